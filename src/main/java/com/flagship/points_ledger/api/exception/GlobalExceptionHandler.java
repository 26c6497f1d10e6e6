package com.flagship.points_ledger.api.exception;

import com.flagship.points_ledger.error.InsufficientBalanceException;
import com.flagship.points_ledger.error.OperationCancelledException;
import com.flagship.points_ledger.error.PointsException;
import com.flagship.points_ledger.error.RewardNotFoundException;
import com.flagship.points_ledger.error.RewardOutOfStockException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 *
 * Business-rule failures map to 422, missing rewards to 404 and transient
 * failures to 503. Contention and store outages carry a Retry-After hint.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String RETRY_AFTER_SECONDS = "1";

    @ExceptionHandler(InsufficientBalanceException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientBalance(InsufficientBalanceException e) {
        log.info("Insufficient balance: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Insufficient Balance")
            .message(e.getMessage())
            .details(Map.of(
                "balance", String.valueOf(e.getBalance()),
                "requested", String.valueOf(e.getRequested())))
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error);
    }

    @ExceptionHandler(RewardOutOfStockException.class)
    public ResponseEntity<ErrorResponse> handleOutOfStock(RewardOutOfStockException e) {
        log.info("Reward out of stock: {}", e.getRewardId());

        ErrorResponse error = ErrorResponse.builder()
            .error("Reward Out Of Stock")
            .message(e.getMessage())
            .details(Map.of("reward_id", e.getRewardId()))
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error);
    }

    @ExceptionHandler(RewardNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleRewardNotFound(RewardNotFoundException e) {
        log.info("Reward not found: {}", e.getRewardId());

        ErrorResponse error = ErrorResponse.builder()
            .error("Reward Not Found")
            .message(e.getMessage())
            .details(Map.of("reward_id", e.getRewardId()))
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(OperationCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(OperationCancelledException e) {
        log.warn("Operation cancelled: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Operation Cancelled")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    /**
     * Remaining failures are classified by kind; RetryExhausted and StoreUnavailable land here.
     */
    @ExceptionHandler(PointsException.class)
    public ResponseEntity<ErrorResponse> handlePointsException(PointsException e) {
        ErrorResponse.ErrorResponseBuilder error = ErrorResponse.builder()
            .message(e.getMessage())
            .timestamp(Instant.now());

        switch (e.getKind()) {
            case TRANSIENT:
                log.warn("Transient failure: {}", e.getMessage());
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                    .body(error.error("Service Unavailable").build());
            case NOT_FOUND:
                log.info("Not found: {}", e.getMessage());
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error.error("Not Found").build());
            default:
                log.info("Business rule violated: {}", e.getMessage());
                return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(error.error("Business Rule Violation").build());
        }
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());

        ErrorResponse error = ErrorResponse.builder()
            .error("Missing Required Header")
            .message("Required header '" + e.getHeaderName() + "' is missing")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ErrorResponse error = ErrorResponse.builder()
            .error("Validation Failed")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid Request")
            .message("Request body is missing or malformed")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid Request")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid State")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}

package com.flagship.points_ledger.api;

import com.flagship.points_ledger.api.dto.RedeemRequest;
import com.flagship.points_ledger.api.dto.RedemptionResponse;
import com.flagship.points_ledger.reward.RedemptionResult;
import com.flagship.points_ledger.reward.RewardService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for reward redemptions.
 *
 * Key features:
 * - Requires Idempotency-Key header, used as the redemption request ID
 * - 201 for a new redemption, 200 with the original record for a replay
 * - Never debits twice for the same key
 */
@RestController
@RequestMapping("/api/users/{userId}/redemptions")
@RequiredArgsConstructor
@Slf4j
public class RedemptionController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final RewardService rewardService;

    @PostMapping
    public ResponseEntity<RedemptionResponse> redeem(
            @PathVariable("userId") String userId,
            @Valid @RequestBody RedeemRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {

        log.info("Received redemption request: userId={}, rewardId={}, idempotencyKey={}",
                userId, request.getRewardId(), idempotencyKey);

        RedemptionResult result = rewardService.redeem(userId, request.getRewardId(), idempotencyKey);
        RedemptionResponse body = RedemptionResponse.from(result.getRecord());

        if (result.isReplayed()) {
            return ResponseEntity.ok(body);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @GetMapping
    public ResponseEntity<List<RedemptionResponse>> listRedemptions(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(rewardService.listRedemptionHistory(userId).stream()
            .map(RedemptionResponse::from)
            .toList());
    }
}

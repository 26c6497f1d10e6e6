package com.flagship.points_ledger.api;

import com.flagship.points_ledger.api.dto.BalanceResponse;
import com.flagship.points_ledger.api.dto.LedgerOperationResponse;
import com.flagship.points_ledger.api.dto.PointSummaryResponse;
import com.flagship.points_ledger.points.PointQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only points endpoints.
 */
@RestController
@RequestMapping("/api/users/{userId}")
@RequiredArgsConstructor
public class PointsController {

    private final PointQueryService pointQueryService;

    /**
     * Current balance; 0 for a user who never earned points.
     */
    @GetMapping("/balance")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(new BalanceResponse(userId, pointQueryService.getBalance(userId)));
    }

    @GetMapping("/points/history")
    public ResponseEntity<List<LedgerOperationResponse>> getHistory(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(pointQueryService.getOperationHistory(userId).stream()
            .map(LedgerOperationResponse::from)
            .toList());
    }

    @GetMapping("/points/summary")
    public ResponseEntity<PointSummaryResponse> getSummary(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(PointSummaryResponse.from(pointQueryService.summarize(userId)));
    }
}

package com.flagship.points_ledger.api;

import com.flagship.points_ledger.api.dto.RewardResponse;
import com.flagship.points_ledger.api.dto.SaveRewardRequest;
import com.flagship.points_ledger.catalog.RewardCatalogService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Catalog administration. Rewards are created or replaced with PUT and are
 * never deleted.
 */
@RestController
@RequestMapping("/api/rewards")
@RequiredArgsConstructor
@Slf4j
public class RewardCatalogController {

    private final RewardCatalogService catalogService;

    @PutMapping("/{rewardId}")
    public ResponseEntity<RewardResponse> saveReward(
            @PathVariable("rewardId") String rewardId,
            @Valid @RequestBody SaveRewardRequest request) {

        log.info("Received reward update: rewardId={}, cost={}", rewardId, request.getCost());

        return ResponseEntity.ok(RewardResponse.from(catalogService.save(
            rewardId, request.getTitle(), request.getDescription(), request.getCost(), request.getStock())));
    }

    @GetMapping("/{rewardId}")
    public ResponseEntity<RewardResponse> getReward(@PathVariable("rewardId") String rewardId) {
        return ResponseEntity.ok(RewardResponse.from(catalogService.get(rewardId)));
    }

    @GetMapping
    public ResponseEntity<List<RewardResponse>> listRewards() {
        return ResponseEntity.ok(catalogService.list().stream()
            .map(RewardResponse::from)
            .toList());
    }
}

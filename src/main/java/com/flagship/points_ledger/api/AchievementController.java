package com.flagship.points_ledger.api;

import com.flagship.points_ledger.achievement.AchievementService;
import com.flagship.points_ledger.api.dto.AchievementCompletionResponse;
import com.flagship.points_ledger.api.dto.AchievementResponse;
import com.flagship.points_ledger.api.dto.CompleteAchievementRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for achievement completions.
 *
 * Completing the same achievement twice is safe: the second call answers
 * ALREADY_COMPLETED and credits nothing.
 */
@RestController
@RequestMapping("/api/users/{userId}/achievements")
@RequiredArgsConstructor
@Slf4j
public class AchievementController {

    private final AchievementService achievementService;

    @PostMapping("/{achievementId}")
    public ResponseEntity<AchievementCompletionResponse> completeAchievement(
            @PathVariable("userId") String userId,
            @PathVariable("achievementId") String achievementId,
            @Valid @RequestBody CompleteAchievementRequest request) {

        log.info("Received achievement completion: userId={}, achievementId={}, points={}",
                userId, achievementId, request.getPoints());

        return ResponseEntity.ok(AchievementCompletionResponse.from(
            achievementService.completeAchievement(
                userId, achievementId, request.getTitle(), request.getPoints())));
    }

    @GetMapping
    public ResponseEntity<List<AchievementResponse>> listAchievements(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(achievementService.listAchievements(userId).stream()
            .map(AchievementResponse::from)
            .toList());
    }

    /**
     * Re-drives the user's PENDING achievements and returns the ones it finished.
     */
    @PostMapping("/reconcile")
    public ResponseEntity<List<AchievementCompletionResponse>> reconcile(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(achievementService.reconcile(userId).stream()
            .map(AchievementCompletionResponse::from)
            .toList());
    }
}

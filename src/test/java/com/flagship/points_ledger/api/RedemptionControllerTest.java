package com.flagship.points_ledger.api;

import com.flagship.points_ledger.error.InsufficientBalanceException;
import com.flagship.points_ledger.error.RewardNotFoundException;
import com.flagship.points_ledger.error.RewardOutOfStockException;
import com.flagship.points_ledger.error.StoreUnavailableException;
import com.flagship.points_ledger.reward.RedemptionRecord;
import com.flagship.points_ledger.reward.RedemptionResult;
import com.flagship.points_ledger.reward.RewardService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Redemption endpoint: Idempotency-Key handling and error mapping.
 */
@WebMvcTest(RedemptionController.class)
class RedemptionControllerTest {

    private static final String BODY = "{\"reward_id\": \"mug\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RewardService rewardService;

    private final RedemptionRecord record =
        new RedemptionRecord("u1", "req-1", "mug", "Coffee mug", 80, 20, Instant.now());

    @Test
    @DisplayName("A new redemption answers 201")
    void newRedemptionIsCreated() throws Exception {
        when(rewardService.redeem("u1", "mug", "req-1")).thenReturn(new RedemptionResult(record, false));

        mockMvc.perform(post("/api/users/u1/redemptions")
                .header("Idempotency-Key", "req-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.request_id").value("req-1"))
            .andExpect(jsonPath("$.points_spent").value(80))
            .andExpect(jsonPath("$.balance_after").value(20));
    }

    @Test
    @DisplayName("A replayed redemption answers 200 with the original record")
    void replayIsOk() throws Exception {
        when(rewardService.redeem("u1", "mug", "req-1")).thenReturn(new RedemptionResult(record, true));

        mockMvc.perform(post("/api/users/u1/redemptions")
                .header("Idempotency-Key", "req-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.reward_title").value("Coffee mug"));
    }

    @Test
    @DisplayName("The Idempotency-Key header is required")
    void missingKeyIsRejected() throws Exception {
        mockMvc.perform(post("/api/users/u1/redemptions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing Required Header"));

        verify(rewardService, never()).redeem(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("Insufficient balance answers 422 with the balance")
    void insufficientBalanceIsUnprocessable() throws Exception {
        when(rewardService.redeem("u1", "mug", "req-1")).thenThrow(new InsufficientBalanceException("u1", 50, 80));

        mockMvc.perform(post("/api/users/u1/redemptions")
                .header("Idempotency-Key", "req-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.details.balance").value("50"))
            .andExpect(jsonPath("$.details.requested").value("80"));
    }

    @Test
    @DisplayName("Out of stock answers 422 and unknown reward 404")
    void catalogFailures() throws Exception {
        when(rewardService.redeem("u1", "mug", "req-1")).thenThrow(new RewardOutOfStockException("mug"));
        when(rewardService.redeem("u1", "mug", "req-2")).thenThrow(new RewardNotFoundException("mug"));

        mockMvc.perform(post("/api/users/u1/redemptions")
                .header("Idempotency-Key", "req-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("Reward Out Of Stock"));

        mockMvc.perform(post("/api/users/u1/redemptions")
                .header("Idempotency-Key", "req-2")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.details.reward_id").value("mug"));
    }

    @Test
    @DisplayName("Store outages answer 503 with Retry-After")
    void storeOutageIsServiceUnavailable() throws Exception {
        when(rewardService.redeem("u1", "mug", "req-1"))
            .thenThrow(new StoreUnavailableException("Store get failed", new RuntimeException("connection refused")));

        mockMvc.perform(post("/api/users/u1/redemptions")
                .header("Idempotency-Key", "req-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
            .andExpect(status().isServiceUnavailable())
            .andExpect(header().string("Retry-After", "1"));
    }

    @Test
    @DisplayName("A blank reward ID fails validation")
    void blankRewardIsRejected() throws Exception {
        mockMvc.perform(post("/api/users/u1/redemptions")
                .header("Idempotency-Key", "req-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reward_id\": \"\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.rewardId").exists());
    }

    @Test
    @DisplayName("History lists the user's redemptions")
    void historyIsListed() throws Exception {
        when(rewardService.listRedemptionHistory("u1")).thenReturn(List.of(record));

        mockMvc.perform(get("/api/users/u1/redemptions"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].reward_id").value("mug"));
    }
}

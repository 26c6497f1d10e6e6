package com.flagship.points_ledger.api;

import com.flagship.points_ledger.catalog.RewardCatalogEntry;
import com.flagship.points_ledger.catalog.RewardCatalogService;
import com.flagship.points_ledger.error.RewardNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RewardCatalogController.class)
class RewardCatalogControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RewardCatalogService catalogService;

    private final RewardCatalogEntry mug =
        new RewardCatalogEntry("mug", "Coffee mug", "Ceramic", 80, null, Instant.now(), Instant.now());

    @Test
    @DisplayName("PUT saves a reward")
    void saveReward() throws Exception {
        when(catalogService.save("mug", "Coffee mug", "Ceramic", 80L, null)).thenReturn(mug);

        mockMvc.perform(put("/api/rewards/mug")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\": \"Coffee mug\", \"description\": \"Ceramic\", \"cost\": 80}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.reward_id").value("mug"))
            .andExpect(jsonPath("$.cost").value(80));
    }

    @Test
    @DisplayName("A reward without a title or with negative stock is rejected")
    void invalidRewardIsRejected() throws Exception {
        mockMvc.perform(put("/api/rewards/mug")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"cost\": 80, \"stock\": -1}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.title").exists())
            .andExpect(jsonPath("$.details.stock").exists());

        verify(catalogService, never()).save(anyString(), anyString(), any(), anyLong(), any());
    }

    @Test
    @DisplayName("GET returns a reward, 404 when unknown, and lists the catalog")
    void readRewards() throws Exception {
        when(catalogService.get("mug")).thenReturn(mug);
        when(catalogService.get("yacht")).thenThrow(new RewardNotFoundException("yacht"));
        when(catalogService.list()).thenReturn(List.of(mug));

        mockMvc.perform(get("/api/rewards/mug"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.title").value("Coffee mug"));

        mockMvc.perform(get("/api/rewards/yacht"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Reward Not Found"));

        mockMvc.perform(get("/api/rewards"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].reward_id").value("mug"));
    }
}

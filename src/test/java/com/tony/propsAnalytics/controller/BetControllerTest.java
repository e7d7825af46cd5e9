package com.tony.propsAnalytics.controller;

import com.tony.propsAnalytics.model.dto.BetPerformance;
import com.tony.propsAnalytics.service.BetTrackerService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BetController.class)
class BetControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BetTrackerService betTrackerService;

    @Test
    @DisplayName("POST /bets sans pick -> 400 sans appel au service")
    void placeBetShouldValidateBody() throws Exception {
        String body = """
                {"playerId": "lebron", "statType": "PTS", "line": 25.5, "stake": 10}
                """;

        mockMvc.perform(post("/api/v1/bets").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(betTrackerService);
    }

    @Test
    @DisplayName("Règlement d'un pari inconnu -> 404")
    void settleUnknownBetShouldReturnNotFound() throws Exception {
        when(betTrackerService.settle(eq(42L), anyDouble(), any())).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/bets/42/settle").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actualStat\": 27.0}"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /performance : bilan des 7 derniers jours")
    void performanceShouldReturnSummary() throws Exception {
        when(betTrackerService.recent(7)).thenReturn(List.of());
        when(betTrackerService.calculatePerformance(List.of()))
                .thenReturn(BetPerformance.builder().totalBets(0).roiPct(0.0).build());

        mockMvc.perform(get("/api/v1/bets/performance"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalBets").value(0))
                .andExpect(jsonPath("$.roiPct").value(0.0));
    }
}

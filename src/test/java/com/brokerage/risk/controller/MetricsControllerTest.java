package com.brokerage.risk.controller;

import com.brokerage.risk.repository.RiskMetricsRepository;
import com.brokerage.risk.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(MetricsController.class)
class MetricsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RiskMetricsRepository riskMetricsRepository;

    @Test
    void getSnapshots_success() throws Exception {
        when(riskMetricsRepository.findSince(isNull(), eq(100))).thenReturn(List.of(
                TestDataFactory.createSnapshot(2_000L), TestDataFactory.createSnapshot(1_000L)));

        mockMvc.perform(get("/api/v1/metrics/snapshots"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].timestamp").value(2000))
                .andExpect(jsonPath("$[0].highRiskClients").value(2));
    }

    @Test
    void getSnapshots_sinceAndLimit() throws Exception {
        when(riskMetricsRepository.findSince(1_500L, 10)).thenReturn(List.of(TestDataFactory.createSnapshot(2_000L)));

        mockMvc.perform(get("/api/v1/metrics/snapshots?since=1500&limit=10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void getLatestSnapshot_found() throws Exception {
        when(riskMetricsRepository.findLatest()).thenReturn(Optional.of(TestDataFactory.createSnapshot(3_000L)));

        mockMvc.perform(get("/api/v1/metrics/snapshots/latest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalTransactions").value(1200));
    }

    @Test
    void getLatestSnapshot_none() throws Exception {
        when(riskMetricsRepository.findLatest()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/metrics/snapshots/latest"))
                .andExpect(status().isNotFound());
    }
}

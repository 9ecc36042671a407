package com.brokerage.risk.controller;

import com.brokerage.risk.exception.TransientStoreException;
import com.brokerage.risk.model.*;
import com.brokerage.risk.service.AlertService;
import com.brokerage.risk.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AlertController.class)
class AlertControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private AlertService alertService;

    @Test
    void getAlerts_success() throws Exception {
        when(alertService.query(any(AlertQuery.class))).thenReturn(List.of(
                TestDataFactory.createAlert("A-1", AlertType.HIGH_CLIENT_EXPOSURE, RiskLevel.CRITICAL, "CLIENT_001")));

        mockMvc.perform(get("/api/v1/alerts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray())
                .andExpect(jsonPath("$[0].alertId").value("A-1"))
                .andExpect(jsonPath("$[0].severity").value("CRITICAL"));
    }

    @Test
    void getAlerts_filtersPassedToQuery() throws Exception {
        when(alertService.query(any(AlertQuery.class))).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/alerts?acknowledged=false&severity=HIGH&alertType=ANOMALY_DETECTED&since=1000&limit=5"))
                .andExpect(status().isOk());

        ArgumentCaptor<AlertQuery> captor = ArgumentCaptor.forClass(AlertQuery.class);
        verify(alertService).query(captor.capture());
        AlertQuery query = captor.getValue();
        assertThat(query.getAcknowledged()).isFalse();
        assertThat(query.getSeverity()).isEqualTo(RiskLevel.HIGH);
        assertThat(query.getAlertType()).isEqualTo(AlertType.ANOMALY_DETECTED);
        assertThat(query.getEntityType()).isNull();
        assertThat(query.getSince()).isEqualTo(1000L);
        assertThat(query.getLimit()).isEqualTo(5);
    }

    @Test
    void getAlerts_invalidSeverity_badRequest() throws Exception {
        mockMvc.perform(get("/api/v1/alerts?severity=SEVERE"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void getAlerts_storeUnavailable_serviceUnavailable() throws Exception {
        when(alertService.query(any(AlertQuery.class))).thenThrow(new TransientStoreException("down", null));

        mockMvc.perform(get("/api/v1/alerts"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Store temporarily unavailable"));
    }

    @Test
    void getAlert_found() throws Exception {
        when(alertService.findById("A-1")).thenReturn(Optional.of(
                TestDataFactory.createAlert("A-1", AlertType.HIGH_SYMBOL_EXPOSURE, RiskLevel.HIGH, "AAPL")));

        mockMvc.perform(get("/api/v1/alerts/A-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entityId").value("AAPL"))
                .andExpect(jsonPath("$.thresholdValue").value(1000000.0));
    }

    @Test
    void getAlert_notFound() throws Exception {
        when(alertService.findById("MISSING")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/alerts/MISSING"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getSummary_success() throws Exception {
        Map<RiskLevel, Long> bySeverity = new EnumMap<>(RiskLevel.class);
        bySeverity.put(RiskLevel.CRITICAL, 2L);
        Map<AlertType, Long> byType = new EnumMap<>(AlertType.class);
        byType.put(AlertType.HIGH_CLIENT_EXPOSURE, 2L);
        when(alertService.summary()).thenReturn(AlertSummary.builder()
                .totalAlerts(5)
                .unacknowledgedAlerts(2)
                .unacknowledgedBySeverity(bySeverity)
                .unacknowledgedByType(byType)
                .build());

        mockMvc.perform(get("/api/v1/alerts/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAlerts").value(5))
                .andExpect(jsonPath("$.unacknowledgedAlerts").value(2))
                .andExpect(jsonPath("$.unacknowledgedBySeverity.CRITICAL").value(2));
    }

    @Test
    void acknowledge_success() throws Exception {
        Alert acked = TestDataFactory.createAlert("A-1", AlertType.HIGH_CLIENT_EXPOSURE, RiskLevel.CRITICAL, "CLIENT_001");
        acked.setAcknowledged(true);
        acked.setAcknowledgedBy("risk-desk");
        when(alertService.acknowledge("A-1", "risk-desk")).thenReturn(Optional.of(acked));

        mockMvc.perform(post("/api/v1/alerts/A-1/acknowledge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("acknowledgedBy", "risk-desk"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.acknowledged").value(true))
                .andExpect(jsonPath("$.acknowledgedBy").value("risk-desk"));
    }

    @Test
    void acknowledge_withoutBody_defaultsToOps() throws Exception {
        Alert acked = TestDataFactory.createAlert("A-1", AlertType.HIGH_CLIENT_EXPOSURE, RiskLevel.CRITICAL, "CLIENT_001");
        when(alertService.acknowledge("A-1", "ops")).thenReturn(Optional.of(acked));

        mockMvc.perform(post("/api/v1/alerts/A-1/acknowledge"))
                .andExpect(status().isOk());

        verify(alertService).acknowledge("A-1", "ops");
    }

    @Test
    void acknowledge_notFound() throws Exception {
        when(alertService.acknowledge(eq("MISSING"), anyString())).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/alerts/MISSING/acknowledge"))
                .andExpect(status().isNotFound());
    }

    @Test
    void acknowledgeAll_success() throws Exception {
        when(alertService.acknowledgeAll(anyList(), eq("ops"))).thenReturn(List.of(
                TestDataFactory.createAlert("A-1", AlertType.HIGH_CLIENT_EXPOSURE, RiskLevel.CRITICAL, "CLIENT_001"),
                TestDataFactory.createAlert("A-2", AlertType.ANOMALY_DETECTED, RiskLevel.HIGH, "AAPL")));

        mockMvc.perform(post("/api/v1/alerts/acknowledge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "alertIds", List.of("A-1", "A-2", "A-3"),
                                "acknowledgedBy", "ops"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.acknowledgedCount").value(2))
                .andExpect(jsonPath("$.requestedCount").value(3));
    }

    @Test
    void acknowledgeAll_badRequest_emptyIds() throws Exception {
        mockMvc.perform(post("/api/v1/alerts/acknowledge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("alertIds", List.of()))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("alertIds is required and must not be empty"));
    }

    @Test
    void acknowledgeAll_missingAcknowledgedBy_defaultsToOps() throws Exception {
        when(alertService.acknowledgeAll(List.of("A-1"), "ops")).thenReturn(List.of());

        mockMvc.perform(post("/api/v1/alerts/acknowledge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"alertIds\":[\"A-1\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requestedCount").value(1));

        verify(alertService).acknowledgeAll(List.of("A-1"), "ops");
    }

    @Test
    void acknowledgeAll_wronglyTypedIds_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/alerts/acknowledge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"alertIds\":[{\"id\":1},{\"id\":2}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));

        verifyNoInteractions(alertService);
    }

    @Test
    void acknowledgeAll_wronglyTypedAcknowledgedBy_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/alerts/acknowledge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"alertIds\":[\"A-1\"],\"acknowledgedBy\":{\"name\":\"ops\"}}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(alertService);
    }
}

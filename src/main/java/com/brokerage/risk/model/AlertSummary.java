package com.brokerage.risk.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Counts over the alert log")
public class AlertSummary {

    @Schema(description = "All alerts in the log", example = "42")
    private long totalAlerts;

    @Schema(description = "Alerts not yet acknowledged", example = "7")
    private long unacknowledgedAlerts;

    @Schema(description = "Unacknowledged alerts per severity")
    private Map<RiskLevel, Long> unacknowledgedBySeverity;

    @Schema(description = "Unacknowledged alerts per alert type")
    private Map<AlertType, Long> unacknowledgedByType;
}

package com.brokerage.risk.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Point-in-time rollup of the engine's aggregate state")
public class RiskMetricsSnapshot {

    @Schema(description = "Snapshot time in epoch milliseconds", example = "1739886765000")
    private long timestamp;

    @Schema(description = "Transactions processed since startup", example = "12840")
    private long totalTransactions;

    @Schema(description = "Sum of all client exposures", example = "48211345.50")
    private double totalExposure;

    @Schema(description = "Clients with non-zero exposure", example = "50")
    private int activeClients;

    @Schema(description = "Symbols with non-zero exposure", example = "20")
    private int activeSymbols;

    @Schema(description = "Clients at HIGH or CRITICAL", example = "3")
    private int highRiskClients;

    @Schema(description = "Symbols at HIGH or CRITICAL", example = "1")
    private int highRiskSymbols;

    @Schema(description = "Alerts generated since startup", example = "17")
    private long alertsGenerated;
}

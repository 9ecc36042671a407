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
@Schema(description = "Runtime status of the detection pipeline")
public class EngineStatus {

    @Schema(description = "Whether the poller is running", example = "true")
    private boolean running;

    @Schema(description = "Last checkpointed feed position")
    private FeedMarker committedMarker;

    @Schema(description = "Transactions processed since startup", example = "12840")
    private long transactionsProcessed;

    @Schema(description = "Records skipped as malformed since startup", example = "2")
    private long transactionsSkipped;

    @Schema(description = "Alerts emitted since startup", example = "17")
    private long alertsGenerated;

    @Schema(description = "Alerts suppressed by the cooldown since startup", example = "93")
    private long alertsSuppressed;

    @Schema(description = "Alerts waiting to be persisted after a store failure", example = "0")
    private int pendingAlerts;

    @Schema(description = "Clients currently tracked", example = "50")
    private int trackedClients;

    @Schema(description = "Symbols currently tracked", example = "20")
    private int trackedSymbols;

    @Schema(description = "Thresholds in effect")
    private RiskThresholds thresholds;
}

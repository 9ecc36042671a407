package com.brokerage.risk.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Running exposure aggregate for one client or one symbol. Instances handed out
 * by the aggregator are copies; the live aggregate never leaves it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Cumulative exposure of a client or symbol")
public class Exposure {

    @Schema(description = "CLIENT or SYMBOL", example = "CLIENT")
    private EntityType entityType;

    @Schema(description = "Client id or symbol", example = "CLIENT_001")
    private String entityId;

    @Schema(description = "Sum of processed transaction values", example = "845000.00")
    @Builder.Default
    private double totalExposure = 0.0;

    @Schema(description = "Processed transactions (positions for clients, trades for symbols)", example = "37")
    @Builder.Default
    private long positionCount = 0;

    @Schema(description = "Risk level derived from exposure / threshold", example = "HIGH")
    @Builder.Default
    private RiskLevel riskLevel = RiskLevel.LOW;

    @Schema(description = "Last update time in epoch milliseconds", example = "1739886764000")
    private long lastUpdated;

    @Schema(description = "Timestamp of the last applied transaction (processed high-watermark)")
    private long lastTransactionTimestamp;

    @Schema(description = "Id of the last applied transaction (processed high-watermark)")
    private long lastTransactionId;

    public FeedMarker watermark() {
        return new FeedMarker(lastTransactionTimestamp, lastTransactionId);
    }
}

package com.brokerage.risk.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A risk alert raised by the detection engine")
public class Alert {

    @Schema(description = "Alert id, derived from the natural key (type, entity, triggering transaction)",
            example = "4f0e3c1a-7d2b-3c55-9a51-0a3f5c1d2e77")
    private String alertId;

    @Schema(description = "Detection time in epoch milliseconds", example = "1739886765120")
    private long timestamp;

    @Schema(description = "Timestamp of the triggering transaction in epoch milliseconds", example = "1739886764000")
    private long eventTimestamp;

    @Schema(description = "Alert family", example = "HIGH_CLIENT_EXPOSURE")
    private AlertType alertType;

    @Schema(description = "Severity", example = "CRITICAL")
    private RiskLevel severity;

    @Schema(description = "Kind of entity the alert is about", example = "CLIENT")
    private EntityType entityType;

    @Schema(description = "Client id, symbol, or engine component for SYSTEM alerts", example = "CLIENT_001")
    private String entityId;

    @Schema(description = "Human-readable description",
            example = "Client CLIENT_001 exposure $1,200,000.00 reached CRITICAL (120.0% of threshold $1,000,000.00)")
    private String message;

    @Schema(description = "Threshold that was breached", example = "1000000.0")
    private double thresholdValue;

    @Schema(description = "Observed value", example = "1200000.0")
    private double currentValue;

    @Schema(description = "Id of the transaction that triggered the alert", example = "42017")
    private long transactionId;

    @Schema(description = "True when emitted inside the cooldown because severity increased", example = "false")
    private boolean escalation;

    @Schema(description = "Whether an operator acknowledged the alert", example = "false")
    private boolean acknowledged;

    @Schema(description = "Acknowledgement time in epoch milliseconds (0 if not acknowledged)")
    private long acknowledgedAt;

    @Schema(description = "Operator who acknowledged the alert", example = "risk-desk")
    private String acknowledgedBy;

    public String dedupKey() {
        return alertType + ":" + entityId;
    }

    /**
     * Deterministic id for an alert's natural key, so re-processing the same
     * transaction yields the same id and the store can insert it idempotently.
     */
    public static String naturalId(AlertType alertType, EntityType entityType, String entityId, long transactionId) {
        String naturalKey = alertType + "|" + entityType + "|" + entityId + "|" + transactionId;
        return UUID.nameUUIDFromBytes(naturalKey.getBytes(StandardCharsets.UTF_8)).toString();
    }

    public static Alert fromRuleResult(RuleResult result, Transaction txn, long detectedAt) {
        return Alert.builder()
                .alertId(naturalId(result.getAlertType(), result.getEntityType(),
                        result.getEntityId(), txn.getTransactionId()))
                .timestamp(detectedAt)
                .eventTimestamp(txn.getTimestamp())
                .alertType(result.getAlertType())
                .severity(result.getSeverity())
                .entityType(result.getEntityType())
                .entityId(result.getEntityId())
                .message(result.getReason())
                .thresholdValue(result.getThresholdValue())
                .currentValue(result.getCurrentValue())
                .transactionId(txn.getTransactionId())
                .build();
    }
}

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
@Schema(description = "Outcome of one rule family for one transaction")
public class RuleResult {

    public static final String SYSTEM_ENTITY_ID = "RISK_ENGINE";

    @Schema(description = "Rule family", example = "HIGH_TRANSACTION_VELOCITY")
    private AlertType alertType;

    @Schema(description = "Whether the rule's trigger condition holds", example = "true")
    private boolean triggered;

    @Schema(description = "Severity of the breach (null when not triggered)", example = "MEDIUM")
    private RiskLevel severity;

    @Schema(description = "Entity kind the result refers to", example = "CLIENT")
    private EntityType entityType;

    @Schema(description = "Entity id the result refers to", example = "CLIENT_001")
    private String entityId;

    @Schema(description = "Threshold used by the rule", example = "10.0")
    private double thresholdValue;

    @Schema(description = "Observed value", example = "12.0")
    private double currentValue;

    @Schema(description = "Human-readable explanation",
            example = "Client CLIENT_001 has 12 transactions in last 60s (threshold: 10)")
    private String reason;

    public static RuleResult notTriggered(AlertType alertType, String reason) {
        return RuleResult.builder()
                .alertType(alertType)
                .triggered(false)
                .reason(reason)
                .build();
    }

    /**
     * A rule that could not be evaluated is reported as a triggered SYSTEM result
     * so the failure surfaces as an alert instead of disappearing.
     */
    public static RuleResult evaluationFailure(AlertType alertType, Transaction txn, Exception e) {
        return RuleResult.builder()
                .alertType(alertType)
                .triggered(true)
                .severity(RiskLevel.HIGH)
                .entityType(EntityType.SYSTEM)
                .entityId(SYSTEM_ENTITY_ID)
                .reason(String.format("%s evaluation failed for transaction %d (client=%s, symbol=%s): %s",
                        alertType, txn.getTransactionId(), txn.getClientId(), txn.getSymbol(), e.getMessage()))
                .build();
    }
}

package com.brokerage.risk.engine.evaluators;

import com.brokerage.risk.engine.EvaluationContext;
import com.brokerage.risk.engine.RuleEvaluator;
import com.brokerage.risk.model.AlertType;
import com.brokerage.risk.model.EntityType;
import com.brokerage.risk.model.RiskLevel;
import com.brokerage.risk.model.RiskThresholds;
import com.brokerage.risk.model.RuleResult;
import com.brokerage.risk.model.Transaction;
import org.springframework.stereotype.Component;

/**
 * Flags a client sending more transactions than the velocity threshold within
 * the trailing window.
 *
 * Severity: MEDIUM up to twice the threshold, HIGH beyond. With threshold 10,
 * the 11th transaction in 60s is MEDIUM and the 21st is HIGH.
 */
@Component
public class TransactionVelocityEvaluator implements RuleEvaluator {

    private final RiskThresholds thresholds;

    public TransactionVelocityEvaluator(RiskThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public AlertType getSupportedAlertType() {
        return AlertType.HIGH_TRANSACTION_VELOCITY;
    }

    @Override
    public RuleResult evaluate(Transaction txn, EvaluationContext context) {
        Integer count = context.getVelocityCount();
        if (count == null) {
            return RuleResult.notTriggered(getSupportedAlertType(), "Velocity not recorded for this transaction");
        }

        int threshold = thresholds.getVelocityThreshold();
        if (count <= threshold) {
            return RuleResult.notTriggered(getSupportedAlertType(),
                    String.format("Client %s has %d transactions in last %ds", txn.getClientId(), count,
                            thresholds.getVelocityWindowSeconds()));
        }

        RiskLevel severity = count <= 2 * threshold ? RiskLevel.MEDIUM : RiskLevel.HIGH;
        String reason = String.format("Client %s has %d transactions in last %ds (threshold: %d)",
                txn.getClientId(), count, thresholds.getVelocityWindowSeconds(), threshold);

        return RuleResult.builder()
                .alertType(getSupportedAlertType())
                .triggered(true)
                .severity(severity)
                .entityType(EntityType.CLIENT)
                .entityId(txn.getClientId())
                .thresholdValue(threshold)
                .currentValue(count)
                .reason(reason)
                .build();
    }
}

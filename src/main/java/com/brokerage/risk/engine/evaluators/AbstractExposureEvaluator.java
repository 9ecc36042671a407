package com.brokerage.risk.engine.evaluators;

import com.brokerage.risk.engine.EvaluationContext;
import com.brokerage.risk.engine.RuleEvaluator;
import com.brokerage.risk.model.AlertType;
import com.brokerage.risk.model.EntityType;
import com.brokerage.risk.model.Exposure;
import com.brokerage.risk.model.ExposureUpdate;
import com.brokerage.risk.model.RiskThresholds;
import com.brokerage.risk.model.RuleResult;
import com.brokerage.risk.model.Transaction;

/**
 * Exposure rule shared by clients and symbols. Triggers only when the
 * transaction moved the aggregate into HIGH or CRITICAL from a lower level;
 * severity is the aggregate's new risk level.
 */
abstract class AbstractExposureEvaluator implements RuleEvaluator {

    private final RiskThresholds thresholds;
    private final EntityType entityType;
    private final String entityLabel;

    AbstractExposureEvaluator(RiskThresholds thresholds, EntityType entityType, String entityLabel) {
        this.thresholds = thresholds;
        this.entityType = entityType;
        this.entityLabel = entityLabel;
    }

    protected abstract ExposureUpdate selectUpdate(EvaluationContext context);

    @Override
    public RuleResult evaluate(Transaction txn, EvaluationContext context) {
        AlertType alertType = getSupportedAlertType();
        ExposureUpdate update = selectUpdate(context);
        if (update == null || !update.applied()) {
            return RuleResult.notTriggered(alertType, entityLabel + " exposure not updated by this transaction");
        }

        Exposure exposure = update.exposure();
        double threshold = thresholds.exposureThresholdFor(entityType);
        if (!update.crossedIntoHighRisk()) {
            return RuleResult.notTriggered(alertType, String.format(
                    "%s %s exposure $%,.2f at %s (no escalation from %s)",
                    entityLabel, exposure.getEntityId(), exposure.getTotalExposure(),
                    exposure.getRiskLevel(), update.previousLevel()));
        }

        String reason = String.format(
                "%s %s exposure $%,.2f reached %s (%.1f%% of threshold $%,.2f)",
                entityLabel, exposure.getEntityId(), exposure.getTotalExposure(),
                exposure.getRiskLevel(), exposure.getTotalExposure() / threshold * 100.0, threshold);

        return RuleResult.builder()
                .alertType(alertType)
                .triggered(true)
                .severity(exposure.getRiskLevel())
                .entityType(entityType)
                .entityId(exposure.getEntityId())
                .thresholdValue(threshold)
                .currentValue(exposure.getTotalExposure())
                .reason(reason)
                .build();
    }
}

package com.brokerage.risk.engine.evaluators;

import com.brokerage.risk.engine.EvaluationContext;
import com.brokerage.risk.engine.RuleEvaluator;
import com.brokerage.risk.model.AlertType;
import com.brokerage.risk.model.AnomalyScore;
import com.brokerage.risk.model.EntityType;
import com.brokerage.risk.model.RiskLevel;
import com.brokerage.risk.model.RiskThresholds;
import com.brokerage.risk.model.RuleResult;
import com.brokerage.risk.model.Transaction;
import org.springframework.stereotype.Component;

/**
 * Flags a transaction whose value lies more than k standard deviations from
 * the recent mean of its symbol.
 *
 * Severity: HIGH below 5σ, CRITICAL from 5σ. The reported threshold is the
 * breached bound, mean + kσ above the mean or mean - kσ below it.
 */
@Component
public class AnomalyEvaluator implements RuleEvaluator {

    static final double CRITICAL_SCORE = 5.0;

    private final RiskThresholds thresholds;

    public AnomalyEvaluator(RiskThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public AlertType getSupportedAlertType() {
        return AlertType.ANOMALY_DETECTED;
    }

    @Override
    public RuleResult evaluate(Transaction txn, EvaluationContext context) {
        AnomalyScore score = context.getAnomalyScore();
        if (score == null) {
            return RuleResult.notTriggered(getSupportedAlertType(), "Value not scored for this transaction");
        }
        if (!score.sufficientData()) {
            return RuleResult.notTriggered(getSupportedAlertType(), score.stdDev() == 0.0 && score.sampleSize() > 1
                    ? String.format("Symbol %s has zero variance over %d values", score.symbol(), score.sampleSize())
                    : String.format("Insufficient data for %s (%d prior values)", score.symbol(), score.sampleSize()));
        }

        double k = thresholds.getAnomalyStddevThreshold();
        if (score.absoluteScore() <= k) {
            return RuleResult.notTriggered(getSupportedAlertType(),
                    String.format("Value $%,.2f within %.1fσ of mean for %s (z-score: %.2f)",
                            score.value(), k, score.symbol(), score.score()));
        }

        RiskLevel severity = score.absoluteScore() < CRITICAL_SCORE ? RiskLevel.HIGH : RiskLevel.CRITICAL;
        double bound = score.score() > 0
                ? score.mean() + k * score.stdDev()
                : score.mean() - k * score.stdDev();
        String reason = String.format(
                "Anomalous %s transaction value $%,.2f detected (z-score: %.2f, mean: $%,.2f, std: $%,.2f)",
                score.symbol(), score.value(), score.score(), score.mean(), score.stdDev());

        return RuleResult.builder()
                .alertType(getSupportedAlertType())
                .triggered(true)
                .severity(severity)
                .entityType(EntityType.SYMBOL)
                .entityId(txn.getSymbol())
                .thresholdValue(bound)
                .currentValue(score.value())
                .reason(reason)
                .build();
    }
}

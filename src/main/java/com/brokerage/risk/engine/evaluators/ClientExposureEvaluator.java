package com.brokerage.risk.engine.evaluators;

import com.brokerage.risk.engine.EvaluationContext;
import com.brokerage.risk.model.AlertType;
import com.brokerage.risk.model.EntityType;
import com.brokerage.risk.model.ExposureUpdate;
import com.brokerage.risk.model.RiskThresholds;
import org.springframework.stereotype.Component;

/**
 * Flags a client whose cumulative exposure crosses into HIGH (80% of the
 * client threshold) or CRITICAL (100%).
 *
 * Example: threshold $1,000,000. A client at $700,000 (MEDIUM) buys $150,000
 * and lands at $850,000, so a HIGH alert fires. Another $50,000 keeps it in
 * HIGH and fires nothing. Reaching $1,000,000 fires a CRITICAL alert.
 */
@Component
public class ClientExposureEvaluator extends AbstractExposureEvaluator {

    public ClientExposureEvaluator(RiskThresholds thresholds) {
        super(thresholds, EntityType.CLIENT, "Client");
    }

    @Override
    public AlertType getSupportedAlertType() {
        return AlertType.HIGH_CLIENT_EXPOSURE;
    }

    @Override
    protected ExposureUpdate selectUpdate(EvaluationContext context) {
        return context.getClientExposure();
    }
}

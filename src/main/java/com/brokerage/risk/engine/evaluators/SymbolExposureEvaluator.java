package com.brokerage.risk.engine.evaluators;

import com.brokerage.risk.engine.EvaluationContext;
import com.brokerage.risk.model.AlertType;
import com.brokerage.risk.model.EntityType;
import com.brokerage.risk.model.ExposureUpdate;
import com.brokerage.risk.model.RiskThresholds;
import org.springframework.stereotype.Component;

/**
 * Flags a symbol whose cumulative exposure across all clients crosses into
 * HIGH or CRITICAL against the symbol threshold.
 */
@Component
public class SymbolExposureEvaluator extends AbstractExposureEvaluator {

    public SymbolExposureEvaluator(RiskThresholds thresholds) {
        super(thresholds, EntityType.SYMBOL, "Symbol");
    }

    @Override
    public AlertType getSupportedAlertType() {
        return AlertType.HIGH_SYMBOL_EXPOSURE;
    }

    @Override
    protected ExposureUpdate selectUpdate(EvaluationContext context) {
        return context.getSymbolExposure();
    }
}

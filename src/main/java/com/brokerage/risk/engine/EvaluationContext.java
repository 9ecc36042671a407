package com.brokerage.risk.engine;

import com.brokerage.risk.model.AlertType;
import com.brokerage.risk.model.AnomalyScore;
import com.brokerage.risk.model.ExposureUpdate;
import lombok.Builder;
import lombok.Data;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-transaction state produced by the aggregation phases and consumed by the
 * rule evaluators. A null field means that input was not produced for this
 * transaction (replayed, or its phase failed).
 */
@Data
@Builder
public class EvaluationContext {

    // Client aggregate after this transaction was applied
    private ExposureUpdate clientExposure;

    // Symbol aggregate after this transaction was applied
    private ExposureUpdate symbolExposure;

    // Client's transaction count in the velocity window, this one included
    private Integer velocityCount;

    // Standardized deviation of the value against the symbol's prior window
    private AnomalyScore anomalyScore;

    // Aggregation failures keyed by the rule family that lost its input
    @Builder.Default
    private Map<AlertType, Exception> failures = new EnumMap<>(AlertType.class);

    public void recordFailure(AlertType alertType, Exception e) {
        failures.put(alertType, e);
    }

    /**
     * True when the transaction was already applied to both aggregates in an
     * earlier delivery, so there is nothing new to evaluate.
     */
    public boolean isReplay() {
        return failures.isEmpty()
                && clientExposure != null && !clientExposure.applied()
                && symbolExposure != null && !symbolExposure.applied();
    }
}

package com.brokerage.risk.model;

/**
 * Result of applying one transaction to one aggregate. {@code applied} is false
 * when the transaction was at or below the aggregate's watermark and was ignored.
 */
public record ExposureUpdate(Exposure exposure, RiskLevel previousLevel, boolean applied) {

    public static ExposureUpdate ignored(Exposure current) {
        return new ExposureUpdate(current, current.getRiskLevel(), false);
    }

    public boolean crossedIntoHighRisk() {
        RiskLevel current = exposure.getRiskLevel();
        return applied && current.isHighRisk() && current.isMoreSevereThan(previousLevel);
    }
}

package com.brokerage.risk.model;

/**
 * Ordinal risk classification. Also used as alert severity, so declaration
 * order is significant: later constants are strictly more severe.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static final double DEFAULT_MEDIUM_RATIO = 0.5;
    public static final double DEFAULT_HIGH_RATIO = 0.8;
    public static final double DEFAULT_CRITICAL_RATIO = 1.0;

    /**
     * Classify an exposure-to-threshold ratio using the given band boundaries.
     * Each boundary is inclusive on its lower edge.
     */
    public static RiskLevel fromRatio(double ratio, double mediumRatio, double highRatio, double criticalRatio) {
        if (ratio >= criticalRatio) return CRITICAL;
        if (ratio >= highRatio) return HIGH;
        if (ratio >= mediumRatio) return MEDIUM;
        return LOW;
    }

    public static RiskLevel fromRatio(double ratio) {
        return fromRatio(ratio, DEFAULT_MEDIUM_RATIO, DEFAULT_HIGH_RATIO, DEFAULT_CRITICAL_RATIO);
    }

    public boolean isHighRisk() {
        return this == HIGH || this == CRITICAL;
    }

    public boolean isMoreSevereThan(RiskLevel other) {
        return other == null || this.ordinal() > other.ordinal();
    }
}

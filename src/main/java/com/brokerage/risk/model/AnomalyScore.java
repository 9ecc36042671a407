package com.brokerage.risk.model;

/**
 * Standardized deviation of one value against the prior window of its symbol.
 * When {@code sufficientData} is false the statistics are informational only
 * and {@code score} is zero.
 */
public record AnomalyScore(String symbol, double value, double mean, double stdDev,
                           long sampleSize, double score, boolean sufficientData) {

    public static AnomalyScore insufficient(String symbol, double value, double mean,
                                            double stdDev, long sampleSize) {
        return new AnomalyScore(symbol, value, mean, stdDev, sampleSize, 0.0, false);
    }

    public double absoluteScore() {
        return Math.abs(score);
    }
}

package com.brokerage.risk.service;

import com.brokerage.risk.engine.stats.RollingStatistics;
import com.brokerage.risk.model.AnomalyScore;
import com.brokerage.risk.model.RiskThresholds;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scores each transaction value against the recent values of its symbol.
 * The value is scored against the window as it was before the value arrived,
 * then always added to the window.
 */
@Service
public class AnomalyDetector {

    private final int windowSize;
    private final int minSamples;
    private final Map<String, RollingStatistics> windows = new ConcurrentHashMap<>();

    public AnomalyDetector(RiskThresholds thresholds) {
        this.windowSize = thresholds.getAnomalyWindowSize();
        this.minSamples = thresholds.getAnomalyMinSamples();
    }

    public AnomalyScore score(String symbol, double value) {
        RollingStatistics stats = windows.computeIfAbsent(symbol, s -> new RollingStatistics(windowSize));
        synchronized (stats) {
            int sampleSize = stats.size();
            double mean = stats.mean();
            double stdDev = stats.stdDev();

            AnomalyScore result;
            if (sampleSize < minSamples || stdDev == 0.0) {
                result = AnomalyScore.insufficient(symbol, value, mean, stdDev, sampleSize);
            } else {
                result = new AnomalyScore(symbol, value, mean, stdDev, sampleSize,
                        (value - mean) / stdDev, true);
            }

            stats.add(value);
            return result;
        }
    }

    public int minSamples() {
        return minSamples;
    }

    public int trackedSymbols() {
        return windows.size();
    }
}

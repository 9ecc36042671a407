package com.brokerage.risk.model;

import com.brokerage.risk.exception.RiskConfigurationException;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed, immutable threshold set. Loaded once at startup and injected into the
 * aggregator, trackers, evaluators and deduplicator.
 */
@Value
@Builder(toBuilder = true)
@Schema(description = "Detection thresholds in effect")
public class RiskThresholds {

    @Schema(description = "Client exposure threshold", example = "1000000.0")
    double clientExposureThreshold;

    @Schema(description = "Symbol exposure threshold", example = "500000.0")
    double symbolExposureThreshold;

    @Schema(description = "Max transactions per client inside the velocity window", example = "10")
    int velocityThreshold;

    @Schema(description = "Velocity window length in seconds", example = "60")
    long velocityWindowSeconds;

    @Schema(description = "Anomaly threshold in standard deviations", example = "3.0")
    double anomalyStddevThreshold;

    @Schema(description = "Values kept per symbol for anomaly statistics", example = "100")
    int anomalyWindowSize;

    @Schema(description = "Prior observations required before scoring", example = "5")
    int anomalyMinSamples;

    @Schema(description = "Lower edge of MEDIUM as a fraction of the threshold", example = "0.5")
    double mediumRatio;

    @Schema(description = "Lower edge of HIGH as a fraction of the threshold", example = "0.8")
    double highRatio;

    @Schema(description = "Lower edge of CRITICAL as a fraction of the threshold", example = "1.0")
    double criticalRatio;

    @Schema(description = "Suppression window for repeated alerts of the same key", type = "string", example = "PT5M")
    Duration alertCooldown;

    public double exposureThresholdFor(EntityType entityType) {
        switch (entityType) {
            case CLIENT:
                return clientExposureThreshold;
            case SYMBOL:
                return symbolExposureThreshold;
            default:
                throw new IllegalArgumentException("No exposure threshold for entity type " + entityType);
        }
    }

    public RiskLevel classify(EntityType entityType, double totalExposure) {
        double ratio = totalExposure / exposureThresholdFor(entityType);
        return RiskLevel.fromRatio(ratio, mediumRatio, highRatio, criticalRatio);
    }

    /**
     * @throws RiskConfigurationException listing every invalid value
     */
    public RiskThresholds validate() {
        List<String> problems = new ArrayList<>();
        if (!(clientExposureThreshold > 0)) {
            problems.add("client exposure threshold must be > 0 (was " + clientExposureThreshold + ")");
        }
        if (!(symbolExposureThreshold > 0)) {
            problems.add("symbol exposure threshold must be > 0 (was " + symbolExposureThreshold + ")");
        }
        if (velocityThreshold <= 0) {
            problems.add("velocity threshold must be > 0 (was " + velocityThreshold + ")");
        }
        if (velocityWindowSeconds <= 0) {
            problems.add("velocity window seconds must be > 0 (was " + velocityWindowSeconds + ")");
        }
        if (!(anomalyStddevThreshold > 0)) {
            problems.add("anomaly stddev threshold must be > 0 (was " + anomalyStddevThreshold + ")");
        }
        if (anomalyWindowSize < 2) {
            problems.add("anomaly window size must be >= 2 (was " + anomalyWindowSize + ")");
        }
        if (anomalyMinSamples < 2 || anomalyMinSamples > anomalyWindowSize) {
            problems.add("anomaly min samples must be between 2 and the window size (was "
                    + anomalyMinSamples + ")");
        }
        if (!(mediumRatio > 0 && mediumRatio < highRatio && highRatio < criticalRatio)) {
            problems.add(String.format("risk bands must satisfy 0 < medium < high < critical (was %s/%s/%s)",
                    mediumRatio, highRatio, criticalRatio));
        }
        if (alertCooldown == null || alertCooldown.isNegative()) {
            problems.add("alert cooldown must be a non-negative duration (was " + alertCooldown + ")");
        }
        if (!problems.isEmpty()) {
            throw new RiskConfigurationException("Invalid risk thresholds: " + String.join("; ", problems));
        }
        return this;
    }
}

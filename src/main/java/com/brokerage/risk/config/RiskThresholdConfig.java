package com.brokerage.risk.config;

import com.brokerage.risk.model.RiskLevel;
import com.brokerage.risk.model.RiskThresholds;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "risk")
public class RiskThresholdConfig {

    // Exposure (sum of transaction values) at which a client is CRITICAL
    private double clientExposureThreshold = 1_000_000.0;

    // Exposure at which a symbol is CRITICAL
    private double symbolExposureThreshold = 500_000.0;

    // Transactions per client inside the velocity window before alerting
    private int velocityThreshold = 10;

    // Standard deviations from the symbol's rolling mean before alerting
    private double anomalyStddevThreshold = 3.0;

    private RiskBands riskBands = new RiskBands();

    private Pipeline pipeline = new Pipeline();

    private Velocity velocity = new Velocity();

    private Anomaly anomaly = new Anomaly();

    private Alerts alerts = new Alerts();

    private Snapshot snapshot = new Snapshot();

    /**
     * Defaults used when the store holds no thresholds record.
     */
    public RiskThresholds toThresholds() {
        return RiskThresholds.builder()
                .clientExposureThreshold(clientExposureThreshold)
                .symbolExposureThreshold(symbolExposureThreshold)
                .velocityThreshold(velocityThreshold)
                .velocityWindowSeconds(velocity.getWindowSeconds())
                .anomalyStddevThreshold(anomalyStddevThreshold)
                .anomalyWindowSize(anomaly.getWindowSize())
                .anomalyMinSamples(anomaly.getMinSamples())
                .mediumRatio(riskBands.getMediumRatio())
                .highRatio(riskBands.getHighRatio())
                .criticalRatio(riskBands.getCriticalRatio())
                .alertCooldown(alerts.getCooldown())
                .build();
    }

    @Data
    public static class RiskBands {
        // Lower edges of each band as a fraction of the entity's threshold
        private double mediumRatio = RiskLevel.DEFAULT_MEDIUM_RATIO;
        private double highRatio = RiskLevel.DEFAULT_HIGH_RATIO;
        private double criticalRatio = RiskLevel.DEFAULT_CRITICAL_RATIO;
    }

    @Data
    public static class Pipeline {
        private boolean enabled = true;
        private long pollIntervalMs = 5000;
        private int batchSize = 500;
        private int workerThreads = 4;
        private int shutdownTimeoutSeconds = 30;
        // Feed read retry: attempts include the first call
        private int retryMaxAttempts = 4;
        private long retryBaseDelayMs = 500;
        // Log engine statistics every N polling cycles
        private int statsLogEveryCycles = 10;
    }

    @Data
    public static class Velocity {
        private long windowSeconds = 60;
    }

    @Data
    public static class Anomaly {
        // Count-bounded ring of recent values per symbol
        private int windowSize = 100;
        private int minSamples = 5;
    }

    @Data
    public static class Alerts {
        private Duration cooldown = Duration.ofMinutes(5);
    }

    @Data
    public static class Snapshot {
        private boolean enabled = true;
        private long intervalSeconds = 50;
    }
}

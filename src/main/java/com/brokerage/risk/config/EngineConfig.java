package com.brokerage.risk.config;

import com.brokerage.risk.exception.RiskConfigurationException;
import com.brokerage.risk.exception.TransientStoreException;
import com.brokerage.risk.model.RiskThresholds;
import com.brokerage.risk.repository.EngineStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Thresholds are read once at startup: the stored record (if any) overrides
     * the configured defaults. Invalid values fail the context.
     */
    @Bean
    public RiskThresholds riskThresholds(RiskThresholdConfig config, EngineStateRepository engineStateRepository) {
        RiskThresholds defaults = config.toThresholds();
        RiskThresholds effective;
        try {
            effective = engineStateRepository.loadThresholds(defaults).orElseGet(() -> {
                log.info("No stored thresholds record, using configured defaults");
                return defaults;
            });
        } catch (TransientStoreException e) {
            throw new RiskConfigurationException("Unable to read thresholds from the store: " + e.getMessage(), e);
        }
        effective.validate();
        log.info("Risk thresholds: client={}, symbol={}, velocity={} per {}s, anomaly={}σ (window={}, minSamples={}), " +
                        "bands={}/{}/{}, cooldown={}",
                effective.getClientExposureThreshold(), effective.getSymbolExposureThreshold(),
                effective.getVelocityThreshold(), effective.getVelocityWindowSeconds(),
                effective.getAnomalyStddevThreshold(), effective.getAnomalyWindowSize(),
                effective.getAnomalyMinSamples(), effective.getMediumRatio(), effective.getHighRatio(),
                effective.getCriticalRatio(), effective.getAlertCooldown());
        return effective;
    }
}

package com.brokerage.risk.model;

import com.brokerage.risk.exception.RiskConfigurationException;
import com.brokerage.risk.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RiskThresholdsTest {

    @Test
    void defaults_areValid() {
        RiskThresholds thresholds = TestDataFactory.defaultThresholds();

        assertThat(thresholds.validate()).isSameAs(thresholds);
        assertThat(thresholds.getClientExposureThreshold()).isEqualTo(1_000_000.0);
        assertThat(thresholds.getSymbolExposureThreshold()).isEqualTo(500_000.0);
        assertThat(thresholds.getVelocityThreshold()).isEqualTo(10);
        assertThat(thresholds.getVelocityWindowSeconds()).isEqualTo(60);
        assertThat(thresholds.getAnomalyStddevThreshold()).isEqualTo(3.0);
        assertThat(thresholds.getAlertCooldown()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void classify_usesThresholdOfEntityType() {
        RiskThresholds thresholds = TestDataFactory.defaultThresholds();

        // $450K is MEDIUM for a client ($1M) but HIGH for a symbol ($500K)
        assertThat(thresholds.classify(EntityType.CLIENT, 450_000)).isEqualTo(RiskLevel.LOW);
        assertThat(thresholds.classify(EntityType.CLIENT, 500_000)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(thresholds.classify(EntityType.SYMBOL, 450_000)).isEqualTo(RiskLevel.HIGH);
        assertThat(thresholds.classify(EntityType.SYMBOL, 500_000)).isEqualTo(RiskLevel.CRITICAL);
    }

    @Test
    void exposureThresholdFor_system_throws() {
        assertThatThrownBy(() -> TestDataFactory.defaultThresholds().exposureThresholdFor(EntityType.SYSTEM))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void validate_nonPositiveThreshold_rejected() {
        RiskThresholds thresholds = TestDataFactory.defaultThresholds().toBuilder()
                .clientExposureThreshold(0)
                .build();

        assertThatThrownBy(thresholds::validate)
                .isInstanceOf(RiskConfigurationException.class)
                .hasMessageContaining("client exposure threshold");
    }

    @Test
    void validate_reportsEveryProblem() {
        RiskThresholds thresholds = TestDataFactory.defaultThresholds().toBuilder()
                .velocityThreshold(-1)
                .anomalyStddevThreshold(Double.NaN)
                .mediumRatio(0.9)
                .alertCooldown(Duration.ofSeconds(-1))
                .build();

        assertThatThrownBy(thresholds::validate)
                .isInstanceOf(RiskConfigurationException.class)
                .hasMessageContaining("velocity threshold")
                .hasMessageContaining("anomaly stddev threshold")
                .hasMessageContaining("risk bands")
                .hasMessageContaining("alert cooldown");
    }

    @Test
    void validate_minSamplesLargerThanWindow_rejected() {
        RiskThresholds thresholds = TestDataFactory.defaultThresholds().toBuilder()
                .anomalyWindowSize(10)
                .anomalyMinSamples(11)
                .build();

        assertThatThrownBy(thresholds::validate)
                .isInstanceOf(RiskConfigurationException.class)
                .hasMessageContaining("min samples");
    }
}

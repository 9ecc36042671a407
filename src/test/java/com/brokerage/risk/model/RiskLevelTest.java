package com.brokerage.risk.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RiskLevelTest {

    @Test
    void fromRatio_belowHalf_isLow() {
        assertThat(RiskLevel.fromRatio(0.0)).isEqualTo(RiskLevel.LOW);
        assertThat(RiskLevel.fromRatio(0.4999)).isEqualTo(RiskLevel.LOW);
    }

    @Test
    void fromRatio_bandEdgesAreInclusive() {
        assertThat(RiskLevel.fromRatio(0.5)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(RiskLevel.fromRatio(0.8)).isEqualTo(RiskLevel.HIGH);
        assertThat(RiskLevel.fromRatio(1.0)).isEqualTo(RiskLevel.CRITICAL);
    }

    @Test
    void fromRatio_aboveThreshold_staysCritical() {
        assertThat(RiskLevel.fromRatio(1.2)).isEqualTo(RiskLevel.CRITICAL);
        assertThat(RiskLevel.fromRatio(25.0)).isEqualTo(RiskLevel.CRITICAL);
    }

    @Test
    void fromRatio_customBands() {
        assertThat(RiskLevel.fromRatio(0.65, 0.6, 0.9, 1.2)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(RiskLevel.fromRatio(1.0, 0.6, 0.9, 1.2)).isEqualTo(RiskLevel.HIGH);
        assertThat(RiskLevel.fromRatio(1.2, 0.6, 0.9, 1.2)).isEqualTo(RiskLevel.CRITICAL);
    }

    @Test
    void isHighRisk_onlyHighAndCritical() {
        assertThat(RiskLevel.LOW.isHighRisk()).isFalse();
        assertThat(RiskLevel.MEDIUM.isHighRisk()).isFalse();
        assertThat(RiskLevel.HIGH.isHighRisk()).isTrue();
        assertThat(RiskLevel.CRITICAL.isHighRisk()).isTrue();
    }

    @Test
    void isMoreSevereThan_isStrict() {
        assertThat(RiskLevel.CRITICAL.isMoreSevereThan(RiskLevel.HIGH)).isTrue();
        assertThat(RiskLevel.HIGH.isMoreSevereThan(RiskLevel.HIGH)).isFalse();
        assertThat(RiskLevel.MEDIUM.isMoreSevereThan(RiskLevel.HIGH)).isFalse();
        assertThat(RiskLevel.LOW.isMoreSevereThan(null)).isTrue();
    }
}

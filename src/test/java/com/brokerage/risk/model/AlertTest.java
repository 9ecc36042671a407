package com.brokerage.risk.model;

import com.brokerage.risk.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AlertTest {

    @Test
    void naturalId_sameKey_sameId() {
        String first = Alert.naturalId(AlertType.HIGH_CLIENT_EXPOSURE, EntityType.CLIENT, "CLIENT_001", 42);
        String second = Alert.naturalId(AlertType.HIGH_CLIENT_EXPOSURE, EntityType.CLIENT, "CLIENT_001", 42);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void naturalId_differsPerTransactionAndType() {
        String base = Alert.naturalId(AlertType.HIGH_CLIENT_EXPOSURE, EntityType.CLIENT, "CLIENT_001", 42);

        assertThat(Alert.naturalId(AlertType.HIGH_CLIENT_EXPOSURE, EntityType.CLIENT, "CLIENT_001", 43))
                .isNotEqualTo(base);
        assertThat(Alert.naturalId(AlertType.HIGH_TRANSACTION_VELOCITY, EntityType.CLIENT, "CLIENT_001", 42))
                .isNotEqualTo(base);
    }

    @Test
    void fromRuleResult_copiesResultAndTransaction() {
        Transaction txn = TestDataFactory.createTransactionOfValue(7, "CLIENT_001", "AAPL", 1_200_000);
        RuleResult result = RuleResult.builder()
                .alertType(AlertType.HIGH_CLIENT_EXPOSURE)
                .triggered(true)
                .severity(RiskLevel.CRITICAL)
                .entityType(EntityType.CLIENT)
                .entityId("CLIENT_001")
                .thresholdValue(1_000_000)
                .currentValue(1_200_000)
                .reason("over")
                .build();

        Alert alert = Alert.fromRuleResult(result, txn, 99L);

        assertThat(alert.getAlertId())
                .isEqualTo(Alert.naturalId(AlertType.HIGH_CLIENT_EXPOSURE, EntityType.CLIENT, "CLIENT_001", 7));
        assertThat(alert.getTimestamp()).isEqualTo(99L);
        assertThat(alert.getEventTimestamp()).isEqualTo(txn.getTimestamp());
        assertThat(alert.getTransactionId()).isEqualTo(7);
        assertThat(alert.getSeverity()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(alert.getMessage()).isEqualTo("over");
        assertThat(alert.isAcknowledged()).isFalse();
        assertThat(alert.dedupKey()).isEqualTo("HIGH_CLIENT_EXPOSURE:CLIENT_001");
    }

    @Test
    void feedMarker_ordersByTimestampThenId() {
        FeedMarker marker = new FeedMarker(1000, 5);

        assertThat(new FeedMarker(1000, 6).isAfter(marker)).isTrue();
        assertThat(new FeedMarker(1001, 1).isAfter(marker)).isTrue();
        assertThat(new FeedMarker(1000, 5).isAfter(marker)).isFalse();
        assertThat(new FeedMarker(999, 100).isAfter(marker)).isFalse();
        assertThat(marker.isAfter(FeedMarker.START)).isTrue();
    }
}

package com.brokerage.risk.service;

import com.brokerage.risk.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VelocityTrackerTest {

    private static final long T0 = TestDataFactory.BASE_TS;

    private VelocityTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new VelocityTracker(TestDataFactory.defaultThresholds());
    }

    @Test
    void record_countsWithinSixtySeconds() {
        for (int i = 0; i < 10; i++) {
            tracker.record("CLIENT_001", T0 + i * 1000);
        }

        assertThat(tracker.record("CLIENT_001", T0 + 10_000)).isEqualTo(11);
    }

    @Test
    void record_oldEventsFallOutOfWindow() {
        tracker.record("CLIENT_001", T0);
        tracker.record("CLIENT_001", T0 + 30_000);

        assertThat(tracker.record("CLIENT_001", T0 + 60_000)).isEqualTo(2);
        assertThat(tracker.currentCount("CLIENT_001", T0 + 95_000)).isEqualTo(1);
    }

    @Test
    void clients_areTrackedIndependently() {
        tracker.record("CLIENT_001", T0);
        tracker.record("CLIENT_001", T0 + 1);

        assertThat(tracker.record("CLIENT_002", T0 + 2)).isEqualTo(1);
        assertThat(tracker.trackedClients()).isEqualTo(2);
        assertThat(tracker.currentCount("UNKNOWN", T0)).isZero();
    }
}

package com.brokerage.risk.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicLong feedLagMs;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.feedLagMs = registry.gauge("risk.feed.lag_ms", new AtomicLong(0));
    }

    public void recordTransactionsProcessed(int count) {
        Counter.builder("risk.transactions.processed")
                .register(registry)
                .increment(count);
    }

    public void recordTransactionSkipped(String reason) {
        Counter.builder("risk.transactions.skipped")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAlert(String alertType, String severity) {
        Counter.builder("risk.alerts.emitted")
                .tag("alert_type", alertType)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordAlertSuppressed(String alertType) {
        Counter.builder("risk.alerts.suppressed")
                .tag("alert_type", alertType)
                .register(registry)
                .increment();
    }

    public void recordRuleFailure(String alertType) {
        Counter.builder("risk.rules.failed")
                .tag("alert_type", alertType)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordFeedFailure() {
        Counter.builder("risk.feed.failures")
                .register(registry)
                .increment();
    }

    public void updateFeedLag(long lagMs) {
        feedLagMs.set(lagMs);
    }
}

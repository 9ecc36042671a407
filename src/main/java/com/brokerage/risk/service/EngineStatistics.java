package com.brokerage.risk.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters since startup, read by the snapshotter and the status endpoint.
 */
@Component
public class EngineStatistics {

    private final AtomicLong transactionsProcessed = new AtomicLong();
    private final AtomicLong transactionsSkipped = new AtomicLong();
    private final AtomicLong alertsGenerated = new AtomicLong();
    private final AtomicLong alertsSuppressed = new AtomicLong();

    public void addProcessed(long count) {
        transactionsProcessed.addAndGet(count);
    }

    public void incrementSkipped() {
        transactionsSkipped.incrementAndGet();
    }

    public void incrementAlertsGenerated() {
        alertsGenerated.incrementAndGet();
    }

    public void incrementAlertsSuppressed() {
        alertsSuppressed.incrementAndGet();
    }

    public long getTransactionsProcessed() {
        return transactionsProcessed.get();
    }

    public long getTransactionsSkipped() {
        return transactionsSkipped.get();
    }

    public long getAlertsGenerated() {
        return alertsGenerated.get();
    }

    public long getAlertsSuppressed() {
        return alertsSuppressed.get();
    }
}

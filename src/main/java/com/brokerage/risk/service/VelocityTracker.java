package com.brokerage.risk.service;

import com.brokerage.risk.engine.stats.TimeWindowCounter;
import com.brokerage.risk.model.RiskThresholds;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Transactions per client inside a trailing window, measured on transaction
 * timestamps rather than wall-clock time.
 */
@Service
public class VelocityTracker {

    private final long windowMillis;
    private final Map<String, TimeWindowCounter> windows = new ConcurrentHashMap<>();

    public VelocityTracker(RiskThresholds thresholds) {
        this.windowMillis = thresholds.getVelocityWindowSeconds() * 1000L;
    }

    /**
     * @return transactions for the client in the window ending at {@code timestampMillis}, this one included
     */
    public int record(String clientId, long timestampMillis) {
        return windows.computeIfAbsent(clientId, id -> new TimeWindowCounter(windowMillis))
                .record(timestampMillis);
    }

    public int currentCount(String clientId, long nowMillis) {
        TimeWindowCounter counter = windows.get(clientId);
        return counter == null ? 0 : counter.count(nowMillis);
    }

    public int trackedClients() {
        return windows.size();
    }
}

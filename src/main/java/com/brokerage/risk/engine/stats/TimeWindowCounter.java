package com.brokerage.risk.engine.stats;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Timestamps inside a trailing window. An entry is inside the window while
 * {@code timestamp > now - window}; stale entries are evicted lazily on each
 * record or count.
 */
public class TimeWindowCounter {

    private final long windowMillis;
    private final Deque<Long> timestamps = new ArrayDeque<>();

    public TimeWindowCounter(long windowMillis) {
        if (windowMillis <= 0) {
            throw new IllegalArgumentException("windowMillis must be > 0, was " + windowMillis);
        }
        this.windowMillis = windowMillis;
    }

    /**
     * Record an event and return how many events, including this one, fall
     * inside the window ending at {@code timestampMillis}.
     */
    public synchronized int record(long timestampMillis) {
        evict(timestampMillis);
        timestamps.addLast(timestampMillis);
        return timestamps.size();
    }

    public synchronized int count(long nowMillis) {
        evict(nowMillis);
        return timestamps.size();
    }

    public synchronized boolean isEmpty() {
        return timestamps.isEmpty();
    }

    private void evict(long nowMillis) {
        long horizon = nowMillis - windowMillis;
        while (!timestamps.isEmpty() && timestamps.peekFirst() <= horizon) {
            timestamps.pollFirst();
        }
    }
}

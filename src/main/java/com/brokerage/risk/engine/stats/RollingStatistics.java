package com.brokerage.risk.engine.stats;

/**
 * Count-bounded window of the most recent values with running mean and
 * variance (Welford). When the window is full the oldest value is removed
 * with the inverse update before the new one is added.
 *
 * Inverse updates accumulate rounding error, so the moments are recomputed
 * from the buffer once every {@code capacity} evictions.
 */
public class RollingStatistics {

    private final double[] values;
    private int head;
    private int count;
    private double mean;
    private double m2;
    private long evictionsSinceRecompute;

    public RollingStatistics(int capacity) {
        if (capacity < 2) {
            throw new IllegalArgumentException("capacity must be >= 2, was " + capacity);
        }
        this.values = new double[capacity];
    }

    public synchronized void add(double value) {
        if (count == values.length) {
            double oldest = values[head];
            removeFromMoments(oldest);
            values[head] = value;
            head = (head + 1) % values.length;
            count++;
            addToMoments(value);
            if (++evictionsSinceRecompute >= values.length) {
                recompute();
            }
            return;
        }
        values[(head + count) % values.length] = value;
        count++;
        addToMoments(value);
    }

    public synchronized int size() {
        return count;
    }

    public int capacity() {
        return values.length;
    }

    public synchronized double mean() {
        return count == 0 ? 0.0 : mean;
    }

    /** Population variance of the window (n denominator). */
    public synchronized double variance() {
        return count < 2 ? 0.0 : m2 / count;
    }

    public synchronized double stdDev() {
        return Math.sqrt(variance());
    }

    // count is the size after the value was added
    private void addToMoments(double value) {
        double delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);
    }

    // count is decremented here
    private void removeFromMoments(double value) {
        if (count == 1) {
            count = 0;
            mean = 0.0;
            m2 = 0.0;
            return;
        }
        double previousMean = (count * mean - value) / (count - 1);
        m2 -= (value - mean) * (value - previousMean);
        if (m2 < 0.0) {
            m2 = 0.0;
        }
        mean = previousMean;
        count--;
    }

    private void recompute() {
        double sum = 0.0;
        for (int i = 0; i < count; i++) {
            sum += values[(head + i) % values.length];
        }
        double exactMean = sum / count;
        double squares = 0.0;
        for (int i = 0; i < count; i++) {
            double d = values[(head + i) % values.length] - exactMean;
            squares += d * d;
        }
        mean = exactMean;
        m2 = squares;
        evictionsSinceRecompute = 0;
    }
}

package strata.core.cache;

import strata.core.model.CacheStatistics;

/**
 * Fixed-size ring of the most recent operation latencies.
 */
public final class LatencyWindow {

    public static final int DEFAULT_CAPACITY = 1000;

    private final double[] samples;
    private int next;
    private int count;

    public LatencyWindow() {
        this(DEFAULT_CAPACITY);
    }

    public LatencyWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.samples = new double[capacity];
    }

    public synchronized void record(double millis) {
        samples[next] = millis;
        next = (next + 1) % samples.length;
        if (count < samples.length) {
            count++;
        }
    }

    public synchronized CacheStatistics.Latency snapshot() {
        if (count == 0) {
            return CacheStatistics.Latency.empty();
        }
        double sum = 0;
        double max = 0;
        for (int i = 0; i < count; i++) {
            sum += samples[i];
            max = Math.max(max, samples[i]);
        }
        return new CacheStatistics.Latency(sum / count, max, count);
    }
}

package io.flux.api.pool;

import java.time.Duration;
import java.util.concurrent.ThreadFactory;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Configuration for a work pool.
 * Controls the worker bounds, the metrics cadence and the threads workers run on.
 * <p>
 * Values are not validated here; the pool rejects an invalid configuration when it is built.
 */
public final class PoolConfig {

    private long minWorkers = 1;
    private long maxWorkers = Runtime.getRuntime().availableProcessors();
    private Supplier<Duration> metricInterval = null; // null = no periodic metrics
    private Consumer<PoolStat> metricHandler = null;
    private ThreadFactory threadFactory = null;

    private PoolConfig() {}

    public static PoolConfig create() {
        return new PoolConfig();
    }

    public PoolConfig minWorkers(long minWorkers) {
        this.minWorkers = minWorkers;
        return this;
    }

    public PoolConfig maxWorkers(long maxWorkers) {
        this.maxWorkers = maxWorkers;
        return this;
    }

    /**
     * Fixed interval between metric snapshots. Intervals below one second are raised to one second.
     */
    public PoolConfig metricInterval(Duration metricInterval) {
        this.metricInterval = () -> metricInterval;
        return this;
    }

    /**
     * Interval supplier, consulted again after every snapshot so the cadence can change over time.
     * A zero or negative value stops periodic snapshots.
     */
    public PoolConfig metricInterval(Supplier<Duration> metricInterval) {
        this.metricInterval = metricInterval;
        return this;
    }

    public PoolConfig metricHandler(Consumer<PoolStat> metricHandler) {
        this.metricHandler = metricHandler;
        return this;
    }

    /**
     * Provide a custom thread factory for workers and the management thread, overriding the
     * default named daemon threads.
     */
    public PoolConfig threadFactory(ThreadFactory threadFactory) {
        this.threadFactory = threadFactory;
        return this;
    }

    public long minWorkers() { return minWorkers; }
    public long maxWorkers() { return maxWorkers; }
    public Supplier<Duration> metricInterval() { return metricInterval; }
    public Consumer<PoolStat> metricHandler() { return metricHandler; }
    public ThreadFactory threadFactory() { return threadFactory; }
}

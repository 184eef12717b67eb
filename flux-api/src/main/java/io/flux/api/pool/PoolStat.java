package io.flux.api.pool;

import java.time.Instant;

/**
 * Snapshot of pool counters at a point in time.
 * Built from independent atomic reads, so it is eventually consistent: fine for monitoring
 * and scaling decisions, not for exact accounting.
 */
public record PoolStat(
        Instant stamp,
        long maxWorkers,
        long minWorkers,
        long workers,
        long executed,
        long pending,
        long active
) {

    /**
     * @return true when every live worker is executing a task
     */
    public boolean saturated() {
        return active == workers;
    }

    /**
     * @return true when nothing is executing and nothing waits for admission
     */
    public boolean idle() {
        return active == 0 && pending == 0;
    }
}

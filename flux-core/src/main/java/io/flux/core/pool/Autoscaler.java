package io.flux.core.pool;

import io.flux.api.pool.PoolStat;

/**
 * Load heuristic deciding how a pool should resize.
 * <ul>
 *   <li>While a previous resize is still being applied, hold.</li>
 *   <li>Fully idle and above the minimum: shrink to exactly the minimum.</li>
 *   <li>Fully saturated and below the maximum: grow by 20% of the current workers
 *   (at least one), never past the maximum.</li>
 * </ul>
 */
public record Autoscaler(long minWorkers, long maxWorkers) {

    private static final double GROWTH_FACTOR = 0.20;

    /**
     * @param stat          current pool snapshot
     * @param updatePending resize tokens not yet applied by the pool
     * @return workers to add (positive), remove (negative), or 0 to hold
     */
    public int decide(PoolStat stat, long updatePending) {
        if (updatePending != 0) {
            return 0;
        }

        long workers = stat.workers();

        if (stat.idle() && workers > minWorkers) {
            return (int) (minWorkers - workers);
        }

        if (stat.saturated() && workers < maxWorkers) {
            long grow = Math.max(1, (long) (workers * GROWTH_FACTOR));
            return (int) Math.min(grow, maxWorkers - workers);
        }

        return 0;
    }
}

package io.flux.core.pool;

import io.flux.api.pool.PoolConfig;
import io.flux.api.pool.PoolStat;
import io.flux.api.pool.WorkPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Manages one work pool per name.
 * Lets a host application keep several independently sized pools and shut them down together.
 */
public class PoolManager {

    private static final Logger log = LoggerFactory.getLogger(PoolManager.class);

    private final Map<String, WorkPool> pools = new ConcurrentHashMap<>();

    /**
     * Create and register a pool.
     *
     * @throws IllegalArgumentException if a pool with this name already exists
     */
    public WorkPool create(String name, PoolConfig config) {
        return pools.compute(name, (key, existing) -> {
            if (existing != null) {
                throw new IllegalArgumentException("Pool already exists: " + name);
            }
            return DynamicWorkPool.create(this, key, config);
        });
    }

    /**
     * Get the pool registered under a name.
     */
    public WorkPool pool(String name) {
        WorkPool pool = pools.get(name);
        if (pool == null) {
            throw new IllegalArgumentException("No pool named: " + name);
        }
        return pool;
    }

    /**
     * @return all pools (for metrics collection)
     */
    public Collection<WorkPool> allPools() {
        return Collections.unmodifiableCollection(pools.values());
    }

    /**
     * @return a snapshot of every pool, keyed by name
     */
    public Map<String, PoolStat> stats() {
        Map<String, PoolStat> stats = new LinkedHashMap<>();
        pools.forEach((name, pool) -> stats.put(name, pool.stat()));
        return stats;
    }

    /**
     * Shut down all pools.
     */
    public void shutdown() {
        pools.values().forEach(WorkPool::shutdown);
        log.info("Shut down {} pools", pools.size());
        pools.clear();
    }
}

package io.flux.core.metrics;

import io.flux.api.pool.PoolStat;
import io.flux.api.pool.WorkPool;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.function.ToDoubleFunction;

/**
 * Exposes the counters of a {@link WorkPool} as Micrometer meters tagged with the pool name.
 * Meters read the pool on demand, so nothing is recorded on the submission path.
 */
public class PoolMetricsBinder implements MeterBinder {

    private final WorkPool pool;

    public PoolMetricsBinder(WorkPool pool) {
        this.pool = pool;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        gauge(registry, "flux.pool.workers", "Live workers", PoolStat::workers);
        gauge(registry, "flux.pool.workers.min", "Configured minimum workers", PoolStat::minWorkers);
        gauge(registry, "flux.pool.workers.max", "Configured maximum workers", PoolStat::maxWorkers);
        gauge(registry, "flux.pool.active", "Tasks currently executing", PoolStat::active);
        gauge(registry, "flux.pool.pending", "Submissions waiting for a worker", PoolStat::pending);

        FunctionCounter.builder("flux.pool.executed", pool, p -> p.stat().executed())
                .description("Tasks executed, failed ones included")
                .tag("pool", pool.name())
                .register(registry);
    }

    private void gauge(MeterRegistry registry, String name, String description,
                       ToDoubleFunction<PoolStat> value) {
        Gauge.builder(name, pool, p -> value.applyAsDouble(p.stat()))
                .description(description)
                .tag("pool", pool.name())
                .register(registry);
    }
}

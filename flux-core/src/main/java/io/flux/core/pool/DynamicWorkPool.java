package io.flux.core.pool;

import io.flux.api.pool.InvalidAddRequestException;
import io.flux.api.pool.InvalidMaxWorkersException;
import io.flux.api.pool.InvalidMinWorkersException;
import io.flux.api.pool.PoolConfig;
import io.flux.api.pool.PoolStat;
import io.flux.api.pool.Work;
import io.flux.api.pool.WorkPool;
import io.flux.api.pool.WorkRequestDeniedException;
import io.flux.core.channel.Channel;
import io.flux.core.channel.ChannelClosedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.Phaser;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Work pool whose worker count follows the load.
 * <p>
 * Submitters hand tasks to idle workers through one unbuffered channel, so a submission
 * returns only when a worker has taken the task. A single management thread owns the worker
 * set: it spawns and retires workers in response to {@link #add} requests and to the load
 * heuristic run on every submission, publishes periodic metrics, and stops every worker on
 * {@link #shutdown()}.
 * <p>
 * Workers are never preempted. A retire or stop token is picked up by whichever worker is
 * idle next, so a long-running task delays scale-down and shutdown until it completes.
 *
 * <pre>{@code
 * var pool = DynamicWorkPool.create("app", "resize", PoolConfig.create()
 *     .minWorkers(4)
 *     .maxWorkers(100)
 *     .metricInterval(Duration.ofSeconds(5))
 *     .metricHandler(stat -> log.info("{}", stat)));
 *
 * pool.doWork(image, (ctx, id) -> resize((Path) ctx));
 * pool.shutdown();
 * }</pre>
 */
public class DynamicWorkPool implements WorkPool {

    private static final Logger log = LoggerFactory.getLogger(DynamicWorkPool.class);

    private static final Duration MIN_METRIC_INTERVAL = Duration.ofSeconds(1);

    private enum Command { ADD_WORKER, REMOVE_WORKER, SHUTDOWN }

    private final String name;
    private final PoolConfig config;
    private final long minWorkers;
    private final long maxWorkers;
    private final Autoscaler autoscaler;
    private final ThreadFactory threadFactory;

    private final AtomicLong currentWorkers = new AtomicLong(0);
    private final AtomicLong updatePending = new AtomicLong(0);
    private final AtomicLong activeWork = new AtomicLong(0);
    private final AtomicLong pendingWork = new AtomicLong(0);
    private final AtomicLong executedWork = new AtomicLong(0);
    private final AtomicInteger workerIds = new AtomicInteger(0);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private final Channel<WorkOrder> tasks = new Channel<>();
    private final BlockingDeque<Command> commands = new LinkedBlockingDeque<>();
    private final ReentrantLock healthLock = new ReentrantLock();

    // one party for shutdown(), plus one per live worker and the management thread
    private final Phaser running = new Phaser(1);

    // workers spawned and not yet retired; touched only by the management thread after construction
    private long liveWorkers;

    public DynamicWorkPool(String name, PoolConfig config) {
        if (config.minWorkers() <= 0) {
            throw new InvalidMinWorkersException(config.minWorkers());
        }
        if (config.maxWorkers() <= 0 || config.maxWorkers() < config.minWorkers()) {
            throw new InvalidMaxWorkersException(config.maxWorkers(), config.minWorkers());
        }

        this.name = name;
        this.config = config;
        this.minWorkers = config.minWorkers();
        this.maxWorkers = config.maxWorkers();
        this.autoscaler = new Autoscaler(minWorkers, maxWorkers);
        this.threadFactory = config.threadFactory() != null ? config.threadFactory() : r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            return t;
        };

        for (long i = 0; i < minWorkers; i++) {
            spawnWorker();
        }

        running.register();
        Thread manager = threadFactory.newThread(this::manage);
        if (config.threadFactory() == null) {
            manager.setName(name + "-manager");
        }
        manager.start();

        log.info("Created work pool '{}' with {} to {} workers", name, minWorkers, maxWorkers);
    }

    public static DynamicWorkPool create(Object context, String name, PoolConfig config) {
        DynamicWorkPool pool = new DynamicWorkPool(name, config);
        log.debug("Work pool '{}' created for {}", name, context);
        return pool;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public PoolStat stat() {
        return new PoolStat(
                Instant.now(),
                maxWorkers,
                minWorkers,
                currentWorkers.get(),
                executedWork.get(),
                pendingWork.get(),
                activeWork.get()
        );
    }

    @Override
    public void doWork(Object context, Work work) throws InterruptedException {
        WorkOrder order = new WorkOrder(context, work);
        ensureOpen();

        measureHealth();

        pendingWork.incrementAndGet();
        try {
            tasks.send(order);
        } catch (ChannelClosedException e) {
            throw new WorkRequestDeniedException("Pool '" + name + "' is shut down", e);
        } finally {
            pendingWork.decrementAndGet();
        }
    }

    @Override
    public void doWait(Object context, Work work, Duration timeout) throws InterruptedException {
        WorkOrder order = new WorkOrder(context, work);
        ensureOpen();

        measureHealth();

        boolean accepted;
        pendingWork.incrementAndGet();
        try {
            accepted = tasks.offer(order, timeout);
        } catch (ChannelClosedException e) {
            throw new WorkRequestDeniedException("Pool '" + name + "' is shut down", e);
        } finally {
            pendingWork.decrementAndGet();
        }

        if (!accepted) {
            throw new WorkRequestDeniedException(
                    "Pool '" + name + "' unable to accept task within " + timeout.toMillis() + "ms");
        }
    }

    @Override
    public void add(Object context, int delta) {
        if (delta == 0) {
            throw new InvalidAddRequestException();
        }

        Command command = delta > 0 ? Command.ADD_WORKER : Command.REMOVE_WORKER;
        // tokens past the min..max span are skipped by the management thread anyway
        long count = Math.min(Math.abs((long) delta), maxWorkers - minWorkers);

        log.debug("Pool '{}': {} x{} requested by {}", name, command, count, context);
        if (count == 0) {
            return;
        }

        updatePending.addAndGet(count);
        for (long i = 0; i < count; i++) {
            commands.offer(command);
        }
    }

    @Override
    public void reset(Object context, int target) {
        int delta = Math.max(target, 0) - (int) currentWorkers.get();
        if (delta != 0) {
            add(context, delta);
        }
    }

    @Override
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }

        commands.offerFirst(Command.SHUTDOWN);
        try {
            running.awaitAdvanceInterruptibly(running.arrive());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        tasks.close();

        log.info("Pool '{}' shut down. Executed: {}", name, executedWork.get());
    }

    private void ensureOpen() {
        if (shutdown.get()) {
            throw new WorkRequestDeniedException("Pool '" + name + "' is shut down");
        }
    }

    private void measureHealth() {
        if (updatePending.get() != 0) {
            return;
        }

        healthLock.lock();
        try {
            int delta = autoscaler.decide(stat(), updatePending.get());
            if (delta != 0) {
                log.debug("Pool '{}' resizing by {} workers", name, delta);
                add(name, delta);
            }
        } finally {
            healthLock.unlock();
        }
    }

    private void manage() {
        Duration interval = nextMetricInterval();
        long deadline = System.nanoTime() + interval.toNanos();

        try {
            while (true) {
                Command command = interval.isZero()
                        ? commands.take()
                        : commands.poll(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);

                // a busy command queue must not hold back an overdue tick
                if (!interval.isZero() && System.nanoTime() - deadline >= 0) {
                    publishMetrics();
                    interval = nextMetricInterval();
                    deadline = System.nanoTime() + interval.toNanos();
                }
                if (command == null) {
                    continue;
                }

                switch (command) {
                    case ADD_WORKER -> addWorker();
                    case REMOVE_WORKER -> removeWorker();
                    case SHUTDOWN -> {
                        stopWorkers();
                        return;
                    }
                }
            }
        } catch (InterruptedException e) {
            log.warn("Management thread of pool '{}' interrupted", name);
            Thread.currentThread().interrupt();
        } catch (ChannelClosedException e) {
            // shutdown() gave up waiting and closed the task channel under us
            log.debug("Pool '{}' task channel closed while stopping {} workers", name, liveWorkers);
        } finally {
            running.arriveAndDeregister();
        }
    }

    private void addWorker() {
        try {
            if (liveWorkers >= maxWorkers) {
                return;
            }
            spawnWorker();
        } finally {
            updatePending.decrementAndGet();
        }
    }

    private void removeWorker() throws InterruptedException {
        try {
            if (liveWorkers <= minWorkers) {
                return;
            }
            tasks.send(WorkOrder.KILL);
            liveWorkers--;
        } finally {
            updatePending.decrementAndGet();
        }
    }

    private void stopWorkers() throws InterruptedException {
        log.debug("Pool '{}' stopping {} workers", name, liveWorkers);
        while (liveWorkers > 0) {
            tasks.send(WorkOrder.KILL);
            liveWorkers--;
        }
    }

    private void spawnWorker() {
        int id = workerIds.incrementAndGet();
        liveWorkers++;
        currentWorkers.incrementAndGet();
        running.register();

        Thread worker = threadFactory.newThread(() -> work(id));
        if (config.threadFactory() == null) {
            worker.setName(name + "-worker-" + id);
        }
        worker.start();
    }

    private void work(int id) {
        String tag = "Pool '" + name + "' worker #" + id;
        try {
            while (true) {
                WorkOrder order;
                try {
                    order = tasks.receive().orElse(WorkOrder.KILL);
                } catch (InterruptedException e) {
                    // workers only stop on a kill token, the management thread counts on it
                    log.warn("{} interrupted while idle, ignoring", tag);
                    continue;
                }
                if (order.isKill()) {
                    break;
                }

                activeWork.incrementAndGet();
                try {
                    TaskRecovery.run(tag, order.work(), order.context(), id);
                } finally {
                    executedWork.incrementAndGet();
                    activeWork.decrementAndGet();
                }
            }
        } finally {
            currentWorkers.decrementAndGet();
            running.arriveAndDeregister();
        }
    }

    private void publishMetrics() {
        if (config.metricHandler() == null) {
            return;
        }
        try {
            config.metricHandler().accept(stat());
        } catch (Exception e) {
            log.error("Error publishing metrics for pool '{}'", name, e);
        }
    }

    private Duration nextMetricInterval() {
        Supplier<Duration> supplier = config.metricInterval();
        Duration interval = supplier != null ? supplier.get() : null;

        if (interval == null || interval.isNegative() || interval.isZero()) {
            return Duration.ZERO;
        }
        return interval.compareTo(MIN_METRIC_INTERVAL) < 0 ? MIN_METRIC_INTERVAL : interval;
    }
}

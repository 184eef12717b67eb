package io.flux.api.pool;

import java.time.Duration;

/**
 * A dynamically sized pool of workers fed through a single hand-off point.
 * <p>
 * Submissions block until an idle worker accepts the task. The number of workers moves
 * between the configured minimum and maximum, either on request ({@link #add}, {@link #reset})
 * or driven by the pool's own load heuristic.
 */
public interface WorkPool {

    /**
     * @return the name this pool was created with
     */
    String name();

    /**
     * Hand a task to the pool, blocking until a worker accepts it.
     *
     * @throws WorkRequestDeniedException if the pool is shut down
     */
    void doWork(Object context, Work work) throws InterruptedException;

    /**
     * Hand a task to the pool, waiting at most {@code timeout} for a worker to accept it.
     * A task that is not accepted in time is dropped.
     *
     * @throws WorkRequestDeniedException if no worker accepted the task in time,
     *                                    or the pool is shut down
     */
    void doWait(Object context, Work work, Duration timeout) throws InterruptedException;

    /**
     * Request {@code delta} more workers, or {@code |delta|} fewer when negative.
     * Requests beyond the configured bounds are ignored by the pool.
     *
     * @throws InvalidAddRequestException if {@code delta} is zero
     */
    void add(Object context, int delta);

    /**
     * Move the worker count towards {@code target}.
     */
    void reset(Object context, int target);

    /**
     * @return a best-effort snapshot of the pool counters
     */
    PoolStat stat();

    /**
     * Stop every worker and the management thread, waiting for running tasks to complete.
     * The pool cannot be used afterwards.
     */
    void shutdown();
}

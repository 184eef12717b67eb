package io.flux.api.pool;

/**
 * A unit of work executed by a {@link WorkPool} worker.
 * <p>
 * Failures thrown from {@link #work(Object, int)} are logged by the pool and never reach the
 * submitter. Implementations that need failure visibility must report it through their own
 * side effects (a result channel, a latch, a counter).
 */
@FunctionalInterface
public interface Work {

    /**
     * @param context  the opaque value passed alongside this work at submission
     * @param workerId id of the worker executing it
     */
    void work(Object context, int workerId) throws Exception;
}

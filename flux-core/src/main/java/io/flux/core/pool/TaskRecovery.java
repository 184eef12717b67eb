package io.flux.core.pool;

import io.flux.api.pool.Work;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs work so that nothing it throws escapes the calling worker.
 */
final class TaskRecovery {

    private static final Logger log = LoggerFactory.getLogger(TaskRecovery.class);

    private TaskRecovery() {}

    /**
     * @return true if the work completed normally
     */
    static boolean run(String tag, Work work, Object context, int workerId) {
        try {
            work.work(context, workerId);
            return true;
        } catch (Throwable t) {
            log.error("{}: task failed with context '{}'", tag, context, t);
            return false;
        } finally {
            // a task must not leave the worker interrupted
            Thread.interrupted();
        }
    }
}

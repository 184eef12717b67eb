package io.flux.api.pool;

/**
 * Thrown when the pool is unable to accept a task: no worker took it within the
 * allowed wait, or the pool has been shut down.
 */
public class WorkRequestDeniedException extends PoolException {

    public WorkRequestDeniedException(String message) {
        super(message);
    }

    public WorkRequestDeniedException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.flux.api.pool;

/**
 * Thrown when the maximum worker count is at or below zero, or below the minimum.
 */
public class InvalidMaxWorkersException extends PoolException {

    public InvalidMaxWorkersException(long maxWorkers, long minWorkers) {
        super("Invalid maximum worker value: " + maxWorkers + " (minimum is " + minWorkers + ")");
    }
}

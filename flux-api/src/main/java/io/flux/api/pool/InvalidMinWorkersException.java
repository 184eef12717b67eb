package io.flux.api.pool;

/**
 * Thrown when a pool is configured with a minimum worker count at or below zero.
 */
public class InvalidMinWorkersException extends PoolException {

    public InvalidMinWorkersException(long minWorkers) {
        super("Invalid minimum worker value: " + minWorkers);
    }
}

package io.flux.api.pool;

/**
 * Thrown when a scaling request asks for no change at all.
 */
public class InvalidAddRequestException extends PoolException {

    public InvalidAddRequestException() {
        super("Worker delta must not be zero");
    }
}

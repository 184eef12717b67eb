package io.flux.core.stream;

/**
 * Signals that a {@link Buffer} had no item to return.
 * <p>
 * This is not an error, pollers use it for control flow.
 */
public class BufferEmptyException extends RuntimeException {

    static final BufferEmptyException INSTANCE = new BufferEmptyException();

    public BufferEmptyException() {
        super("Buffer is empty", null, false, false); // no stack trace, shared instance
    }
}

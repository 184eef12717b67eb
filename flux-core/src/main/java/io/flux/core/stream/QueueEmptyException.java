package io.flux.core.stream;

/**
 * Signals that a {@link PressureQueue} had nothing buffered.
 */
public class QueueEmptyException extends RuntimeException {

    static final QueueEmptyException INSTANCE = new QueueEmptyException();

    public QueueEmptyException() {
        super("Queue is empty", null, false, false);
    }
}

package io.flux.core.stream;

import io.flux.core.channel.Channel;

/**
 * A pair of back-pressure queues, one for data signals and one for errors, fed through a
 * single object.
 * <p>
 * Producers never wait on the consumer: both {@link #sendSignal} and {@link #sendError}
 * return as soon as the value is buffered. Consumers read from {@link #signals()} and
 * {@link #errors()}. The two pipelines share nothing except their lifecycle.
 *
 * <pre>{@code
 * PressureStream<Integer> stream = PressureStream.create();
 * stream.sendSignal(1);
 * Optional<Integer> next = stream.signals().receive();
 * stream.close();
 * }</pre>
 */
public class PressureStream<T> implements AutoCloseable {

    private final PressureQueue<T> signalQueue;
    private final PressureQueue<Throwable> errorQueue;

    private PressureStream(Channel<T> signals, Channel<Throwable> errors) {
        this.signalQueue = new PressureQueue<>(signals);
        this.errorQueue = new PressureQueue<>(errors);
    }

    public static <T> PressureStream<T> create() {
        return new PressureStream<>(new Channel<>(), new Channel<>());
    }

    /**
     * Build a stream around caller-owned channels. Both are closed when the stream closes.
     */
    public static <T> PressureStream<T> of(Channel<T> signals, Channel<Throwable> errors) {
        return new PressureStream<>(signals, errors);
    }

    public Channel<T> signals() {
        return signalQueue.out();
    }

    public Channel<Throwable> errors() {
        return errorQueue.out();
    }

    public void sendSignal(T signal) {
        signalQueue.enqueue(signal);
    }

    public void sendError(Throwable error) {
        errorQueue.enqueue(error);
    }

    /**
     * @return signals buffered but not yet taken; advisory only
     */
    public int remainingSignals() {
        return signalQueue.length();
    }

    /**
     * @return errors buffered but not yet taken; advisory only
     */
    public int remainingErrors() {
        return errorQueue.length();
    }

    /**
     * Close both queues. Values not yet taken are discarded.
     */
    @Override
    public void close() {
        signalQueue.close();
        errorQueue.close();
    }
}

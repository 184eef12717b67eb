package io.flux.core.stream;

import io.flux.core.channel.Channel;
import io.flux.core.channel.ChannelClosedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Relays items from any number of producers to the consumer of an output {@link Channel},
 * buffering without bound so producers never wait on the consumer's pace.
 * <p>
 * A single manager thread is the only one that ever takes from the buffer or sends on the
 * output channel. It offers the head of the buffer and removes it only once the consumer has
 * taken it, so a single producer's items come out in the order they went in.
 * <p>
 * Items must not be null.
 * <p>
 * {@link #close()} is a fast shutdown: items still buffered are discarded. Consumers that need
 * every item must drain the output channel before closing.
 */
public class PressureQueue<T> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PressureQueue.class);
    private static final AtomicInteger QUEUE_IDS = new AtomicInteger();

    private final Channel<T> out;
    private final Buffer<T> buffer = new Buffer<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final Thread manager;
    private boolean closed;

    public PressureQueue(Channel<T> out) {
        this.out = out;
        this.manager = new Thread(this::manage, "flux-queue-" + QUEUE_IDS.incrementAndGet());
        this.manager.setDaemon(true);
        this.manager.start();
    }

    /**
     * @return the channel items are delivered on
     */
    public Channel<T> out() {
        return out;
    }

    /**
     * Append an item. Returns once the item is buffered; it is never dropped while the queue is open.
     *
     * @throws NullPointerException  if the item is null
     * @throws IllegalStateException if the queue is closed
     */
    public void enqueue(T item) {
        Objects.requireNonNull(item, "item");
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Queue is closed");
            }
            buffer.enqueue(item);
            available.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of buffered items, including the one being offered; advisory only
     */
    public int length() {
        return buffer.length();
    }

    /**
     * @return the next item to be delivered, without removing it; advisory only
     * @throws QueueEmptyException if nothing is buffered
     */
    public T peek() {
        try {
            return buffer.peek();
        } catch (BufferEmptyException e) {
            throw QueueEmptyException.INSTANCE;
        }
    }

    /**
     * Stop the manager and close the output channel. Undelivered items are discarded.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            available.signalAll();
        } finally {
            lock.unlock();
        }

        // aborts a hand-off the consumer is not picking up
        manager.interrupt();
        try {
            manager.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        out.close();

        int dropped = buffer.length();
        if (dropped > 0) {
            log.debug("Queue {} closed with {} undelivered items", manager.getName(), dropped);
        }
    }

    private void manage() {
        try {
            while (true) {
                T head;
                lock.lock();
                try {
                    while (buffer.length() == 0 && !closed) {
                        available.await();
                    }
                    if (closed) {
                        return;
                    }
                    head = buffer.peek();
                } finally {
                    lock.unlock();
                }

                out.send(head);
                buffer.dequeue();
            }
        } catch (InterruptedException e) {
            // close() interrupts us; nothing else does
            Thread.currentThread().interrupt();
        } catch (ChannelClosedException e) {
            log.warn("Output channel of {} was closed while the queue was open", manager.getName());
        }
    }
}

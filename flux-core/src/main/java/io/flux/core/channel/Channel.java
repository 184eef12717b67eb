package io.flux.core.channel;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbuffered, closable hand-off point between threads.
 * <p>
 * A sender blocks until a receiver has taken its item (a rendezvous); there is never more
 * than one item in flight. Closing the channel fails every pending and future sender and
 * lets receivers observe the end of the stream as an empty {@link Optional}.
 * <p>
 * Items must not be null.
 */
public final class Channel<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private T slot;
    // hand-off tickets: a sender's item is delivered once taken >= its ticket
    private long offered;
    private long taken;
    private boolean closed;

    /**
     * Deliver an item, blocking until a receiver takes it.
     *
     * @throws ChannelClosedException if the channel is closed before the item was taken
     * @throws InterruptedException   if interrupted before the item was taken; the item is withdrawn
     */
    public void send(T item) throws InterruptedException {
        transfer(item, false, 0L);
    }

    /**
     * Deliver an item, waiting at most {@code timeout} for a receiver to take it.
     *
     * @return true if taken, false if the wait elapsed and the item was withdrawn
     * @throws ChannelClosedException if the channel is closed before the item was taken
     */
    public boolean offer(T item, Duration timeout) throws InterruptedException {
        return transfer(item, true, timeout.toNanos());
    }

    /**
     * Take the next item, blocking until one is sent.
     *
     * @return the item, or empty once the channel is closed
     */
    public Optional<T> receive() throws InterruptedException {
        return take(false, 0L);
    }

    /**
     * Take the next item, waiting at most {@code timeout}.
     *
     * @return the item, or empty if the wait elapsed or the channel is closed
     */
    public Optional<T> poll(Duration timeout) throws InterruptedException {
        return take(true, timeout.toNanos());
    }

    public void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    private boolean transfer(T item, boolean timed, long nanos) throws InterruptedException {
        Objects.requireNonNull(item, "item");
        lock.lockInterruptibly();
        try {
            while (slot != null && !closed) {
                if (!timed) {
                    changed.await();
                } else if (nanos <= 0L) {
                    return false;
                } else {
                    nanos = changed.awaitNanos(nanos);
                }
            }
            if (closed) {
                throw new ChannelClosedException();
            }

            slot = item;
            long ticket = ++offered;
            changed.signalAll();

            try {
                while (taken < ticket && !closed) {
                    if (!timed) {
                        changed.await();
                    } else if (nanos <= 0L) {
                        withdraw();
                        return false;
                    } else {
                        nanos = changed.awaitNanos(nanos);
                    }
                }
            } catch (InterruptedException e) {
                if (taken >= ticket) {
                    // delivered anyway; keep the interrupt for the caller's next blocking call
                    Thread.currentThread().interrupt();
                    return true;
                }
                withdraw();
                throw e;
            }

            if (taken < ticket) {
                withdraw();
                throw new ChannelClosedException();
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    private Optional<T> take(boolean timed, long nanos) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (slot == null && !closed) {
                if (!timed) {
                    changed.await();
                } else if (nanos <= 0L) {
                    return Optional.empty();
                } else {
                    nanos = changed.awaitNanos(nanos);
                }
            }
            if (slot == null) {
                return Optional.empty();
            }

            T item = slot;
            slot = null;
            taken++;
            changed.signalAll();
            return Optional.of(item);
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock and owns the item currently in the slot.
    private void withdraw() {
        slot = null;
        offered--;
        changed.signalAll();
    }
}

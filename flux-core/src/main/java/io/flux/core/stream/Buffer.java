package io.flux.core.stream;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Unbounded in-memory FIFO guarded by a read/write lock.
 * <p>
 * Every operation holds the lock for its full duration, but {@link #peek()} followed by
 * {@link #dequeue()} is not atomic: callers that rely on both returning the same item must
 * ensure a single consumer themselves, as {@link PressureQueue} does.
 */
public class Buffer<T> {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Deque<T> items = new ArrayDeque<>();

    public void enqueue(T item) {
        lock.writeLock().lock();
        try {
            items.addLast(item);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove and return the oldest item.
     *
     * @throws BufferEmptyException if the buffer holds nothing
     */
    public T dequeue() {
        lock.writeLock().lock();
        try {
            if (items.isEmpty()) {
                throw BufferEmptyException.INSTANCE;
            }
            return items.removeFirst();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Return the oldest item without removing it.
     *
     * @throws BufferEmptyException if the buffer holds nothing
     */
    public T peek() {
        lock.readLock().lock();
        try {
            if (items.isEmpty()) {
                throw BufferEmptyException.INSTANCE;
            }
            return items.peekFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int length() {
        lock.readLock().lock();
        try {
            return items.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            items.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}

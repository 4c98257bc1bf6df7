package io.linedecode.runtime;

import io.linedecode.core.ReceiveChannel;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Fixed-capacity FIFO with an explicit close. {@link #send} blocks while full, receivers block while
 * empty. Closing drops a poison marker behind the last element so waiting receivers wake up, drain
 * what is left and then see end of stream.
 */
public final class BoundedChannel<T> implements ReceiveChannel<T> {
    private static final Object POISON = new Object();
    // upper bound on a single blocking wait, so close() is noticed even if the poison did not fit
    private static final long WAKEUP_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final String name;
    private final int capacity;
    private final ArrayBlockingQueue<Object> items;
    // senders share the read lock; close takes the write lock so nothing lands after it
    private final ReentrantReadWriteLock closeLock = new ReentrantReadWriteLock();
    private volatile boolean closed = false;

    public BoundedChannel(String name, int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        this.name = Objects.requireNonNull(name);
        this.capacity = capacity;
        this.items = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Appends an element, waiting for space if the channel is full.
     *
     * @throws IllegalStateException if the channel is closed, including while waiting for space
     */
    public void send(T item) throws InterruptedException {
        offer(item, Long.MAX_VALUE, TimeUnit.NANOSECONDS);
    }

    /**
     * Appends an element if space frees up within the timeout.
     *
     * @return false on timeout
     * @throws IllegalStateException if the channel is closed
     */
    public boolean offer(T item, long timeout, TimeUnit unit) throws InterruptedException {
        Objects.requireNonNull(item, "item");
        long nanos = unit.toNanos(timeout);
        long deadline = System.nanoTime() + nanos;
        while (true) {
            closeLock.readLock().lockInterruptibly();
            try {
                if (closed) throw new IllegalStateException("send on closed channel " + name);
                if (items.offer(item, Math.min(nanos, WAKEUP_NANOS), TimeUnit.NANOSECONDS)) return true;
            } finally {
                closeLock.readLock().unlock();
            }
            nanos = deadline - System.nanoTime();
            if (nanos <= 0L) return false;
        }
    }

    /**
     * Marks the channel closed. Already buffered elements stay receivable.
     *
     * @throws IllegalStateException if the channel was already closed
     */
    public void close() {
        closeLock.writeLock().lock();
        try {
            if (closed) throw new IllegalStateException("channel " + name + " already closed");
            closed = true;
        } finally {
            closeLock.writeLock().unlock();
        }
        items.offer(POISON);
    }

    @Override
    public Optional<T> receive() throws InterruptedException {
        return poll(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
    }

    @Override
    public Optional<T> poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        long deadline = System.nanoTime() + nanos;
        while (true) {
            // once closed no send is in flight, so an empty queue means end of stream
            boolean wasClosed = closed;
            Object o = wasClosed ? items.poll() : items.poll(Math.min(nanos, WAKEUP_NANOS), TimeUnit.NANOSECONDS);
            if (o == POISON) {
                items.offer(POISON); // leave it for the other receivers
                return Optional.empty();
            }
            if (o != null) return Optional.of(cast(o));
            if (wasClosed) return Optional.empty();
            nanos = deadline - System.nanoTime();
            if (nanos <= 0L) return Optional.empty();
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> T cast(Object o) { return (T) o; }

    @Override
    public boolean isClosed() { return closed; }

    @Override
    public boolean isDrained() {
        if (!closed) return false;
        Object head = items.peek();
        return head == null || head == POISON;
    }

    public int size() {
        int n = items.size();
        return items.contains(POISON) ? n - 1 : n;
    }

    public int capacity() { return capacity; }
    public String name() { return name; }

    @Override
    public String toString() {
        return "BoundedChannel{" + name + ", capacity=" + capacity + '}';
    }
}

package io.linedecode.core;

import io.linedecode.error.ReceiveInterruptedException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Read-only end of a bounded channel. Elements become available as producers send them;
 * once the channel is closed and drained every receive reports the end of the stream.
 */
public interface ReceiveChannel<T> extends Iterable<T> {

    /**
     * Blocks until an element is available or the channel is closed and empty.
     * Returns empty only in the latter case.
     */
    Optional<T> receive() throws InterruptedException;

    /**
     * Like {@link #receive()} but gives up after the timeout. Returns empty on timeout as well as
     * on end of stream; use {@link #isDrained()} to tell them apart.
     */
    Optional<T> poll(long timeout, TimeUnit unit) throws InterruptedException;

    boolean isClosed();

    /** Closed and nothing left to receive. */
    boolean isDrained();

    /** Receives until end of stream. */
    default List<T> drain() throws InterruptedException {
        List<T> out = new ArrayList<>();
        Optional<T> next;
        while ((next = receive()).isPresent()) {
            out.add(next.get());
        }
        return out;
    }

    /**
     * Blocking iteration until the channel is closed and drained. An interrupt while waiting
     * throws {@link ReceiveInterruptedException} with the interrupt flag set, so a partially
     * consumed channel is never mistaken for a finished one.
     */
    @Override
    default Iterator<T> iterator() {
        ReceiveChannel<T> channel = this;
        return new Iterator<>() {
            private Optional<T> next;

            @Override
            public boolean hasNext() {
                if (next == null) {
                    try {
                        next = receive();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new ReceiveInterruptedException(String.valueOf(channel), e);
                    }
                }
                return next.isPresent();
            }

            @Override
            public T next() {
                if (!hasNext()) throw new NoSuchElementException();
                T value = next.get();
                next = null;
                return value;
            }
        };
    }

    /** Lazily iterates; see {@link #iterator()} for interrupt handling. */
    default Stream<T> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL), false);
    }
}

package io.linedecode.runtime;

import io.linedecode.error.ReceiveInterruptedException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class BoundedChannelTest {
    @Test
    void receives_in_send_order_then_end_of_stream_after_close() throws Exception {
        BoundedChannel<String> ch = new BoundedChannel<>("t", 4);
        ch.send("a");
        ch.send("b");
        ch.close();
        assertTrue(ch.isClosed());
        assertFalse(ch.isDrained(), "buffered items survive close");
        assertEquals(Optional.of("a"), ch.receive());
        assertEquals(Optional.of("b"), ch.receive());
        assertEquals(Optional.empty(), ch.receive());
        assertTrue(ch.isDrained());
    }

    @Test
    void send_after_close_and_double_close_are_rejected() throws Exception {
        BoundedChannel<String> ch = new BoundedChannel<>("t", 1);
        ch.close();
        assertThrows(IllegalStateException.class, () -> ch.send("x"));
        assertThrows(IllegalStateException.class, ch::close);
    }

    @Test
    void offer_times_out_when_full() throws Exception {
        BoundedChannel<Integer> ch = new BoundedChannel<>("t", 2);
        assertTrue(ch.offer(1, 10, TimeUnit.MILLISECONDS));
        assertTrue(ch.offer(2, 10, TimeUnit.MILLISECONDS));
        assertFalse(ch.offer(3, 20, TimeUnit.MILLISECONDS));
        assertEquals(2, ch.size());
    }

    @Test
    void send_blocks_until_receiver_frees_space() throws Exception {
        BoundedChannel<Integer> ch = new BoundedChannel<>("t", 1);
        ch.send(1);
        CountDownLatch sent = new CountDownLatch(1);
        Thread producer = new Thread(() -> {
            try {
                ch.send(2);
                sent.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();
        assertFalse(sent.await(100, TimeUnit.MILLISECONDS), "producer should be blocked on full channel");
        assertEquals(Optional.of(1), ch.receive());
        assertTrue(sent.await(2, TimeUnit.SECONDS));
        assertEquals(Optional.of(2), ch.receive());
        producer.join(2000);
    }

    @Test
    void poll_times_out_on_open_empty_channel_and_close_wakes_receiver() throws Exception {
        BoundedChannel<String> ch = new BoundedChannel<>("t", 1);
        assertEquals(Optional.empty(), ch.poll(20, TimeUnit.MILLISECONDS));
        assertFalse(ch.isDrained());

        CountDownLatch done = new CountDownLatch(1);
        Thread consumer = new Thread(() -> {
            try {
                ch.receive();
                done.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        consumer.start();
        Thread.sleep(50);
        ch.close();
        assertTrue(done.await(2, TimeUnit.SECONDS), "close must release blocked receivers");
        consumer.join(2000);
    }

    @Test
    void iteration_and_stream_end_when_drained() throws Exception {
        BoundedChannel<Integer> ch = new BoundedChannel<>("t", 8);
        for (int i = 0; i < 5; i++) ch.send(i);
        ch.close();
        List<Integer> seen = ch.stream().collect(Collectors.toList());
        assertEquals(List.of(0, 1, 2, 3, 4), seen);
        assertFalse(ch.iterator().hasNext());
    }

    @Test
    void rejects_non_positive_capacity_and_null_items() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedChannel<String>("t", 0));
        BoundedChannel<String> ch = new BoundedChannel<>("t", 1);
        assertThrows(NullPointerException.class, () -> ch.send(null));
    }

    @Test
    void closing_a_full_channel_still_ends_every_receiver() throws Exception {
        BoundedChannel<Integer> ch = new BoundedChannel<>("t", 3);
        for (int i = 0; i < 3; i++) ch.send(i);
        ch.close(); // no room for the end marker
        List<Integer> got = java.util.Collections.synchronizedList(new java.util.ArrayList<>());
        List<Thread> receivers = new java.util.ArrayList<>();
        for (int r = 0; r < 4; r++) {
            Thread t = new Thread(() -> {
                try {
                    got.addAll(ch.drain());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            t.start();
            receivers.add(t);
        }
        for (Thread t : receivers) {
            t.join(2000);
            assertFalse(t.isAlive(), "receiver should see end of stream");
        }
        assertEquals(3, got.size());
        assertTrue(ch.isDrained());
        assertEquals(0, ch.size());
    }

    @Test
    void interrupted_iteration_throws_instead_of_ending_quietly() throws Exception {
        BoundedChannel<String> ch = new BoundedChannel<>("t", 2);
        Thread.currentThread().interrupt();
        try {
            assertThrows(ReceiveInterruptedException.class, () -> ch.iterator().hasNext());
            assertTrue(Thread.currentThread().isInterrupted(), "interrupt flag restored");
        } finally {
            Thread.interrupted();
        }
        assertFalse(ch.isClosed());
    }
}

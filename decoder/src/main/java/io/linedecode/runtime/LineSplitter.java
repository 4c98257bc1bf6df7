package io.linedecode.runtime;

import io.linedecode.core.Record;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;

/**
 * Cuts an input stream into {@code '\n'}-terminated records and pushes them onto the work channel
 * in input order. The delimiter stays part of each record. Bytes after the last delimiter are
 * dropped: an unterminated final line is never emitted.
 *
 * <p>The input stream is read but never closed; it belongs to the caller.
 */
public final class LineSplitter {
    static final byte DELIMITER = '\n';
    private static final int READ_BUFFER = 64 * 1024;
    private static final long LIVENESS_CHECK_MILLIS = 50;

    private final InputStream input;
    private final BoundedChannel<Record> work;
    private final int maxLineBytes;
    private final IntSupplier liveConsumers;
    private long emitted = 0;
    private boolean abandoned = false;

    /**
     * @param maxLineBytes longest accepted record including its delimiter, 0 for no limit
     * @param liveConsumers number of workers still pulling from {@code work}; when it drops to zero
     *                      while the channel is full, splitting stops since nobody can drain it
     */
    public LineSplitter(InputStream input, BoundedChannel<Record> work, int maxLineBytes, IntSupplier liveConsumers) {
        this.input = Objects.requireNonNull(input, "input");
        this.work = Objects.requireNonNull(work, "work");
        this.maxLineBytes = Math.max(0, maxLineBytes);
        this.liveConsumers = Objects.requireNonNull(liveConsumers, "liveConsumers");
    }

    /**
     * Reads to end of input. Returns normally at end of input; any other read failure propagates
     * after the records before it have been pushed. Does not close the work channel.
     */
    public void split() throws IOException, InterruptedException {
        byte[] buf = new byte[READ_BUFFER];
        ByteArrayOutputStream pending = new ByteArrayOutputStream(256);
        int n;
        while ((n = input.read(buf)) != -1) {
            int start = 0;
            for (int i = 0; i < n; i++) {
                if (buf[i] != DELIMITER) continue;
                append(pending, buf, start, i + 1 - start);
                if (!push(pending.toByteArray())) return;
                pending.reset();
                start = i + 1;
            }
            append(pending, buf, start, n - start);
        }
    }

    /** Records pushed onto the work channel so far. */
    public long emitted() { return emitted; }

    /** Whether splitting stopped early because no worker was left to take records. */
    public boolean abandoned() { return abandoned; }

    private void append(ByteArrayOutputStream pending, byte[] buf, int off, int len) throws IOException {
        if (len == 0) return;
        pending.write(buf, off, len);
        if (maxLineBytes > 0 && pending.size() > maxLineBytes) {
            throw new IOException("record " + emitted + " exceeds " + maxLineBytes + " bytes");
        }
    }

    private boolean push(byte[] line) throws InterruptedException {
        Record record = new Record(emitted, line);
        while (!work.offer(record, LIVENESS_CHECK_MILLIS, TimeUnit.MILLISECONDS)) {
            if (liveConsumers.getAsInt() == 0) {
                abandoned = true;
                return false;
            }
        }
        emitted++;
        return true;
    }
}

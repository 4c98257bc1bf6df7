package io.linedecode.core;

import java.nio.charset.StandardCharsets;

/**
 * One newline-delimited unit of input: the raw bytes of a line, delimiter included,
 * together with its zero-based position in the input.
 */
public final class Record {
    private final long seq; // line index within the input
    private final byte[] payload;

    public Record(long seq, byte[] payload) {
        this.seq = seq;
        this.payload = payload;
    }

    public long seq() { return seq; }
    public byte[] payload() { return payload; }
    public int length() { return payload.length; }

    @Override
    public String toString() {
        return "Record{" +
                "seq=" + seq +
                ", payload=" + new String(payload, StandardCharsets.UTF_8).stripTrailing() +
                '}';
    }
}

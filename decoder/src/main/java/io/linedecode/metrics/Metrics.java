package io.linedecode.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * The decoder's instruments, registered once per registry. Every session started by the same
 * decoder reports into the same meters.
 */
public class Metrics {
    public static final String RECORDS_READ = "linedecode.records.read";
    public static final String VALUES_DECODED = "linedecode.values.decoded";
    public static final String DECODE_ERRORS = "linedecode.errors.decode";
    public static final String READ_ERRORS = "linedecode.errors.read";
    public static final String DECODE_TIME = "linedecode.decode.time";
    public static final String SESSIONS = "linedecode.sessions";

    private final MetricRegistry registry;
    private final Meter recordsRead;
    private final Meter valuesDecoded;
    private final Meter decodeErrors;
    private final Meter readErrors;
    private final Timer decodeTime;
    private final Counter sessions;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
        this.recordsRead = registry.meter(RECORDS_READ);
        this.valuesDecoded = registry.meter(VALUES_DECODED);
        this.decodeErrors = registry.meter(DECODE_ERRORS);
        this.readErrors = registry.meter(READ_ERRORS);
        this.decodeTime = registry.timer(DECODE_TIME);
        this.sessions = registry.counter(SESSIONS);
    }

    public MetricRegistry registry() { return registry; }

    /** Records pushed by splitters onto work queues. */
    public Meter recordsRead() { return recordsRead; }
    public Meter valuesDecoded() { return valuesDecoded; }
    public Meter decodeErrors() { return decodeErrors; }
    public Meter readErrors() { return readErrors; }

    /** Factory call plus decode, per record, failures included. */
    public Timer decodeTime() { return decodeTime; }
    public Counter sessions() { return sessions; }
}

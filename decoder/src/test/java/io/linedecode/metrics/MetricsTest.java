package io.linedecode.metrics;

import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MetricsTest {
    @Test
    void instruments_are_registered_under_their_names() {
        MetricRegistry registry = new MetricRegistry();
        Metrics metrics = new Metrics(registry);
        metrics.recordsRead().mark(3);
        metrics.valuesDecoded().mark(2);
        metrics.decodeErrors().mark();
        metrics.sessions().inc();
        metrics.decodeTime().time().stop();

        assertEquals(3, registry.meter(Metrics.RECORDS_READ).getCount());
        assertEquals(2, registry.meter(Metrics.VALUES_DECODED).getCount());
        assertEquals(1, registry.meter(Metrics.DECODE_ERRORS).getCount());
        assertEquals(0, registry.meter(Metrics.READ_ERRORS).getCount());
        assertEquals(1, registry.counter(Metrics.SESSIONS).getCount());
        assertEquals(1, registry.timer(Metrics.DECODE_TIME).getCount());
    }

    @Test
    void wrappers_over_one_registry_share_instruments() {
        MetricRegistry registry = new MetricRegistry();
        new Metrics(registry).readErrors().mark();
        new Metrics(registry).readErrors().mark();
        assertEquals(2, registry.meter(Metrics.READ_ERRORS).getCount());
    }
}

package io.linedecode.runtime;

import com.codahale.metrics.MetricRegistry;
import io.linedecode.config.DecoderConfig;
import io.linedecode.core.RecordDecoder;
import io.linedecode.decode.DecoderSettings;
import io.linedecode.decode.DiagnosticLog;
import io.linedecode.metrics.Metrics;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Decodes newline-delimited records from an input stream on a fixed number of worker threads.
 *
 * <p>The decode function and diagnostic output can be swapped at any time. Each session takes a
 * snapshot of both when it starts, so a swap only affects sessions started afterwards.
 */
public class ParallelDecoder {
    private static final AtomicLong SESSION_IDS = new AtomicLong();

    private final DecoderConfig config;
    private final Metrics metrics;
    private final AtomicReference<DecoderSettings> settings;

    public ParallelDecoder() {
        this(DecoderConfig.defaults(), new MetricRegistry(), DecoderSettings.defaults());
    }

    public ParallelDecoder(DecoderConfig config, MetricRegistry registry, DecoderSettings settings) {
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = new Metrics(Objects.requireNonNull(registry, "registry"));
        this.settings = new AtomicReference<>(Objects.requireNonNull(settings, "settings"));
    }

    /**
     * Starts a session that splits {@code input} into lines and decodes each into a fresh value
     * from {@code factory} on {@code workers} threads. Returns at once; results and failures
     * arrive on the session's channels, which close when the session completes.
     *
     * @throws IllegalArgumentException if {@code workers < 1}
     */
    public <T> DecodeSession<T> decode(InputStream input, int workers, Supplier<? extends T> factory) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(factory, "factory");
        DecodeSession<T> session = new DecodeSession<>(SESSION_IDS.incrementAndGet(), input, workers, factory,
                settings.get(), config, metrics);
        session.start();
        return session;
    }

    /** {@link #decode(InputStream, int, Supplier)} with the configured worker count. */
    public <T> DecodeSession<T> decode(InputStream input, Supplier<? extends T> factory) {
        return decode(input, config.workers(), factory);
    }

    /** Replaces the decode function for sessions started from now on. */
    public void setDecodeFunction(RecordDecoder decoder) {
        Objects.requireNonNull(decoder, "decoder");
        settings.updateAndGet(s -> s.withDecoder(decoder));
    }

    /** Sends diagnostics of sessions started from now on to {@code out}. */
    public void setLogOutput(OutputStream out) {
        DiagnosticLog log = DiagnosticLog.to(out);
        settings.updateAndGet(s -> s.withDiagnostics(log));
    }

    public void discardLogOutput() {
        settings.updateAndGet(s -> s.withDiagnostics(DiagnosticLog.discard()));
    }

    public DecoderSettings settings() { return settings.get(); }
    public DecoderConfig config() { return config; }
    public MetricRegistry metricRegistry() { return metrics.registry(); }
}

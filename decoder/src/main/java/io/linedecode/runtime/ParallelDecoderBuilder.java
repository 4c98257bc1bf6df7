package io.linedecode.runtime;

import com.codahale.metrics.MetricRegistry;
import io.linedecode.config.DecoderConfig;
import io.linedecode.core.RecordDecoder;
import io.linedecode.decode.DecoderSettings;
import io.linedecode.decode.DiagnosticLog;

import java.io.OutputStream;
import java.util.Objects;

public class ParallelDecoderBuilder {
    private DecoderConfig config = DecoderConfig.defaults();
    private MetricRegistry metricRegistry = new MetricRegistry();
    private DecoderSettings settings = DecoderSettings.defaults();

    public ParallelDecoderBuilder config(DecoderConfig c) { this.config = Objects.requireNonNull(c); return this; }
    public ParallelDecoderBuilder workers(int n) { this.config = config.withWorkers(n); return this; }
    public ParallelDecoderBuilder bufferPerWorker(int n) { this.config = new DecoderConfig(config.workers(), n, config.maxLineBytes()); return this; }
    public ParallelDecoderBuilder maxLineBytes(int n) { this.config = new DecoderConfig(config.workers(), config.bufferPerWorker(), n); return this; }
    public ParallelDecoderBuilder metrics(MetricRegistry r) { this.metricRegistry = Objects.requireNonNull(r); return this; }
    public ParallelDecoderBuilder decoder(RecordDecoder d) { this.settings = settings.withDecoder(d); return this; }
    public ParallelDecoderBuilder logOutput(OutputStream out) { this.settings = settings.withDiagnostics(DiagnosticLog.to(out)); return this; }

    public ParallelDecoder build() {
        return new ParallelDecoder(config, metricRegistry, settings);
    }
}

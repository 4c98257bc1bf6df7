package io.linedecode.ingestor;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.linedecode.config.DecoderConfig;
import io.linedecode.core.RecordDecoder;
import io.linedecode.decode.DecoderSettings;
import io.linedecode.decode.JacksonRecordDecoder;
import io.linedecode.runtime.ParallelDecoder;

public class DecoderModule extends AbstractModule {
    private final DecoderConfig config;

    public DecoderModule(DecoderConfig config) { this.config = config; }

    public DecoderModule() { this(DecoderConfig.fromEnv()); }

    @Override
    protected void configure() {
        bind(DecoderConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton RecordDecoder recordDecoder() { return new JacksonRecordDecoder(); }

    @Provides @Singleton DecoderSettings settings(RecordDecoder decoder) { return DecoderSettings.defaults().withDecoder(decoder); }

    @Provides @Singleton ParallelDecoder parallelDecoder(MetricRegistry registry, DecoderSettings settings) {
        return new ParallelDecoder(config, registry, settings);
    }
}

package io.linedecode.decode;

import io.linedecode.core.RecordDecoder;

import java.util.Objects;

/**
 * Immutable decode strategy and diagnostic sink. A session captures one snapshot when it starts
 * and uses it until it closes.
 */
public final class DecoderSettings {
    private static final DecoderSettings DEFAULTS = new DecoderSettings(new JacksonRecordDecoder(), DiagnosticLog.discard());

    private final RecordDecoder decoder;
    private final DiagnosticLog diagnostics;

    private DecoderSettings(RecordDecoder decoder, DiagnosticLog diagnostics) {
        this.decoder = decoder;
        this.diagnostics = diagnostics;
    }

    /** Jackson JSON decoding, diagnostics discarded. */
    public static DecoderSettings defaults() { return DEFAULTS; }

    public RecordDecoder decoder() { return decoder; }
    public DiagnosticLog diagnostics() { return diagnostics; }

    public DecoderSettings withDecoder(RecordDecoder d) {
        return new DecoderSettings(Objects.requireNonNull(d, "decoder"), diagnostics);
    }

    public DecoderSettings withDiagnostics(DiagnosticLog l) {
        return new DecoderSettings(decoder, Objects.requireNonNull(l, "diagnostics"));
    }
}

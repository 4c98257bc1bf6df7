package io.linedecode.decode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Line-oriented diagnostic sink for session failures. Each line is prefixed with {@code [linedecode] }.
 * The default instance discards everything.
 */
public final class DiagnosticLog {
    private static final Logger log = LoggerFactory.getLogger(DiagnosticLog.class);

    public static final String PREFIX = "[linedecode] ";

    private static final DiagnosticLog DISCARD = new DiagnosticLog(OutputStream.nullOutputStream());

    private final OutputStream out;

    private DiagnosticLog(OutputStream out) {
        this.out = out;
    }

    public static DiagnosticLog discard() { return DISCARD; }

    public static DiagnosticLog to(OutputStream out) {
        return new DiagnosticLog(Objects.requireNonNull(out, "out"));
    }

    public boolean isDiscarding() { return this == DISCARD; }

    public void printf(String format, Object... args) {
        if (isDiscarding()) return;
        byte[] line = (PREFIX + String.format(format, args) + "\n").getBytes(StandardCharsets.UTF_8);
        synchronized (out) {
            try {
                out.write(line);
                out.flush();
            } catch (IOException e) {
                log.warn("Diagnostic output failed: {}", e.toString());
            }
        }
    }
}

package io.linedecode.error;

/**
 * The input stream failed before its natural end. Records split before the failure are still
 * decoded; anything after it, including a partially read line, is lost. The cause is usually an
 * {@link java.io.IOException}, but unchecked failures thrown by the stream are reported the same way.
 */
public final class InputReadException extends DecodePipelineException {
    private final long recordsRead;

    public InputReadException(long recordsRead, Throwable cause) {
        super("readlines: after " + recordsRead + " records: " + cause, cause);
        this.recordsRead = recordsRead;
    }

    public long recordsRead() { return recordsRead; }
}

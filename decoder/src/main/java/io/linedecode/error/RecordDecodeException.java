package io.linedecode.error;

/**
 * A record could not be decoded into its target value. The worker that hit it stops taking
 * further records, so a session reports at most one of these per worker.
 */
public final class RecordDecodeException extends DecodePipelineException {
    private final int workerId;
    private final long recordSeq;

    public RecordDecodeException(int workerId, long recordSeq, Throwable cause) {
        super("decoder " + workerId + ": record " + recordSeq + ": " + cause, cause);
        this.workerId = workerId;
        this.recordSeq = recordSeq;
    }

    public int workerId() { return workerId; }

    /** Zero-based line index of the failing record. */
    public long recordSeq() { return recordSeq; }
}

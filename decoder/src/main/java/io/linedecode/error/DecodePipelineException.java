package io.linedecode.error;

/**
 * A failure reported on a session's error stream. Never thrown at the caller of
 * {@code ParallelDecoder#decode}; received from {@code DecodeSession#errors()} instead.
 */
public abstract class DecodePipelineException extends Exception {

    protected DecodePipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}

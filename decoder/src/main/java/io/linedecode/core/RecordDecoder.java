package io.linedecode.core;

/**
 * Decodes the bytes of one record into a value instance obtained from the caller's factory.
 * A single decoder is shared by every worker of a session, so implementations must be safe
 * for concurrent use as long as each call gets its own target.
 */
@FunctionalInterface
public interface RecordDecoder {
    void decode(byte[] record, Object target) throws Exception;
}

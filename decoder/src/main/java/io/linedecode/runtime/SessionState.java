package io.linedecode.runtime;

/** Lifecycle of a {@link DecodeSession}. Transitions only move forward. */
public enum SessionState {
    /** Channels allocated, no thread started yet. */
    CREATED,
    /** Splitter still reading input while workers decode. */
    RUNNING,
    /** Input exhausted or failed; at least one worker may still be decoding. */
    DRAINING,
    /** Everything finished and both output channels closed. Terminal. */
    CLOSED
}

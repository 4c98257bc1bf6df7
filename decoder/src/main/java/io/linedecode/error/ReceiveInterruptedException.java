package io.linedecode.error;

/**
 * Thrown out of channel iteration when the consuming thread is interrupted while waiting. The
 * interrupt flag is set again before this is thrown; elements not yet received stay in the channel.
 */
public final class ReceiveInterruptedException extends RuntimeException {

    public ReceiveInterruptedException(String channel, InterruptedException cause) {
        super("interrupted while receiving from " + channel, cause);
    }
}

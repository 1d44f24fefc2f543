package io.blockring.cluster.exception;

/**
 * No usable membership snapshot: none has been published yet, or the latest one was
 * marked invalid. Callers decide whether to retry or skip the cycle.
 */
public final class RingUnavailableException extends RingException {

    public RingUnavailableException(final String message) {
        super(message);
    }
}

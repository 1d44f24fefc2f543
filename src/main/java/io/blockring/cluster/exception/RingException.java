package io.blockring.cluster.exception;

/**
 * Base type for failures raised while resolving ring ownership.
 */
public class RingException extends RuntimeException {

    public RingException(final String message) {
        super(message);
    }

    public RingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

package io.blockring.cluster.exception;

import lombok.Getter;

/**
 * A snapshot violates token uniqueness. The revision is rejected as a whole.
 */
@Getter
public final class SnapshotCorruptException extends RingException {
    private final long revision;

    public SnapshotCorruptException(final long revision, final String message) {
        super("Snapshot revision " + revision + " is corrupt: " + message);
        this.revision = revision;
    }
}

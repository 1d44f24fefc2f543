package io.blockring.cluster.membership.resolver.type;

import io.blockring.cluster.membership.resolver.ReplicaSet;
import io.blockring.cluster.ring.Ring;

import java.time.Instant;

/**
 * Maps a ring position to the members that own it.
 * <p>
 * Implementations must be deterministic for a given ring and hash, and safe for
 * concurrent use without locking.
 */
@FunctionalInterface
public interface ReplicationStrategy {

    /**
     * @param ring              immutable ring to resolve against
     * @param hash              unsigned 32-bit position
     * @param replicationFactor nominal number of owners, {@code >= 1}
     * @param now               instant member health is judged at
     * @return owners in ring order; never {@code null}
     */
    ReplicaSet get(Ring ring, int hash, int replicationFactor, Instant now);
}

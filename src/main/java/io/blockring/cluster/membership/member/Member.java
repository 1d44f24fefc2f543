package io.blockring.cluster.membership.member;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable membership entry, replaced on each heartbeat by the propagation layer.
 * <p>
 * Tokens are unsigned 32-bit ring positions stored in plain {@code int}s; compare them
 * with {@link Integer#compareUnsigned(int, int)}.
 */
public record Member(String id,
                     String address,
                     Set<Integer> tokens,
                     MemberState state,
                     Instant lastHeartbeat) {

    public Member {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address must not be blank");
        }
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(lastHeartbeat, "lastHeartbeat");
        tokens = tokens == null ? Set.of() : Set.copyOf(tokens);
    }

    public Member withHeartbeat(final Instant heartbeat) {
        return new Member(id, address, tokens, state, heartbeat);
    }
}

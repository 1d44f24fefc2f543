package io.blockring.cluster.membership.health.impl;

import io.blockring.cluster.membership.health.type.HealthPolicy;
import io.blockring.cluster.membership.member.Member;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A member is healthy while its last heartbeat is no older than the configured timeout,
 * whatever its declared state.
 */
@Getter
public final class HeartbeatHealthPolicy implements HealthPolicy {
    private final Duration heartbeatTimeout;

    public HeartbeatHealthPolicy(final Duration heartbeatTimeout) {
        Objects.requireNonNull(heartbeatTimeout, "heartbeatTimeout");
        if (heartbeatTimeout.isNegative() || heartbeatTimeout.isZero()) {
            throw new IllegalArgumentException("heartbeatTimeout must be > 0");
        }
        this.heartbeatTimeout = heartbeatTimeout;
    }

    @Override
    public boolean isHealthy(final Member member, final Instant now) {
        return Duration.between(member.lastHeartbeat(), now).compareTo(heartbeatTimeout) <= 0;
    }
}

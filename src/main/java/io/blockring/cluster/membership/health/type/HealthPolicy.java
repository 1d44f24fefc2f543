package io.blockring.cluster.membership.health.type;

import io.blockring.cluster.membership.member.Member;

import java.time.Instant;

/**
 * Decides whether a member may own replicas at the given instant. Implementations
 * must be pure: no side effects, no memory of past evaluations.
 */
@FunctionalInterface
public interface HealthPolicy {

    boolean isHealthy(Member member, Instant now);
}

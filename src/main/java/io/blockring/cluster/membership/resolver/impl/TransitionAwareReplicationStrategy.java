package io.blockring.cluster.membership.resolver.impl;

import io.blockring.cluster.membership.health.type.HealthPolicy;
import io.blockring.cluster.membership.member.Member;
import io.blockring.cluster.membership.resolver.ReplicaSet;
import io.blockring.cluster.membership.resolver.type.ReplicationStrategy;
import io.blockring.cluster.ring.Ring;
import io.blockring.cluster.ring.TokenIndex;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks the ring clockwise from the hash and collects distinct healthy members.
 * <ul>
 *   <li>Unhealthy members are skipped without being counted, so a dead member is
 *       replaced by the next healthy one instead of shrinking the set.</li>
 *   <li>Each {@code JOINING} or {@code LEAVING} member taken into the set raises the
 *       target by one, keeping a stable replica while it transitions.</li>
 *   <li>The walk stops once every distinct member was visited; the partial set that
 *       results is returned as is.</li>
 * </ul>
 */
@RequiredArgsConstructor
public final class TransitionAwareReplicationStrategy implements ReplicationStrategy {
    private final HealthPolicy healthPolicy;

    @Override
    public ReplicaSet get(final Ring ring, final int hash, final int replicationFactor, final Instant now) {
        if (replicationFactor < 1) {
            throw new IllegalArgumentException("replicationFactor must be >= 1");
        }
        final int distinct = ring.memberCount();
        if (distinct == 0) {
            return ReplicaSet.empty(replicationFactor);
        }

        int target = replicationFactor;
        final List<String> addresses = new ArrayList<>(target + 1);
        final Set<String> visited = new HashSet<>();

        for (final TokenIndex.Entry entry : ring.walk(ring.locate(hash))) {
            if (addresses.size() >= target || visited.size() >= distinct) break;
            if (!visited.add(entry.memberId())) continue;

            final Member member = ring.member(entry.memberId());
            if (!healthPolicy.isHealthy(member, now)) continue;
            if (addresses.contains(member.address())) continue;

            addresses.add(member.address());
            if (member.state().isTransitioning()) {
                target++;
            }
        }
        return new ReplicaSet(addresses, replicationFactor);
    }
}

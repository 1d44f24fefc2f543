package io.blockring.cluster.membership.resolver.impl;

import io.blockring.cluster.membership.health.impl.HeartbeatHealthPolicy;
import io.blockring.cluster.membership.member.Member;
import io.blockring.cluster.membership.member.MemberState;
import io.blockring.cluster.membership.resolver.ReplicaSet;
import io.blockring.cluster.membership.snapshot.MembershipSnapshot;
import io.blockring.cluster.ring.Ring;
import io.blockring.cluster.ring.TokenGenerator;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

final class TransitionAwareReplicationStrategyTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private final TransitionAwareReplicationStrategy strategy =
            new TransitionAwareReplicationStrategy(new HeartbeatHealthPolicy(Duration.ofMinutes(1)));

    private static Member member(final String id, final MemberState state, final Integer... tokens) {
        return new Member(id, "addr-" + id, Set.of(tokens), state, NOW);
    }

    private static Member stale(final Member m) {
        return m.withHeartbeat(NOW.minus(Duration.ofHours(1)));
    }

    private static Ring ring(final Member... members) {
        final MembershipSnapshot.Builder b = MembershipSnapshot.builder(1, CLOCK);
        Arrays.stream(members).forEach(b::addMember);
        return Ring.of(b.build());
    }

    @Test
    void judgesHealthAtTheSuppliedInstant() {
        final Ring ring = ring(member("a", MemberState.ACTIVE, 100), member("b", MemberState.ACTIVE, 200));
        assertEquals(List.of("addr-a"), strategy.get(ring, 50, 1, NOW).addresses());
        assertTrue(strategy.get(ring, 50, 1, NOW.plus(Duration.ofMinutes(2))).isEmpty(),
                "members are stale two minutes after their heartbeat");
    }

    @Test
    void walksClockwiseFromTheHash() {
        final Ring ring = ring(
                member("a", MemberState.ACTIVE, 100),
                member("b", MemberState.ACTIVE, 200),
                member("c", MemberState.ACTIVE, 300));

        assertEquals(List.of("addr-b", "addr-c"), strategy.get(ring, 150, 2, NOW).addresses());
        assertEquals(List.of("addr-a", "addr-b"), strategy.get(ring, 301, 2, NOW).addresses(), "wraps past the last token");
        assertEquals(List.of("addr-a"), strategy.get(ring, 100, 1, NOW).addresses(), "a token owns its own position");
    }

    @Test
    void dedupesMembersOwningSeveralTokens() {
        final Ring ring = ring(
                member("a", MemberState.ACTIVE, 100, 110, 120),
                member("b", MemberState.ACTIVE, 200));

        final ReplicaSet set = strategy.get(ring, 90, 2, NOW);
        assertEquals(List.of("addr-a", "addr-b"), set.addresses());
        assertFalse(set.isDegraded());
    }

    @Test
    void unhealthyMembersAreSkippedNotCounted() {
        final Ring ring = ring(
                member("a", MemberState.ACTIVE, 100),
                stale(member("b", MemberState.ACTIVE, 200)),
                member("c", MemberState.ACTIVE, 300));

        assertEquals(List.of("addr-c"), strategy.get(ring, 150, 1, NOW).addresses());
        assertEquals(List.of("addr-c", "addr-a"), strategy.get(ring, 150, 2, NOW).addresses());
    }

    @Test
    void transitioningMemberAddsOneStableReplica() {
        for (final MemberState state : List.of(MemberState.JOINING, MemberState.LEAVING)) {
            final Ring ring = ring(
                    member("a", MemberState.ACTIVE, 100),
                    member("b", state, 200),
                    member("c", MemberState.ACTIVE, 300),
                    member("d", MemberState.ACTIVE, 400));

            final ReplicaSet set = strategy.get(ring, 150, 2, NOW);
            assertEquals(List.of("addr-b", "addr-c", "addr-d"), set.addresses(), state.name());
            assertEquals(2, set.replicationFactor());
        }
    }

    @Test
    void eachTransitioningMemberExtendsIndependently() {
        final Ring ring = ring(
                member("a", MemberState.ACTIVE, 100),
                member("b", MemberState.JOINING, 200),
                member("c", MemberState.LEAVING, 300),
                member("d", MemberState.ACTIVE, 400));

        assertEquals(List.of("addr-b", "addr-c", "addr-d"), strategy.get(ring, 150, 1, NOW).addresses());
    }

    @Test
    void unhealthyTransitioningMemberDoesNotExtend() {
        final Ring ring = ring(
                member("a", MemberState.ACTIVE, 100),
                stale(member("b", MemberState.LEAVING, 200)),
                member("c", MemberState.ACTIVE, 300));

        assertEquals(List.of("addr-c"), strategy.get(ring, 150, 1, NOW).addresses());
    }

    @Test
    void partialSetWhenTooFewHealthyMembers() {
        final Ring ring = ring(
                member("a", MemberState.ACTIVE, 100),
                stale(member("b", MemberState.ACTIVE, 200)),
                stale(member("c", MemberState.ACTIVE, 300)));

        final ReplicaSet set = strategy.get(ring, 250, 3, NOW);
        assertEquals(List.of("addr-a"), set.addresses());
        assertTrue(set.isDegraded());
    }

    @Test
    void emptyRingResolvesToEmptySet() {
        final ReplicaSet set = strategy.get(ring(member("a", MemberState.ACTIVE)), 5, 1, NOW);
        assertTrue(set.isEmpty());
        assertTrue(set.isDegraded());
    }

    @Test
    void rejectsNonPositiveReplicationFactor() {
        final Ring ring = ring(member("a", MemberState.ACTIVE, 1));
        assertThrows(IllegalArgumentException.class, () -> strategy.get(ring, 0, 0, NOW));
    }

    @Test
    void propertiesHoldOnRandomRings() {
        final Random random = new Random(42);
        for (int round = 0; round < 20; round++) {
            final MembershipSnapshot.Builder b = MembershipSnapshot.builder(round, CLOCK);
            final Set<Integer> taken = new HashSet<>();
            final Set<String> healthy = new HashSet<>();
            final Set<String> unhealthy = new HashSet<>();
            final int members = 2 + random.nextInt(8);
            for (int i = 0; i < members; i++) {
                final int[] tokens = TokenGenerator.generate(16, taken, random);
                Arrays.stream(tokens).forEach(taken::add);
                final Set<Integer> owned = Arrays.stream(tokens).boxed().collect(Collectors.toSet());
                Member m = new Member("m" + i, "10.0.0." + i, owned, MemberState.ACTIVE, NOW);
                if (random.nextInt(4) == 0) {
                    m = stale(m);
                    unhealthy.add(m.address());
                } else {
                    healthy.add(m.address());
                }
                b.addMember(m);
            }
            final Ring ring = Ring.of(b.build());

            for (int k = 0; k < 200; k++) {
                final int hash = random.nextInt();
                final int rf = 1 + random.nextInt(members + 1);
                final ReplicaSet set = strategy.get(ring, hash, rf, NOW);

                assertEquals(set, strategy.get(ring, hash, rf, NOW), "determinism");
                assertEquals(set.size(), new HashSet<>(set.addresses()).size(), "no duplicates");
                set.addresses().forEach(a -> assertFalse(unhealthy.contains(a), "unhealthy " + a + " selected"));
                assertEquals(Math.min(rf, healthy.size()), set.size(), "size");
                if (rf >= healthy.size()) {
                    assertEquals(healthy, new HashSet<>(set.addresses()), "saturation covers every healthy member");
                }
            }
        }
    }
}

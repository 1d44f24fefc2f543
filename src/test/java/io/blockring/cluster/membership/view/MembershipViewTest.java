package io.blockring.cluster.membership.view;

import io.blockring.cluster.exception.RingUnavailableException;
import io.blockring.cluster.exception.SnapshotCorruptException;
import io.blockring.cluster.membership.member.MemberState;
import io.blockring.cluster.membership.snapshot.MembershipSnapshot;
import io.blockring.cluster.ring.Ring;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class MembershipViewTest {

    private static MembershipSnapshot snapshot(final long revision, final int... tokens) {
        final MembershipSnapshot.Builder b = MembershipSnapshot.builder(revision);
        for (int i = 0; i < tokens.length; i++) {
            b.addMember("m" + i, "10.0.0." + i, Set.of(tokens[i]), MemberState.ACTIVE);
        }
        return b.build();
    }

    @Test
    void coldStartIsUnavailable() {
        final MembershipView view = new MembershipView();
        assertThrows(RingUnavailableException.class, view::ring);
        assertEquals(Optional.empty(), view.revision());
    }

    @Test
    void newerRevisionsReplaceOlderOnesAreIgnored() {
        final MembershipView view = new MembershipView();
        assertTrue(view.publish(snapshot(2, 10, 20)));
        final Ring first = view.ring();
        assertEquals(2, first.revision());

        assertFalse(view.publish(snapshot(2, 30)), "same revision");
        assertFalse(view.publish(snapshot(1, 30)), "older revision");
        assertSame(first, view.ring());

        assertTrue(view.publish(snapshot(3, 30)));
        assertEquals(3, view.ring().revision());
        assertEquals(1, view.ring().memberCount());
    }

    @Test
    void corruptSnapshotKeepsServingThePreviousRing() {
        final MembershipView view = new MembershipView();
        view.publish(snapshot(1, 10, 20));
        final Ring good = view.ring();

        assertThrows(SnapshotCorruptException.class, () -> view.publish(snapshot(2, 10, 10)));
        assertSame(good, view.ring());
        assertEquals(Optional.of(1L), view.revision());

        assertTrue(view.publish(snapshot(2, 10, 11)), "the rejected revision can be republished fixed");
    }

    @Test
    void invalidSnapshotMakesTheRingUnavailableUntilReplaced() {
        final MembershipView view = new MembershipView();
        view.publish(snapshot(1, 10));

        assertFalse(view.invalidate(7), "only the current revision can be invalidated");
        assertTrue(view.invalidate(1));
        final RingUnavailableException e = assertThrows(RingUnavailableException.class, view::ring);
        assertTrue(e.getMessage().contains("revision 1"), e.getMessage());

        view.publish(snapshot(2, 10).invalidated());
        assertThrows(RingUnavailableException.class, view::ring);

        view.publish(snapshot(3, 10));
        assertEquals(3, view.ring().revision());
    }

    @Test
    void readersNeverSeeATornRing() throws Exception {
        final MembershipView view = new MembershipView();
        view.publish(snapshot(1, 1, 2));

        final ExecutorService exec = Executors.newFixedThreadPool(4);
        final CountDownLatch start = new CountDownLatch(1);
        final List<Future<?>> readers = new ArrayList<>();
        for (int t = 0; t < 3; t++) {
            readers.add(exec.submit(() -> {
                start.await();
                for (int i = 0; i < 10_000; i++) {
                    final Ring r = view.ring();
                    // revision N has N+1 members, each with one token
                    assertEquals(r.revision() + 1, r.getIndex().size());
                    assertEquals(r.getSnapshot().members().size(), r.memberCount());
                }
                return null;
            }));
        }

        start.countDown();
        for (int rev = 2; rev < 200; rev++) {
            final int[] tokens = new int[rev + 1];
            for (int i = 0; i < tokens.length; i++) tokens[i] = i * 7 + rev;
            view.publish(snapshot(rev, tokens));
        }
        for (final Future<?> f : readers) {
            f.get(10, TimeUnit.SECONDS);
        }
        exec.shutdown();
        assertTrue(exec.awaitTermination(5, TimeUnit.SECONDS), "executor did not finish");
    }
}

package io.blockring.cluster.membership.view;

import io.blockring.cluster.exception.RingUnavailableException;
import io.blockring.cluster.exception.SnapshotCorruptException;
import io.blockring.cluster.membership.snapshot.MembershipSnapshot;
import io.blockring.cluster.ring.Ring;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Local view of cluster membership, fed by the external propagation layer.
 * <p>
 * Each accepted snapshot is indexed before it becomes visible and then swapped in with
 * a single reference write, so readers see either the previous ring or the new one in
 * full. Writers are serialized; readers never block.
 */
@Slf4j
public final class MembershipView {

    /** Latest accepted revision and the ring built for it, or none while invalid. */
    private record Published(long revision, Ring ring, boolean valid) {
    }

    private final AtomicReference<Published> current = new AtomicReference<>();

    /**
     * Publishes a newer snapshot. Revisions not above the current one are ignored.
     *
     * @return {@code true} if the snapshot replaced the current view
     * @throws SnapshotCorruptException if the snapshot violates token uniqueness; the
     *                                  previously published ring keeps being served
     */
    public synchronized boolean publish(final MembershipSnapshot snapshot) {
        final Published prev = current.get();
        if (prev != null && snapshot.revision() <= prev.revision()) {
            log.warn("Ignoring stale membership snapshot revision {} (current {})",
                    snapshot.revision(), prev.revision());
            return false;
        }

        if (!snapshot.valid()) {
            current.set(new Published(snapshot.revision(), null, false));
            log.warn("Membership snapshot revision {} is marked invalid; ring unavailable", snapshot.revision());
            return true;
        }

        final Ring ring;
        try {
            ring = Ring.of(snapshot);
        } catch (final SnapshotCorruptException e) {
            log.error("Rejecting membership snapshot revision {}, keeping revision {}: {}",
                    snapshot.revision(), prev == null ? "none" : prev.revision(), e.getMessage());
            throw e;
        }

        current.set(new Published(snapshot.revision(), ring, true));
        log.info("Published {}", ring);
        return true;
    }

    /**
     * Marks the given revision invalid if it is still the current one.
     *
     * @return {@code true} if the current view was invalidated
     */
    public synchronized boolean invalidate(final long revision) {
        final Published prev = current.get();
        if (prev == null || prev.revision() != revision) {
            return false;
        }
        current.set(new Published(revision, null, false));
        log.warn("Membership snapshot revision {} invalidated; ring unavailable", revision);
        return true;
    }

    /**
     * The ring to resolve ownership against.
     *
     * @throws RingUnavailableException if no snapshot was ever published, or the latest one is invalid
     */
    public Ring ring() {
        final Published p = current.get();
        if (p == null) {
            throw new RingUnavailableException("no membership snapshot has been observed yet");
        }
        if (!p.valid()) {
            throw new RingUnavailableException("membership snapshot revision " + p.revision() + " is marked invalid");
        }
        return p.ring();
    }

    public Optional<Long> revision() {
        final Published p = current.get();
        return p == null ? Optional.empty() : Optional.of(p.revision());
    }
}

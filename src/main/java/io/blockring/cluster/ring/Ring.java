package io.blockring.cluster.ring;

import io.blockring.cluster.membership.member.Member;
import io.blockring.cluster.membership.snapshot.MembershipSnapshot;
import lombok.Getter;

/**
 * A membership snapshot paired with its token index: the single immutable value a
 * replication strategy reads. Built once per snapshot revision.
 */
@Getter
public final class Ring {
    private final MembershipSnapshot snapshot;
    private final TokenIndex index;

    private Ring(final MembershipSnapshot snapshot, final TokenIndex index) {
        this.snapshot = snapshot;
        this.index = index;
    }

    /**
     * @throws io.blockring.cluster.exception.SnapshotCorruptException on duplicate tokens
     */
    public static Ring of(final MembershipSnapshot snapshot) {
        return new Ring(snapshot, TokenIndex.build(snapshot));
    }

    public long revision() {
        return snapshot.revision();
    }

    public Member member(final String id) {
        return snapshot.member(id);
    }

    /** Distinct members reachable by a walk, i.e. owning at least one token. */
    public int memberCount() {
        return index.distinctOwners();
    }

    public int locate(final int hash) {
        return index.locate(hash);
    }

    public Iterable<TokenIndex.Entry> walk(final int cursor) {
        return index.walk(cursor);
    }

    @Override
    public String toString() {
        return "Ring{revision=" + revision() + ", members=" + snapshot.members().size()
                + ", tokens=" + index.size() + "}";
    }
}

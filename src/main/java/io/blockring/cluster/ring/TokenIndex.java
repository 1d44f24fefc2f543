package io.blockring.cluster.ring;

import io.blockring.cluster.exception.SnapshotCorruptException;
import io.blockring.cluster.membership.member.Member;
import io.blockring.cluster.membership.snapshot.MembershipSnapshot;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Sorted projection of every token in a {@link MembershipSnapshot}.
 * <p>
 * Two parallel arrays hold the ring: {@code tokens[i]} is owned by {@code owners[i]},
 * sorted ascending by unsigned token value. Instances are immutable and replaced as a
 * whole when the snapshot revision changes.
 */
public final class TokenIndex {

    /** One ring position and the member that claimed it. */
    public record Entry(int token, String memberId) {
        @Override
        public String toString() {
            return Integer.toUnsignedString(token) + "@" + memberId;
        }
    }

    private static final Comparator<Entry> BY_UNSIGNED_TOKEN =
            (a, b) -> Integer.compareUnsigned(a.token(), b.token());

    private final int[] tokens;
    private final String[] owners;
    private final int distinctOwners;

    private TokenIndex(final int[] tokens, final String[] owners) {
        this.tokens = tokens;
        this.owners = owners;
        this.distinctOwners = new HashSet<>(Arrays.asList(owners)).size();
    }

    /**
     * Flattens and sorts all member tokens of the snapshot.
     *
     * @throws SnapshotCorruptException if two members (or one member twice) claim the same token
     */
    public static TokenIndex build(final MembershipSnapshot snapshot) {
        final List<Entry> entries = new ArrayList<>();
        for (final Member m : snapshot.all()) {
            for (final int token : m.tokens()) {
                entries.add(new Entry(token, m.id()));
            }
        }
        entries.sort(BY_UNSIGNED_TOKEN);

        final int[] toks = new int[entries.size()];
        final String[] own = new String[entries.size()];
        for (int i = 0; i < entries.size(); i++) {
            final Entry e = entries.get(i);
            if (i > 0 && toks[i - 1] == e.token()) {
                throw new SnapshotCorruptException(snapshot.revision(),
                        "token " + Integer.toUnsignedString(e.token()) + " claimed by both '"
                                + own[i - 1] + "' and '" + e.memberId() + "'");
            }
            toks[i] = e.token();
            own[i] = e.memberId();
        }
        return new TokenIndex(toks, own);
    }

    public int size() {
        return tokens.length;
    }

    public boolean isEmpty() {
        return tokens.length == 0;
    }

    /** Number of distinct members owning at least one token. */
    public int distinctOwners() {
        return distinctOwners;
    }

    /**
     * Returns the index of the first token {@code >= hash} under unsigned comparison,
     * wrapping to 0 when {@code hash} is past the last token. An empty index returns 0.
     */
    public int locate(final int hash) {
        int lo = 0;
        int hi = tokens.length;
        while (lo < hi) {
            final int mid = (lo + hi) >>> 1;
            if (Integer.compareUnsigned(tokens[mid], hash) < 0) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo == tokens.length ? 0 : lo;
    }

    /**
     * Clockwise walk starting at {@code cursor}. Every iterator restarts at the cursor
     * and ends after one full revolution, so a walk never yields more than
     * {@link #size()} entries.
     */
    public Iterable<Entry> walk(final int cursor) {
        if (!isEmpty() && (cursor < 0 || cursor >= tokens.length)) {
            throw new IndexOutOfBoundsException("cursor " + cursor + " outside ring of " + tokens.length);
        }
        return () -> new Iterator<>() {
            private int step;

            @Override
            public boolean hasNext() {
                return step < tokens.length;
            }

            @Override
            public Entry next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                final int idx = (cursor + step++) % tokens.length;
                return new Entry(tokens[idx], owners[idx]);
            }
        };
    }
}

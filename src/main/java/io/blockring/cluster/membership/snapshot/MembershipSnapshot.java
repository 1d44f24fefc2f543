package io.blockring.cluster.membership.snapshot;

import io.blockring.cluster.membership.member.Member;
import io.blockring.cluster.membership.member.MemberState;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, versioned table of ring members as materialized by the propagation layer.
 * <p>
 * Members in state {@link MemberState#LEFT} are dropped on construction: leaving the
 * ring is a removal, never a visible state. Token uniqueness is checked when the
 * snapshot is indexed, not here.
 */
public record MembershipSnapshot(long revision, Map<String, Member> members, boolean valid) {

    public MembershipSnapshot(final long revision,
                              final Map<String, Member> members,
                              final boolean valid) {
        if (revision < 0) {
            throw new IllegalArgumentException("revision must be >= 0");
        }
        final Map<String, Member> live = new LinkedHashMap<>();
        if (members != null) {
            for (final Map.Entry<String, Member> e : members.entrySet()) {
                final Member m = e.getValue();
                if (!e.getKey().equals(m.id())) {
                    throw new IllegalArgumentException("member keyed as '" + e.getKey() + "' has id '" + m.id() + "'");
                }
                if (m.state() != MemberState.LEFT) {
                    live.put(m.id(), m);
                }
            }
        }
        this.revision = revision;
        this.members = Collections.unmodifiableMap(live);
        this.valid = valid;
    }

    public Member member(final String id) {
        return members.get(id);
    }

    public Collection<Member> all() {
        return members.values();
    }

    public MembershipSnapshot invalidated() {
        return new MembershipSnapshot(revision, members, false);
    }

    public static Builder builder(final long revision) {
        return new Builder(revision, Clock.systemUTC());
    }

    public static Builder builder(final long revision, final Clock clock) {
        return new Builder(revision, clock);
    }

    public static final class Builder {
        private final long revision;
        private final Clock clock;
        private final Map<String, Member> members = new LinkedHashMap<>();
        private boolean valid = true;

        private Builder(final long revision, final Clock clock) {
            this.revision = revision;
            this.clock = clock;
        }

        /** Adds a member whose last heartbeat is the builder clock's current instant. */
        public Builder addMember(final String id,
                                 final String address,
                                 final Set<Integer> tokens,
                                 final MemberState state) {
            return addMember(new Member(id, address, tokens, state, Instant.now(clock)));
        }

        public Builder addMember(final Member member) {
            members.put(member.id(), member);
            return this;
        }

        public Builder valid(final boolean valid) {
            this.valid = valid;
            return this;
        }

        public MembershipSnapshot build() {
            return new MembershipSnapshot(revision, members, valid);
        }
    }
}

package io.blockring.cluster.membership.resolver;

import java.util.List;

/**
 * Ordered, duplicate-free member addresses owning one hash, together with the
 * replication factor they were resolved for.
 * <p>
 * The set may hold fewer addresses than requested when the ring lacks healthy members
 * (see {@link #isDegraded()}), and more when the walk crossed transitioning members.
 */
public record ReplicaSet(List<String> addresses, int replicationFactor) {

    public ReplicaSet {
        addresses = List.copyOf(addresses);
    }

    public static ReplicaSet empty(final int replicationFactor) {
        return new ReplicaSet(List.of(), replicationFactor);
    }

    public boolean contains(final String address) {
        return addresses.contains(address);
    }

    public int size() {
        return addresses.size();
    }

    public boolean isEmpty() {
        return addresses.isEmpty();
    }

    public boolean isDegraded() {
        return addresses.size() < replicationFactor;
    }
}

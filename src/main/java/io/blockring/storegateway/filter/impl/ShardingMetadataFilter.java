package io.blockring.storegateway.filter.impl;

import io.blockring.block.BlockId;
import io.blockring.block.hash.type.BlockHasher;
import io.blockring.cluster.membership.resolver.ReplicaSet;
import io.blockring.cluster.membership.resolver.type.ReplicationStrategy;
import io.blockring.cluster.membership.view.MembershipView;
import io.blockring.cluster.ring.Ring;
import io.blockring.metrics.SyncedGauge;
import io.blockring.storegateway.filter.type.MetadataFilter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps only the blocks this instance owns according to the ring.
 * <p>
 * Every block is hashed onto the ring and resolved to its replica set; blocks whose set
 * does not contain the local instance address are removed from the caller's map and
 * counted under {@link #SHARD_EXCLUDED}. The clock is read once per call, so every block
 * of one cycle sees the same member health.
 *
 * @param <M> block metadata type
 */
@Slf4j
public final class ShardingMetadataFilter<M> implements MetadataFilter<M> {
    public static final String SHARD_EXCLUDED = "shard-excluded";

    private final MembershipView view;
    private final ReplicationStrategy strategy;
    private final BlockHasher hasher;
    private final String instanceAddress;
    private final int replicationFactor;
    private final Clock clock;

    public ShardingMetadataFilter(final MembershipView view,
                                  final ReplicationStrategy strategy,
                                  final BlockHasher hasher,
                                  final String instanceAddress,
                                  final int replicationFactor,
                                  final Clock clock) {
        if (replicationFactor < 1) {
            throw new IllegalArgumentException("replicationFactor must be >= 1");
        }
        if (instanceAddress == null || instanceAddress.isBlank()) {
            throw new IllegalArgumentException("instanceAddress must not be blank");
        }
        this.view = Objects.requireNonNull(view, "view");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.instanceAddress = instanceAddress;
        this.replicationFactor = replicationFactor;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @throws io.blockring.cluster.exception.RingUnavailableException if there is no usable
     *         membership snapshot; {@code metas} is left untouched
     */
    @Override
    public void filter(final Map<BlockId, M> metas, final SyncedGauge synced) {
        final Ring ring = view.ring();
        final Instant now = clock.instant();

        int excluded = 0;
        int degraded = 0;
        final Iterator<BlockId> it = metas.keySet().iterator();
        while (it.hasNext()) {
            final BlockId id = it.next();
            final ReplicaSet replicas = strategy.get(ring, hasher.hash(id), replicationFactor, now);
            if (replicas.isDegraded()) {
                degraded++;
                log.debug("Block {} resolved to {} of {} replicas: {}",
                        id, replicas.size(), replicationFactor, replicas.addresses());
            }
            if (!replicas.contains(instanceAddress)) {
                it.remove();
                excluded++;
            }
        }

        synced.add(SHARD_EXCLUDED, excluded);
        log.debug("Sharding filter on {} at ring revision {}: kept={} excluded={} degraded={}",
                instanceAddress, ring.revision(), metas.size(), excluded, degraded);
    }
}

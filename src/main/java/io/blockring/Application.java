package io.blockring;

import io.blockring.block.BlockId;
import io.blockring.block.hash.impl.Fnv32BlockHasher;
import io.blockring.cluster.exception.RingException;
import io.blockring.cluster.membership.health.impl.HeartbeatHealthPolicy;
import io.blockring.cluster.membership.resolver.impl.TransitionAwareReplicationStrategy;
import io.blockring.cluster.membership.view.MembershipView;
import io.blockring.config.impl.GatewayConfig;
import io.blockring.config.type.ConfigLoader;
import io.blockring.metrics.SyncedGauge;
import io.blockring.storegateway.filter.impl.ShardingMetadataFilter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;

/**
 * Runs one sharding cycle: loads the gateway config, the membership snapshot and the
 * discovered block ids, then reports which blocks this instance owns.
 */
@Slf4j
public class Application {
    static final String SYNCED_METRIC = "blockring_blocks_meta_synced";

    public static void main(final String[] args) throws Exception {
        if (args.length < 1) {
            System.err.println("Usage: java -jar blockring.jar <gateway-config.yaml>");
            System.exit(1);
        }

        final Path configPath = Paths.get(args[0]).toAbsolutePath();
        final GatewayConfig cfg = ConfigLoader.load(configPath);
        final Path base = configPath.getParent();

        final MembershipView view = new MembershipView();

        final Map<BlockId, Path> metas = new TreeMap<>();
        for (final BlockId id : ConfigLoader.loadBlockIds(base.resolve(cfg.getBlocksFile()))) {
            metas.put(id, Paths.get(id.toString()));
        }
        final int discovered = metas.size();

        final ShardingMetadataFilter<Path> filter = new ShardingMetadataFilter<>(
                view,
                new TransitionAwareReplicationStrategy(new HeartbeatHealthPolicy(cfg.getHeartbeatTimeout())),
                new Fnv32BlockHasher(),
                cfg.getInstanceAddress(),
                cfg.getReplicationFactor(),
                Clock.systemUTC());

        final SyncedGauge synced = new SyncedGauge(new SimpleMeterRegistry(), SYNCED_METRIC, "state");
        synced.set(ShardingMetadataFilter.SHARD_EXCLUDED, 0);
        try {
            view.publish(ConfigLoader.loadSnapshot(base.resolve(cfg.getRingFile())));
            filter.filter(metas, synced);
        } catch (final RingException e) {
            log.error("Sharding cycle skipped: {}", e.getMessage());
            System.exit(2);
        }
        synced.submit();

        log.info("Instance {} owns {} of {} blocks ({} excluded by sharding, RF={})",
                cfg.getInstanceAddress(), metas.size(), discovered,
                (long) synced.value(ShardingMetadataFilter.SHARD_EXCLUDED), cfg.getReplicationFactor());
        metas.keySet().forEach(id -> log.info("  {}", id));
    }
}

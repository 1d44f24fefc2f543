package io.blockring.storegateway.filter.type;

import io.blockring.block.BlockId;
import io.blockring.metrics.SyncedGauge;

import java.util.Map;

/**
 * One stage of the block metadata sync. A stage removes the blocks it rejects from the
 * caller's map in place and accounts for them under its own label of {@code synced}.
 *
 * @param <M> opaque block metadata, never inspected by filters keyed on the id alone
 */
@FunctionalInterface
public interface MetadataFilter<M> {

    void filter(Map<BlockId, M> metas, SyncedGauge synced);
}

package io.blockring.block.hash.type;

import io.blockring.block.BlockId;

/**
 * Maps a block to its unsigned 32-bit ring position. Every member of a cluster must
 * use the same implementation, and the result must be stable across restarts.
 */
@FunctionalInterface
public interface BlockHasher {

    int hash(BlockId id);
}

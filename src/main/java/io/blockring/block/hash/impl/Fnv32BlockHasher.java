package io.blockring.block.hash.impl;

import io.blockring.block.BlockId;
import io.blockring.block.hash.type.BlockHasher;

/** 32-bit FNV-1 (multiply, then xor) over the 16 identifier bytes. */
public final class Fnv32BlockHasher implements BlockHasher {
    private static final int OFFSET_BASIS = 0x811C9DC5;
    private static final int PRIME = 0x01000193;

    @Override
    public int hash(final BlockId id) {
        int h = OFFSET_BASIS;
        for (int i = 0; i < BlockId.BYTES; i++) {
            h *= PRIME;
            h ^= id.byteAt(i) & 0xFF;
        }
        return h;
    }
}

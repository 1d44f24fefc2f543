package io.blockring.block;

import com.github.f4b6a3.ulid.Ulid;

import java.util.Objects;

/**
 * 128-bit block identifier in ULID layout: a 48-bit big-endian millisecond timestamp
 * followed by 80 bits of entropy. Ordering is unsigned lexicographic over the bytes,
 * which matches both creation time and the canonical text form.
 * <p>
 * The text form is 26 characters of Crockford base32, e.g.
 * {@code 01ARYZ6S41000G40R40M30E209}.
 */
public final class BlockId implements Comparable<BlockId> {
    public static final int BYTES = 16;
    public static final int TEXT_LENGTH = 26;

    private static final int ENTROPY_BYTES = 10;
    private static final long MAX_TIMESTAMP = (1L << 48) - 1;

    private final Ulid ulid;
    private final byte[] bytes;

    private BlockId(final Ulid ulid) {
        this.ulid = ulid;
        this.bytes = ulid.toBytes();
    }

    public static BlockId of(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != BYTES) {
            throw new IllegalArgumentException("block id must be " + BYTES + " bytes, got " + bytes.length);
        }
        return new BlockId(Ulid.from(bytes));
    }

    /**
     * @param timestampMillis creation time, must fit 48 bits
     * @param entropy         10 random bytes, or {@code null} for all zeroes
     */
    public static BlockId of(final long timestampMillis, final byte[] entropy) {
        if (timestampMillis < 0 || timestampMillis > MAX_TIMESTAMP) {
            throw new IllegalArgumentException("timestamp out of range (must fit 48 bits): " + timestampMillis);
        }
        if (entropy != null && entropy.length != ENTROPY_BYTES) {
            throw new IllegalArgumentException("entropy must be " + ENTROPY_BYTES + " bytes, got " + entropy.length);
        }
        return new BlockId(new Ulid(timestampMillis, entropy == null ? new byte[ENTROPY_BYTES] : entropy));
    }

    /**
     * Parses the 26-character text form, case-insensitively.
     */
    public static BlockId parse(final String text) {
        Objects.requireNonNull(text, "text");
        if (text.length() != TEXT_LENGTH) {
            throw new IllegalArgumentException("block id must be " + TEXT_LENGTH + " characters: '" + text + "'");
        }
        // 26 * 5 = 130 bits, so the leading character carries only 3
        if (text.charAt(0) > '7') {
            throw new IllegalArgumentException("block id overflows 128 bits: '" + text + "'");
        }
        if (!Ulid.isValid(text)) {
            throw new IllegalArgumentException("invalid block id '" + text + "'");
        }
        return new BlockId(Ulid.from(text));
    }

    public long timestampMillis() {
        return ulid.getTime();
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    /** Byte at {@code index} without copying the identifier. */
    public byte byteAt(final int index) {
        return bytes[index];
    }

    @Override
    public int compareTo(final BlockId other) {
        return ulid.compareTo(other.ulid);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof BlockId)) return false;
        return ulid.equals(((BlockId) o).ulid);
    }

    @Override
    public int hashCode() {
        return ulid.hashCode();
    }

    @Override
    public String toString() {
        return ulid.toString();
    }
}

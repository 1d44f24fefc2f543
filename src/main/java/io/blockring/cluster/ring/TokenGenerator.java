package io.blockring.cluster.ring;

import lombok.experimental.UtilityClass;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

/** Random ring positions for a member claiming its place in the ring. */
@UtilityClass
public final class TokenGenerator {

    /**
     * Draws {@code count} distinct tokens that collide neither with each other nor with
     * {@code taken}, returned in unsigned ascending order.
     */
    public int[] generate(final int count, final Set<Integer> taken, final Random random) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
        final Set<Integer> used = new HashSet<>(taken);
        final int[] out = new int[count];
        int n = 0;
        while (n < count) {
            final int candidate = random.nextInt();
            if (used.add(candidate)) {
                out[n++] = candidate;
            }
        }
        return Arrays.stream(out)
                .boxed()
                .sorted(Integer::compareUnsigned)
                .mapToInt(Integer::intValue)
                .toArray();
    }
}

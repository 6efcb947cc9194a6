package org.Aayush.npuzzle.state;

import java.util.Arrays;

/**
 * Canonical identity of one tile arrangement.
 *
 * <p>Tiles are bit-packed into {@code long} words using {@code ceil(log2(length))} bits each.
 * A 3x3 (4 bits x 9) or 4x4 (4 bits x 16) puzzle fits in a single word; larger grids spill
 * into additional words. The encoding is injective for permutations of {@code 0..length-1},
 * so keys never collide.</p>
 */
public final class StateKey {
    private final int length;
    private final long[] words;
    private final int hash;

    private StateKey(int length, long[] words) {
        this.length = length;
        this.words = words;
        this.hash = 31 * Arrays.hashCode(words) + length;
    }

    /**
     * Packs a tile sequence into its canonical key.
     *
     * @param tiles tile values, each in {@code [0, tiles.length)}.
     * @return canonical key.
     */
    public static StateKey of(int[] tiles) {
        int length = tiles.length;
        int bits = bitsPerTile(length);
        int tilesPerWord = Long.SIZE / bits;
        long[] words = new long[(length + tilesPerWord - 1) / tilesPerWord];

        for (int i = 0; i < length; i++) {
            int word = i / tilesPerWord;
            int shift = (i % tilesPerWord) * bits;
            words[word] |= ((long) tiles[i]) << shift;
        }
        return new StateKey(length, words);
    }

    /**
     * Returns the number of bits used per tile for a grid length.
     */
    static int bitsPerTile(int length) {
        int maxValue = Math.max(length - 1, 1);
        return Integer.SIZE - Integer.numberOfLeadingZeros(maxValue);
    }

    /**
     * @return number of packed words (one for grids up to 4x4).
     */
    public int wordCount() {
        return words.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StateKey other)) {
            return false;
        }
        return length == other.length && hash == other.hash && Arrays.equals(words, other.words);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("StateKey{");
        for (int i = words.length - 1; i >= 0; i--) {
            sb.append(Long.toHexString(words[i]));
            if (i > 0) {
                sb.append(':');
            }
        }
        return sb.append('}').toString();
    }
}

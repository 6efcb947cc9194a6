package org.Aayush.npuzzle.state;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;

/**
 * One immutable configuration of a square N-puzzle plus its search bookkeeping.
 *
 * <p>Identity is the tile sequence alone: {@link #equals(Object)}, {@link #hashCode()} and
 * {@link #key()} ignore {@code g}, {@code h}, {@code f}, {@code move} and {@code parentKey}.
 * Costs are attached by deriving a copy through {@link #withCosts(int, double, StateKey)};
 * the tile array itself is never written after construction and is shared between such
 * copies.</p>
 */
@Getter
@Accessors(fluent = true)
public final class PuzzleState {
    public static final int BLANK = 0;

    @Getter(AccessLevel.NONE)
    private final int[] tiles;
    /** Index of the blank cell. */
    private final int blankIndex;
    /** Side length of the square grid. */
    private final int dimension;
    /** Path cost from the start state. */
    private final int g;
    /** Heuristic estimate of the remaining cost. */
    private final double h;
    /** Priority {@code g + h}. */
    private final double f;
    /** Blank move that produced this state. */
    private final Move move;
    /** Key of the generating state, {@code null} for the start state. */
    private final StateKey parentKey;
    @Getter(AccessLevel.NONE)
    private StateKey key;

    private PuzzleState(
            int[] tiles,
            int blankIndex,
            int dimension,
            int g,
            double h,
            Move move,
            StateKey parentKey,
            StateKey key
    ) {
        this.tiles = tiles;
        this.blankIndex = blankIndex;
        this.dimension = dimension;
        this.g = g;
        this.h = h;
        this.f = g + h;
        this.move = move;
        this.parentKey = parentKey;
        this.key = key;
    }

    /**
     * Builds a start state from a flattened row-major grid.
     *
     * @param grid tile values, {@code 0} for the blank.
     * @return start state with zero costs and no parent.
     * @throws InvalidGridException when the grid is not a permutation of {@code 0..N} with a
     * perfect-square length.
     */
    public static PuzzleState fromGrid(int[] grid) {
        if (grid == null || grid.length == 0) {
            throw new InvalidGridException(InvalidGridException.REASON_GRID_REQUIRED, "grid must be non-empty");
        }
        int length = grid.length;
        int dimension = squareRoot(length);
        if (dimension < 0) {
            throw new InvalidGridException(
                    InvalidGridException.REASON_GRID_NOT_SQUARE,
                    "grid length " + length + " is not a perfect square"
            );
        }

        int blankIndex = -1;
        int blankCount = 0;
        for (int i = 0; i < length; i++) {
            if (grid[i] == BLANK) {
                blankIndex = i;
                blankCount++;
            }
        }
        if (blankCount != 1) {
            throw new InvalidGridException(
                    InvalidGridException.REASON_GRID_BLANK_COUNT,
                    "grid must contain exactly one blank (0), found " + blankCount
            );
        }

        boolean[] seen = new boolean[length];
        for (int i = 0; i < length; i++) {
            int value = grid[i];
            if (value < 0 || value >= length || seen[value]) {
                throw new InvalidGridException(
                        InvalidGridException.REASON_GRID_NOT_PERMUTATION,
                        "grid must be a permutation of 0.." + (length - 1) + ", bad value " + value + " at index " + i
                );
            }
            seen[value] = true;
        }

        return new PuzzleState(Arrays.copyOf(grid, length), blankIndex, dimension, 0, 0.0d, Move.START, null, null);
    }

    /**
     * Returns the canonical goal arrangement {@code 1, 2, ..., N, 0}.
     *
     * @param dimension side length, at least 1.
     * @return goal state.
     */
    public static PuzzleState goal(int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("dimension must be >= 1, got " + dimension);
        }
        int length = dimension * dimension;
        int[] grid = new int[length];
        for (int i = 0; i < length - 1; i++) {
            grid[i] = i + 1;
        }
        grid[length - 1] = BLANK;
        return fromGrid(grid);
    }

    /**
     * Derives a successor by swapping the blank with {@code targetIndex}.
     *
     * <p>Costs are reset and the parent key is left unset; the search engine assigns them.</p>
     */
    PuzzleState slide(int targetIndex, Move move) {
        int[] next = Arrays.copyOf(tiles, tiles.length);
        next[blankIndex] = next[targetIndex];
        next[targetIndex] = BLANK;
        return new PuzzleState(next, targetIndex, dimension, 0, 0.0d, move, null, null);
    }

    /**
     * Returns a copy of this state carrying search costs and a parent link.
     *
     * @param g path cost from the start state.
     * @param h heuristic estimate.
     * @param parentKey key of the generating state, or {@code null} for the start state.
     * @return costed copy sharing this state's tiles.
     */
    public PuzzleState withCosts(int g, double h, StateKey parentKey) {
        if (g < 0) {
            throw new IllegalArgumentException("g must be >= 0, got " + g);
        }
        if (!Double.isFinite(h) || h < 0.0d) {
            throw new IllegalArgumentException("h must be finite and >= 0, got " + h);
        }
        return new PuzzleState(tiles, blankIndex, dimension, g, h, move, parentKey, key);
    }

    /**
     * @return canonical identity of this tile arrangement.
     */
    public StateKey key() {
        StateKey k = key;
        if (k == null) {
            k = StateKey.of(tiles);
            key = k;
        }
        return k;
    }

    /**
     * @return whether every non-blank tile {@code v} sits at index {@code v - 1}.
     */
    public boolean isGoal() {
        for (int i = 0; i < tiles.length; i++) {
            int value = tiles[i];
            if (value != BLANK && value != i + 1) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return whether this is a start state (no parent link).
     */
    public boolean isStart() {
        return parentKey == null;
    }

    /**
     * Returns the tile at a grid index.
     */
    public int tile(int index) {
        return tiles[index];
    }

    /**
     * @return defensive copy of the row-major tile sequence.
     */
    public int[] tiles() {
        return Arrays.copyOf(tiles, tiles.length);
    }

    /**
     * @return number of cells ({@code N + 1}).
     */
    public int length() {
        return tiles.length;
    }

    /**
     * @return number of numbered tiles {@code N}.
     */
    public int size() {
        return tiles.length - 1;
    }

    public int rowOf(int index) {
        return index / dimension;
    }

    public int colOf(int index) {
        return index % dimension;
    }

    /**
     * Returns {@code sqrt(length)} when {@code length} is a perfect square, else {@code -1}.
     */
    private static int squareRoot(int length) {
        int root = (int) Math.round(Math.sqrt(length));
        return root * root == length ? root : -1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PuzzleState other)) {
            return false;
        }
        return Arrays.equals(tiles, other.tiles);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(tiles);
    }

    @Override
    public String toString() {
        return "PuzzleState{" +
                "tiles=" + Arrays.toString(tiles) +
                ", move=" + move +
                ", g=" + g +
                ", h=" + h +
                '}';
    }
}

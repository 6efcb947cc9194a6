package org.Aayush.npuzzle.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;

/**
 * Built-in puzzles of increasing difficulty.
 *
 * <p>Optimal move counts are listed where the puzzle is solvable.</p>
 */
@Getter
@Accessors(fluent = true)
public enum PuzzleCatalog {
    EIGHT_TRIVIAL("8-puzzle: trivial", 0, new int[]{
            1, 2, 3,
            4, 5, 6,
            7, 8, 0}),
    EIGHT_EASY("8-puzzle: easy", 2, new int[]{
            1, 2, 0,
            4, 5, 3,
            7, 8, 6}),
    EIGHT_DOABLE("8-puzzle: doable", 4, new int[]{
            0, 1, 2,
            4, 5, 3,
            7, 8, 6}),
    EIGHT_OH_BOY("8-puzzle: oh boy", 22, new int[]{
            8, 7, 1,
            6, 0, 2,
            5, 4, 3}),
    EIGHT_WAIT_FOR_IT("8-puzzle: wait for it", 31, new int[]{
            8, 6, 7,
            2, 5, 4,
            3, 0, 1}),
    EIGHT_IMPOSSIBLE("8-puzzle: impossible", -1, new int[]{
            1, 2, 3,
            4, 5, 6,
            8, 7, 0}),
    FIFTEEN_TRIVIAL("15-puzzle: trivial", 0, new int[]{
            1, 2, 3, 4,
            5, 6, 7, 8,
            9, 10, 11, 12,
            13, 14, 15, 0}),
    FIFTEEN_EASY("15-puzzle: easy", 3, new int[]{
            1, 2, 3, 0,
            5, 6, 7, 4,
            9, 10, 11, 8,
            13, 14, 15, 12}),
    FIFTEEN_DOABLE("15-puzzle: doable", 9, new int[]{
            2, 0, 3, 4,
            1, 10, 6, 8,
            5, 9, 7, 11,
            13, 14, 15, 12}),
    FIFTEEN_WAIT_FOR_IT("15-puzzle: wait for it", 35, new int[]{
            1, 10, 15, 4,
            13, 6, 3, 8,
            2, 9, 12, 7,
            14, 5, 0, 11}),
    FIFTEEN_IMPOSSIBLE("15-puzzle: impossible", -1, new int[]{
            1, 2, 3, 4,
            5, 6, 7, 8,
            9, 10, 11, 12,
            13, 15, 14, 0});

    /** Menu label. */
    private final String title;
    /** Optimal number of moves, {@code -1} when unsolvable. */
    private final int optimalMoves;
    private final int[] grid;

    PuzzleCatalog(String title, int optimalMoves, int[] grid) {
        this.title = title;
        this.optimalMoves = optimalMoves;
        this.grid = grid;
    }

    /**
     * @return defensive copy of the row-major grid.
     */
    public int[] grid() {
        return Arrays.copyOf(grid, grid.length);
    }

    public boolean solvable() {
        return optimalMoves >= 0;
    }

    /**
     * @return validated instance of this puzzle.
     */
    public PuzzleInstance instance() {
        return PuzzleInstance.of(grid);
    }
}

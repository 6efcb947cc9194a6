package org.Aayush.npuzzle.core;

import lombok.experimental.UtilityClass;
import org.Aayush.npuzzle.state.PuzzleState;

import java.util.Objects;

/**
 * Inversion-parity test for reachability of the goal arrangement.
 *
 * <p>For odd dimensions a slide never changes inversion parity, so the goal (zero inversions)
 * is reachable iff the inversion count is even. For even dimensions a vertical slide flips the
 * parity together with the blank's row, so the sum of inversions and the blank's row counted
 * from the bottom must be odd.</p>
 */
@UtilityClass
public final class SolvabilityChecker {

    /**
     * Counts pairs {@code i < j} of non-blank tiles with {@code tiles[j] < tiles[i]}.
     */
    public static int countInversions(int[] tiles) {
        Objects.requireNonNull(tiles, "tiles");
        int inversions = 0;
        for (int i = 0; i < tiles.length; i++) {
            if (tiles[i] == PuzzleState.BLANK) {
                continue;
            }
            for (int j = i + 1; j < tiles.length; j++) {
                if (tiles[j] != PuzzleState.BLANK && tiles[j] < tiles[i]) {
                    inversions++;
                }
            }
        }
        return inversions;
    }

    /**
     * Decides whether the goal arrangement is reachable from a state.
     *
     * @param state start state.
     * @return {@code true} when the puzzle is solvable.
     */
    public static boolean isSolvable(PuzzleState state) {
        Objects.requireNonNull(state, "state");
        return isSolvable(countInversions(state.tiles()), state.dimension(), state.blankIndex());
    }

    /**
     * Decides solvability of a raw grid.
     *
     * @param tiles valid row-major grid (validated through {@link PuzzleState#fromGrid(int[])}).
     * @return {@code true} when the puzzle is solvable.
     */
    public static boolean isSolvable(int[] tiles) {
        return isSolvable(PuzzleState.fromGrid(tiles));
    }

    private static boolean isSolvable(int inversions, int dimension, int blankIndex) {
        boolean evenInversions = inversions % 2 == 0;
        if (dimension % 2 == 1) {
            return evenInversions;
        }
        int rowFromBottom = dimension - (blankIndex / dimension);
        boolean evenRowFromBottom = rowFromBottom % 2 == 0;
        return (!evenInversions && evenRowFromBottom) || (evenInversions && !evenRowFromBottom);
    }
}

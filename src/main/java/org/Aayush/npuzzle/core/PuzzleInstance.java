package org.Aayush.npuzzle.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.npuzzle.state.PuzzleState;

import java.util.Objects;

/**
 * One validated puzzle to be solved.
 *
 * <p>Construction fails fast on malformed grids and runs the solvability check exactly once;
 * the verdict is cached for every later search.</p>
 */
@Getter
@Accessors(fluent = true)
public final class PuzzleInstance {
    /** Validated start state with zero costs. */
    private final PuzzleState startState;
    /** Cached parity verdict. */
    private final boolean solvable;

    private PuzzleInstance(PuzzleState startState) {
        this.startState = startState;
        this.solvable = SolvabilityChecker.isSolvable(startState);
    }

    /**
     * Validates a flattened grid and builds an instance.
     *
     * @param grid row-major tile values, {@code 0} for the blank.
     * @return puzzle instance.
     * @throws org.Aayush.npuzzle.state.InvalidGridException when the grid is malformed.
     */
    public static PuzzleInstance of(int[] grid) {
        return new PuzzleInstance(PuzzleState.fromGrid(grid));
    }

    /**
     * Builds an instance whose start is the tile arrangement of an existing state.
     *
     * <p>Costs, move tag and parent link of the given state are discarded.</p>
     */
    public static PuzzleInstance of(PuzzleState state) {
        Objects.requireNonNull(state, "state");
        return new PuzzleInstance(PuzzleState.fromGrid(state.tiles()));
    }

    /**
     * @return side length of the grid.
     */
    public int dimension() {
        return startState.dimension();
    }

    /**
     * @return number of numbered tiles {@code N}.
     */
    public int size() {
        return startState.size();
    }

    /**
     * @return number of cells {@code N + 1}.
     */
    public int length() {
        return startState.length();
    }
}

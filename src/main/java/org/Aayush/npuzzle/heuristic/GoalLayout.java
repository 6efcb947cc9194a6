package org.Aayush.npuzzle.heuristic;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.npuzzle.state.PuzzleState;

/**
 * Goal row and column of every tile value for one grid dimension.
 *
 * <p>Tile {@code v > 0} belongs at index {@code v - 1}; the blank's slot is never used by the
 * estimators, which skip the blank.</p>
 */
public final class GoalLayout {
    @Getter
    @Accessors(fluent = true)
    private final int dimension;
    private final int[] goalRowByTile;
    private final int[] goalColByTile;

    private GoalLayout(int dimension) {
        this.dimension = dimension;
        int length = dimension * dimension;
        this.goalRowByTile = new int[length];
        this.goalColByTile = new int[length];
        for (int value = 1; value < length; value++) {
            goalRowByTile[value] = (value - 1) / dimension;
            goalColByTile[value] = (value - 1) % dimension;
        }
        goalRowByTile[PuzzleState.BLANK] = dimension - 1;
        goalColByTile[PuzzleState.BLANK] = dimension - 1;
    }

    /**
     * Builds the layout of a square grid.
     *
     * @param dimension side length, at least 1.
     * @return goal layout.
     */
    public static GoalLayout forDimension(int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("dimension must be >= 1, got " + dimension);
        }
        return new GoalLayout(dimension);
    }

    public int goalRow(int tile) {
        return goalRowByTile[tile];
    }

    public int goalCol(int tile) {
        return goalColByTile[tile];
    }

    /**
     * Validates that a state belongs to this layout's dimension.
     */
    void checkDimension(PuzzleState state) {
        if (state.dimension() != dimension) {
            throw new IllegalArgumentException(
                    "state dimension " + state.dimension() + " does not match bound goal dimension " + dimension
            );
        }
    }
}

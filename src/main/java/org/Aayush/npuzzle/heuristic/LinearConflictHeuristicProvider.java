package org.Aayush.npuzzle.heuristic;

import org.Aayush.npuzzle.state.PuzzleState;

import java.util.Objects;

/**
 * Manhattan distance plus linear-conflict penalty.
 *
 * <p>Two tiles are in a row conflict when both sit in the row that is their goal row and the
 * larger value precedes the smaller one. One of them has to leave the row and come back,
 * which costs two moves the Manhattan sum does not see. Column conflicts are the transpose.
 * Each pair is visited once because the inner scan only walks forward from the outer tile.</p>
 */
public final class LinearConflictHeuristicProvider implements HeuristicProvider {
    static final int CONFLICT_PENALTY = 2;

    @Override
    public HeuristicType type() {
        return HeuristicType.MANHATTAN_LINEAR_CONFLICT;
    }

    @Override
    public GoalBoundHeuristic bindGoal(GoalLayout layout) {
        Objects.requireNonNull(layout, "layout");
        return state -> {
            layout.checkDimension(state);
            return ManhattanHeuristicProvider.manhattanDistance(layout, state)
                    + CONFLICT_PENALTY * countConflicts(layout, state);
        };
    }

    /**
     * Counts conflicting tile pairs across all rows and columns.
     */
    static int countConflicts(GoalLayout layout, PuzzleState state) {
        int dimension = layout.dimension();
        int length = state.length();
        int conflicts = 0;

        for (int i = 0; i < length; i++) {
            int tile = state.tile(i);
            if (tile == PuzzleState.BLANK) {
                continue;
            }
            int row = state.rowOf(i);
            int col = state.colOf(i);

            if (layout.goalRow(tile) == row) {
                int rowEnd = (row + 1) * dimension;
                for (int j = i + 1; j < rowEnd; j++) {
                    int other = state.tile(j);
                    if (other != PuzzleState.BLANK && layout.goalRow(other) == row && other < tile) {
                        conflicts++;
                    }
                }
            }

            if (layout.goalCol(tile) == col) {
                for (int j = i + dimension; j < length; j += dimension) {
                    int other = state.tile(j);
                    if (other != PuzzleState.BLANK && layout.goalCol(other) == col && other < tile) {
                        conflicts++;
                    }
                }
            }
        }
        return conflicts;
    }
}

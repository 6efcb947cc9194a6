package org.Aayush.npuzzle.heuristic;

import org.Aayush.npuzzle.state.PuzzleState;

import java.util.Objects;

/**
 * Manhattan-distance heuristic provider.
 */
public final class ManhattanHeuristicProvider implements HeuristicProvider {

    @Override
    public HeuristicType type() {
        return HeuristicType.MANHATTAN;
    }

    @Override
    public GoalBoundHeuristic bindGoal(GoalLayout layout) {
        Objects.requireNonNull(layout, "layout");
        return state -> {
            layout.checkDimension(state);
            return manhattanDistance(layout, state);
        };
    }

    /**
     * Sums {@code |goalRow - row| + |goalCol - col|} over all non-blank tiles.
     */
    static int manhattanDistance(GoalLayout layout, PuzzleState state) {
        int cost = 0;
        for (int i = 0; i < state.length(); i++) {
            int tile = state.tile(i);
            if (tile == PuzzleState.BLANK) {
                continue;
            }
            cost += TileDistance.manhattan(
                    state.rowOf(i),
                    state.colOf(i),
                    layout.goalRow(tile),
                    layout.goalCol(tile)
            );
        }
        return cost;
    }
}

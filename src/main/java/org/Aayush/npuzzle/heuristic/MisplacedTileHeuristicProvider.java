package org.Aayush.npuzzle.heuristic;

import org.Aayush.npuzzle.state.PuzzleState;

import java.util.Objects;

/**
 * Misplaced-tile heuristic provider.
 *
 * <p>Counts non-blank tiles that are not on their goal index. Every misplaced tile needs at
 * least one move, so the count is admissible.</p>
 */
public final class MisplacedTileHeuristicProvider implements HeuristicProvider {

    @Override
    public HeuristicType type() {
        return HeuristicType.MISPLACED_TILE;
    }

    @Override
    public GoalBoundHeuristic bindGoal(GoalLayout layout) {
        return new BoundMisplacedTileHeuristic(Objects.requireNonNull(layout, "layout"));
    }

    private static final class BoundMisplacedTileHeuristic implements GoalBoundHeuristic {
        private final GoalLayout layout;

        private BoundMisplacedTileHeuristic(GoalLayout layout) {
            this.layout = layout;
        }

        @Override
        public double estimate(PuzzleState state) {
            layout.checkDimension(state);
            int misplaced = 0;
            for (int i = 0; i < state.length(); i++) {
                int tile = state.tile(i);
                if (tile != PuzzleState.BLANK && tile != i + 1) {
                    misplaced++;
                }
            }
            return misplaced;
        }
    }
}

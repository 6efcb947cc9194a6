package org.Aayush.npuzzle.heuristic;

import org.Aayush.npuzzle.state.PuzzleState;

import java.util.Objects;

/**
 * Euclidean heuristic provider.
 *
 * <p>Sums the straight-line (L2) distance of every non-blank tile from its goal cell. A tile
 * moves one unit per slide, so the sum never exceeds the remaining moves; it is dominated by
 * the Manhattan sum.</p>
 */
public final class EuclideanHeuristicProvider implements HeuristicProvider {

    /**
     * Returns provider type discriminator.
     */
    @Override
    public HeuristicType type() {
        return HeuristicType.EUCLIDEAN;
    }

    /**
     * Binds this provider to one goal layout and returns a reusable estimator.
     *
     * @param layout goal layout.
     * @return goal-bound heuristic estimator.
     */
    @Override
    public GoalBoundHeuristic bindGoal(GoalLayout layout) {
        return new BoundEuclideanHeuristic(Objects.requireNonNull(layout, "layout"));
    }

    private static final class BoundEuclideanHeuristic implements GoalBoundHeuristic {
        private final GoalLayout layout;

        private BoundEuclideanHeuristic(GoalLayout layout) {
            this.layout = layout;
        }

        /**
         * Returns the summed straight-line displacement of all tiles.
         */
        @Override
        public double estimate(PuzzleState state) {
            layout.checkDimension(state);
            double cost = 0.0d;
            for (int i = 0; i < state.length(); i++) {
                int tile = state.tile(i);
                if (tile == PuzzleState.BLANK) {
                    continue;
                }
                cost += TileDistance.euclidean(
                        state.rowOf(i),
                        state.colOf(i),
                        layout.goalRow(tile),
                        layout.goalCol(tile)
                );
            }
            return cost;
        }
    }
}

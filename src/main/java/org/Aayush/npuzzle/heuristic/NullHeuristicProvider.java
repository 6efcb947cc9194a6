package org.Aayush.npuzzle.heuristic;

import org.Aayush.npuzzle.state.PuzzleState;

import java.util.Objects;

/**
 * Null heuristic provider.
 *
 * <p>Always returns zero estimates and therefore turns the search into uniform-cost search
 * while still honoring dimension-check contracts.</p>
 */
public final class NullHeuristicProvider implements HeuristicProvider {

    /**
     * Returns provider type discriminator.
     */
    @Override
    public HeuristicType type() {
        return HeuristicType.UNIFORM_COST;
    }

    /**
     * Binds this provider to one goal layout.
     *
     * @param layout goal layout.
     * @return zero-cost estimator.
     */
    @Override
    public GoalBoundHeuristic bindGoal(GoalLayout layout) {
        return new BoundNullHeuristic(Objects.requireNonNull(layout, "layout"));
    }

    private static final class BoundNullHeuristic implements GoalBoundHeuristic {
        private final GoalLayout layout;

        private BoundNullHeuristic(GoalLayout layout) {
            this.layout = layout;
        }

        /**
         * Returns constant zero estimate for any state of the bound dimension.
         */
        @Override
        public double estimate(PuzzleState state) {
            layout.checkDimension(state);
            return 0.0d;
        }
    }
}

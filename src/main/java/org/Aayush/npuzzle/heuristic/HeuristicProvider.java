package org.Aayush.npuzzle.heuristic;

/**
 * Heuristic provider contract used by the search engine.
 *
 * <p>Providers are immutable and stateless. Binding returns an estimator for the goal
 * arrangement of one grid dimension.</p>
 */
public interface HeuristicProvider {

    /**
     * @return heuristic mode of this provider.
     */
    HeuristicType type();

    /**
     * Binds a goal layout and returns a reusable estimator.
     *
     * @param layout precomputed goal coordinates for one dimension.
     * @return estimator bound to the layout.
     */
    GoalBoundHeuristic bindGoal(GoalLayout layout);
}

package org.Aayush.npuzzle.heuristic;

import org.Aayush.npuzzle.state.PuzzleState;

/**
 * Immutable heuristic estimator bound to the goal layout of one grid dimension.
 *
 * <p>Hot path contract: {@link #estimate(PuzzleState)} must not allocate.</p>
 */
@FunctionalInterface
public interface GoalBoundHeuristic {

    /**
     * Estimates the number of moves remaining to the goal.
     *
     * @param state state whose dimension matches the bound layout.
     * @return non-negative estimate.
     */
    double estimate(PuzzleState state);
}

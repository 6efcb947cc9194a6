package org.Aayush.npuzzle.core;

import org.Aayush.npuzzle.state.PuzzleState;

/**
 * Callbacks fired by {@link PuzzleSearchEngine} while a search runs.
 *
 * <p>All callbacks run on the searching thread. An observer may abort a search by throwing a
 * runtime exception; the engine does not catch it.</p>
 */
public interface SearchObserver {
    SearchObserver NOOP = new SearchObserver() {
    };

    /**
     * Called once with the costed start state before the first pop.
     */
    default void onSearchStarted(PuzzleState start) {
    }

    /**
     * Called after a state has been expanded and its children admitted.
     *
     * @param state expanded state.
     * @param nodesExpanded expansions so far, including this one.
     * @param frontierSize frontier size after admitting the children.
     */
    default void onExpand(PuzzleState state, int nodesExpanded, int frontierSize) {
    }

    /**
     * Called when the goal is popped.
     */
    default void onGoalReached(PuzzleState goal, int nodesExpanded, int maxFrontierSize) {
    }

    /**
     * Called instead of any other callback when the start fails the parity check.
     */
    default void onUnsolvable(PuzzleState start) {
    }
}

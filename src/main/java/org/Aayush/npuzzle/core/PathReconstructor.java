package org.Aayush.npuzzle.core;

import lombok.experimental.UtilityClass;
import org.Aayush.npuzzle.search.ExploredRegistry;
import org.Aayush.npuzzle.state.PuzzleState;
import org.Aayush.npuzzle.state.StateKey;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Rebuilds the start-to-goal sequence by following parent keys through the explored registry.
 */
@UtilityClass
final class PathReconstructor {

    /**
     * Walks parent links from a goal state back to the start.
     *
     * @param goal popped goal state; its ancestors must all be explored.
     * @param explored registry holding every ancestor.
     * @return states from start to goal inclusive.
     * @throws IllegalStateException if an ancestor is missing from the registry.
     */
    static List<PuzzleState> retrace(PuzzleState goal, ExploredRegistry explored) {
        Objects.requireNonNull(goal, "goal");
        Objects.requireNonNull(explored, "explored");

        Deque<PuzzleState> path = new ArrayDeque<>(goal.g() + 1);
        path.addFirst(goal);
        StateKey parentKey = goal.parentKey();
        while (parentKey != null) {
            PuzzleState parent = explored.get(parentKey);
            if (parent == null) {
                throw new IllegalStateException("Parent " + parentKey + " missing from explored registry");
            }
            path.addFirst(parent);
            parentKey = parent.parentKey();
        }
        return new ArrayList<>(path);
    }
}

package org.Aayush.npuzzle.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.npuzzle.heuristic.HeuristicType;
import org.Aayush.npuzzle.state.Move;
import org.Aayush.npuzzle.state.PuzzleState;

import java.util.List;

/**
 * Outcome of one search.
 *
 * <p>When {@code solvable=false} the path is empty and every statistic is zero. An empty path
 * with {@code solvable=true} means the frontier ran dry, which a correct solvability check
 * rules out.</p>
 */
@Value
@Builder
public class SolutionResult {
    /** Parity verdict of the start state. */
    boolean solvable;
    /** Heuristic that ordered the frontier. */
    HeuristicType heuristicType;
    /** Number of states expanded (goal pop not counted). */
    int nodesExpanded;
    /** Largest frontier size observed after an expansion. */
    int maxFrontierSize;
    /**
     * Number of states on the solution path, start and goal included: one more than the move
     * count, 1 when the start is the goal, 0 when no path exists.
     */
    int goalDepth;
    /** States from start to goal inclusive; empty when unsolved. */
    @Singular("pathState")
    List<PuzzleState> path;

    /**
     * Creates the canonical result of an unsolvable start.
     */
    static SolutionResult unsolvable(HeuristicType heuristicType) {
        return SolutionResult.builder()
                .solvable(false)
                .heuristicType(heuristicType)
                .build();
    }

    /**
     * @return whether a path to the goal was found.
     */
    public boolean solved() {
        return !path.isEmpty();
    }

    /**
     * @return moves from start to goal, excluding the start marker; empty when unsolved.
     */
    public List<Move> moves() {
        return path.stream()
                .skip(1)
                .map(PuzzleState::move)
                .toList();
    }
}

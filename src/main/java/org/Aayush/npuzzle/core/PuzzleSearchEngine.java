package org.Aayush.npuzzle.core;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.npuzzle.heuristic.GoalBoundHeuristic;
import org.Aayush.npuzzle.heuristic.GoalLayout;
import org.Aayush.npuzzle.heuristic.HeuristicFactory;
import org.Aayush.npuzzle.heuristic.HeuristicProvider;
import org.Aayush.npuzzle.heuristic.HeuristicType;
import org.Aayush.npuzzle.search.ExploredRegistry;
import org.Aayush.npuzzle.search.FrontierQueue;
import org.Aayush.npuzzle.state.PuzzleState;
import org.Aayush.npuzzle.state.StateKey;
import org.Aayush.npuzzle.state.SuccessorGenerator;

import java.util.List;
import java.util.Objects;

/**
 * Best-first graph search over puzzle states.
 *
 * <p>Priority is {@code f = g + h}; with the uniform-cost heuristic this is plain uniform-cost
 * search, otherwise A*. Execution flow:</p>
 * <ul>
 * <li>Short-circuit unsolvable instances before touching the frontier.</li>
 * <li>Pop the minimum-{@code f} state and run the goal test on pop, not on generation.</li>
 * <li>Expand unexplored states, discarding children already present in the frontier or the
 * explored registry. The first path found to a configuration is kept, which is optimal only for
 * consistent heuristics; no state is ever re-opened.</li>
 * <li>Rebuild the path through {@link PathReconstructor} once the goal is popped.</li>
 * </ul>
 *
 * <p>The engine holds no per-query state and can be reused; each call owns its own frontier and
 * explored registry.</p>
 */
@Slf4j
public final class PuzzleSearchEngine {

    /**
     * Searches without an observer.
     *
     * @param instance validated puzzle.
     * @param heuristicType heuristic; {@code null} falls back to uniform cost.
     * @return solution and statistics.
     */
    public SolutionResult search(PuzzleInstance instance, HeuristicType heuristicType) {
        return search(instance, heuristicType, SearchObserver.NOOP);
    }

    /**
     * Searches for an optimal solution.
     *
     * @param instance validated puzzle.
     * @param heuristicType heuristic; {@code null} falls back to uniform cost.
     * @param observer progress callbacks; may abort the search by throwing.
     * @return solution and statistics; empty path when unsolvable.
     */
    public SolutionResult search(PuzzleInstance instance, HeuristicType heuristicType, SearchObserver observer) {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(observer, "observer");
        HeuristicProvider provider = HeuristicFactory.create(heuristicType);
        HeuristicType effectiveType = provider.type();

        if (!instance.solvable()) {
            log.info("Puzzle {} is not solvable, skipping search", instance.startState());
            observer.onUnsolvable(instance.startState());
            return SolutionResult.unsolvable(effectiveType);
        }

        GoalBoundHeuristic heuristic = provider.bindGoal(GoalLayout.forDimension(instance.dimension()));
        FrontierQueue frontier = new FrontierQueue();
        ExploredRegistry explored = new ExploredRegistry();

        PuzzleState start = instance.startState();
        start = start.withCosts(0, estimate(heuristic, start), null);
        frontier.admit(start);
        observer.onSearchStarted(start);
        log.debug("Searching {}x{} puzzle with {} (h0={})",
                instance.dimension(), instance.dimension(), effectiveType, start.h());

        int nodesExpanded = 0;
        int maxFrontierSize = 0;

        while (!frontier.isEmpty()) {
            PuzzleState current = frontier.extractMin();

            if (current.isGoal()) {
                List<PuzzleState> path = PathReconstructor.retrace(current, explored);
                observer.onGoalReached(current, nodesExpanded, maxFrontierSize);
                log.debug("Solved at depth {} with {}: expanded={}, maxFrontier={}",
                        path.size(), effectiveType, nodesExpanded, maxFrontierSize);
                return SolutionResult.builder()
                        .solvable(true)
                        .heuristicType(effectiveType)
                        .nodesExpanded(nodesExpanded)
                        .maxFrontierSize(maxFrontierSize)
                        .goalDepth(path.size())
                        .path(path)
                        .build();
            }

            if (!explored.markExplored(current)) {
                continue;
            }
            nodesExpanded++;

            StateKey currentKey = current.key();
            for (PuzzleState child : SuccessorGenerator.successors(current)) {
                StateKey childKey = child.key();
                if (frontier.contains(childKey) || explored.isExplored(childKey)) {
                    continue;
                }
                frontier.admit(child.withCosts(current.g() + 1, estimate(heuristic, child), currentKey));
            }

            if (frontier.size() > maxFrontierSize) {
                maxFrontierSize = frontier.size();
            }
            observer.onExpand(current, nodesExpanded, frontier.size());
        }

        log.warn("Frontier exhausted without reaching the goal for solvable puzzle {}", instance.startState());
        return SolutionResult.builder()
                .solvable(true)
                .heuristicType(effectiveType)
                .nodesExpanded(nodesExpanded)
                .maxFrontierSize(maxFrontierSize)
                .build();
    }

    /**
     * Evaluates the heuristic, clamping invalid outputs to zero so queue ordering stays
     * numerically safe.
     */
    private static double estimate(GoalBoundHeuristic heuristic, PuzzleState state) {
        double estimate = heuristic.estimate(state);
        if (!Double.isFinite(estimate) || estimate < 0.0d) {
            return 0.0d;
        }
        return estimate;
    }
}

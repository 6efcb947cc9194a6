package org.Aayush.npuzzle.core;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.npuzzle.heuristic.HeuristicType;
import org.Aayush.npuzzle.state.PuzzleState;

import java.util.List;
import java.util.Objects;

/**
 * Main solver entry point for one puzzle.
 *
 * <p>The facade owns a validated {@link PuzzleInstance} and the result of its most recent
 * solve. Execution flow:</p>
 * <ul>
 * <li>Validate the grid and cache the solvability verdict at construction.</li>
 * <li>Resolve the heuristic (numeric selectors degrade to uniform cost when unknown).</li>
 * <li>Delegate to {@link PuzzleSearchEngine} with the configured {@link SearchBudget} attached.</li>
 * <li>Wrap budget aborts into {@link PuzzleCoreException} with stable reason codes.</li>
 * </ul>
 *
 * <p>Statistics accessors report the latest completed solve. They are zero before the first
 * solve and after a solve aborted by the budget.</p>
 */
@Slf4j
public final class NPuzzle {
    public static final String REASON_SEARCH_BUDGET_EXCEEDED = "NP_SEARCH_BUDGET_EXCEEDED";

    private final PuzzleInstance instance;
    private final SearchBudget budget;
    private final PuzzleSearchEngine engine;
    private SolutionResult lastResult;

    /**
     * Creates a solver with the budget loaded from system properties.
     *
     * @param grid row-major tile values, {@code 0} for the blank.
     * @throws org.Aayush.npuzzle.state.InvalidGridException when the grid is malformed.
     */
    public NPuzzle(int[] grid) {
        this(grid, SearchBudget.defaults());
    }

    /**
     * Creates a solver with an explicit search budget.
     *
     * @param grid row-major tile values, {@code 0} for the blank.
     * @param budget search ceilings.
     * @throws org.Aayush.npuzzle.state.InvalidGridException when the grid is malformed.
     */
    public NPuzzle(int[] grid, SearchBudget budget) {
        this.instance = PuzzleInstance.of(grid);
        this.budget = Objects.requireNonNull(budget, "budget");
        this.engine = new PuzzleSearchEngine();
    }

    /**
     * Solves with a numeric menu selector ({@code 1..5}).
     */
    public List<PuzzleState> solve(int selector) {
        return solve(HeuristicType.fromSelector(selector));
    }

    /**
     * Solves with a heuristic type.
     *
     * @return solution path from start to goal, empty when unsolvable.
     * @throws PuzzleCoreException when the search budget is exceeded.
     */
    public List<PuzzleState> solve(HeuristicType heuristicType) {
        return solve(heuristicType, SearchObserver.NOOP);
    }

    /**
     * Solves with a heuristic type while reporting progress.
     *
     * @param heuristicType heuristic; {@code null} falls back to uniform cost.
     * @param observer progress callbacks, invoked after the budget check.
     * @return solution path from start to goal, empty when unsolvable.
     * @throws PuzzleCoreException when the search budget is exceeded.
     */
    public List<PuzzleState> solve(HeuristicType heuristicType, SearchObserver observer) {
        Objects.requireNonNull(observer, "observer");
        SearchObserver effectiveObserver = budget.isUnbounded() ? observer : new BudgetedObserver(budget, observer);
        // No result survives an aborted solve.
        lastResult = null;
        try {
            lastResult = engine.search(instance, heuristicType, effectiveObserver);
        } catch (SearchBudget.BudgetExceededException ex) {
            log.warn("Search aborted: {}", ex.getMessage());
            throw new PuzzleCoreException(
                    REASON_SEARCH_BUDGET_EXCEEDED,
                    ex.reasonCode() + ": " + ex.getMessage(),
                    ex
            );
        }
        return lastResult.getPath();
    }

    public PuzzleInstance instance() {
        return instance;
    }

    /**
     * @return number of numbered tiles {@code N}.
     */
    public int size() {
        return instance.size();
    }

    public int dimension() {
        return instance.dimension();
    }

    public PuzzleState startState() {
        return instance.startState();
    }

    public boolean solvable() {
        return instance.solvable();
    }

    public int nodesExpanded() {
        return lastResult == null ? 0 : lastResult.getNodesExpanded();
    }

    public int maxFrontierSize() {
        return lastResult == null ? 0 : lastResult.getMaxFrontierSize();
    }

    public int goalDepth() {
        return lastResult == null ? 0 : lastResult.getGoalDepth();
    }

    /**
     * @return path of the latest solve, empty before the first solve.
     */
    public List<PuzzleState> solution() {
        return lastResult == null ? List.of() : lastResult.getPath();
    }

    /**
     * @return latest full result, or {@code null} before the first solve or after an abort.
     */
    public SolutionResult lastResult() {
        return lastResult;
    }

    /**
     * Runs the budget check ahead of the caller's observer.
     */
    private static final class BudgetedObserver implements SearchObserver {
        private final SearchBudget budget;
        private final SearchObserver delegate;

        private BudgetedObserver(SearchBudget budget, SearchObserver delegate) {
            this.budget = budget;
            this.delegate = delegate;
        }

        @Override
        public void onSearchStarted(PuzzleState start) {
            delegate.onSearchStarted(start);
        }

        @Override
        public void onExpand(PuzzleState state, int nodesExpanded, int frontierSize) {
            budget.onExpand(state, nodesExpanded, frontierSize);
            delegate.onExpand(state, nodesExpanded, frontierSize);
        }

        @Override
        public void onGoalReached(PuzzleState goal, int nodesExpanded, int maxFrontierSize) {
            delegate.onGoalReached(goal, nodesExpanded, maxFrontierSize);
        }

        @Override
        public void onUnsolvable(PuzzleState start) {
            delegate.onUnsolvable(start);
        }
    }
}

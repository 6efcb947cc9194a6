package org.Aayush.npuzzle.app;

import org.Aayush.npuzzle.core.SearchObserver;
import org.Aayush.npuzzle.state.PuzzleState;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Prints each step of a running search: every expanded state with its {@code g(n)} and
 * {@code h(n)}, then the goal and the run statistics.
 */
public final class VerboseSearchObserver implements SearchObserver {
    private final PrintStream out;

    public VerboseSearchObserver(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void onSearchStarted(PuzzleState start) {
        out.print("SOLVING PUZZLE...\n\n");
    }

    @Override
    public void onExpand(PuzzleState state, int nodesExpanded, int frontierSize) {
        if (state.isStart()) {
            // Costs of the start state are not shown.
            out.print("Expanding state\n");
            out.print(SolutionRenderer.renderState(state));
            out.print('\n');
            return;
        }
        out.print("The best state to expand with g(n) = " + state.g()
                + " and h(n) = " + SolutionRenderer.formatCost(state.h()) + " is...\n");
        out.print(SolutionRenderer.renderState(state));
        out.print("Expanding this node...\n\n");
    }

    @Override
    public void onGoalReached(PuzzleState goal, int nodesExpanded, int maxFrontierSize) {
        out.print(SolutionRenderer.renderState(goal));
        out.print("\nGOAL\n\n");
        // Depth counts path states, the goal's g counts moves.
        out.print(SolutionRenderer.renderSummary(nodesExpanded, maxFrontierSize, goal.g() + 1));
    }

    @Override
    public void onUnsolvable(PuzzleState start) {
        out.print("PUZZLE IS NOT SOLVABLE\n");
    }
}

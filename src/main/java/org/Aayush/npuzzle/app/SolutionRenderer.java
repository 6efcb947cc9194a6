package org.Aayush.npuzzle.app;

import lombok.experimental.UtilityClass;
import org.Aayush.npuzzle.core.SolutionResult;
import org.Aayush.npuzzle.state.Move;
import org.Aayush.npuzzle.state.PuzzleState;

import java.util.List;
import java.util.Locale;

/**
 * Text rendering of puzzle states and solutions.
 *
 * <p>Every cell is followed by enough spaces to line up with the widest tile number plus one,
 * so grids stay aligned for any puzzle size.</p>
 */
@UtilityClass
public final class SolutionRenderer {
    static final String SOLUTION_HEADER = "*************** SOLUTION ****************";
    static final String SOLUTION_FOOTER = "*****************************************";
    static final String NO_SOLUTION = "-- NO SOLUTION --";

    /**
     * Renders one state as an aligned grid, one row per line.
     */
    public static String renderState(PuzzleState state) {
        int width = String.valueOf(state.size()).length();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < state.length(); i++) {
            String cell = String.valueOf(state.tile(i));
            sb.append(cell);
            sb.append(" ".repeat(width - cell.length() + 1));
            if (state.colOf(i) == state.dimension() - 1) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Renders the banner line for the {@code index}-th state of a path.
     */
    public static String renderMoveLabel(int index, Move move) {
        return switch (move) {
            case START -> "------ START ------";
            case UP -> "-- " + index + ": MOVE UP -----";
            case DOWN -> "-- " + index + ": MOVE DOWN ---";
            case LEFT -> "-- " + index + ": MOVE LEFT ---";
            case RIGHT -> "-- " + index + ": MOVE RIGHT --";
        };
    }

    /**
     * Renders every state of a solution path with its move banner.
     */
    public static String renderSolution(List<PuzzleState> path) {
        StringBuilder sb = new StringBuilder();
        sb.append('\n').append(SOLUTION_HEADER).append("\n\n");
        if (path.isEmpty()) {
            sb.append(NO_SOLUTION).append("\n\n");
        }
        for (int i = 0; i < path.size(); i++) {
            PuzzleState state = path.get(i);
            sb.append(renderMoveLabel(i, state.move())).append('\n');
            sb.append(renderState(state));
            sb.append('\n');
        }
        sb.append(SOLUTION_FOOTER).append("\n\n");
        return sb.toString();
    }

    /**
     * Renders time and space statistics of a finished search.
     */
    public static String renderSummary(SolutionResult result) {
        if (!result.isSolvable()) {
            return "PUZZLE IS NOT SOLVABLE\n";
        }
        return renderSummary(result.getNodesExpanded(), result.getMaxFrontierSize(), result.getGoalDepth());
    }

    static String renderSummary(int nodesExpanded, int maxFrontierSize, int goalDepth) {
        return "To solve this problem, the search algorithm expanded a total of " + nodesExpanded + " nodes.\n"
                + "The maximum number of nodes in the queue at any one time was " + maxFrontierSize + ".\n"
                + "The depth of the goal node was " + goalDepth + ".\n";
    }

    /**
     * Formats a cost without a fractional part when it is integral.
     */
    static String formatCost(double cost) {
        if (cost == Math.rint(cost) && !Double.isInfinite(cost)) {
            return String.valueOf((long) cost);
        }
        return String.format(Locale.ROOT, "%.4f", cost);
    }
}

package org.Aayush.npuzzle.app;

import org.Aayush.npuzzle.core.PuzzleCatalog;
import org.Aayush.npuzzle.core.PuzzleSearchEngine;
import org.Aayush.npuzzle.core.SolutionResult;
import org.Aayush.npuzzle.heuristic.HeuristicType;
import org.Aayush.npuzzle.state.Move;
import org.Aayush.npuzzle.state.PuzzleState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("SolutionRenderer Tests")
class SolutionRendererTest {

    @Test
    @DisplayName("3x3 grid renders one row per line with single-space padding")
    void testRenderThreeByThree() {
        assertEquals("1 2 3 \n4 5 6 \n7 8 0 \n", SolutionRenderer.renderState(PuzzleState.goal(3)));
    }

    @Test
    @DisplayName("4x4 grid pads cells to the width of the largest tile")
    void testRenderFourByFour() {
        String expected = "1  2  3  4  \n"
                + "5  6  7  8  \n"
                + "9  10 11 12 \n"
                + "13 14 15 0  \n";
        assertEquals(expected, SolutionRenderer.renderState(PuzzleState.goal(4)));
    }

    @Test
    @DisplayName("Move banners have fixed labels")
    void testMoveLabels() {
        assertEquals("------ START ------", SolutionRenderer.renderMoveLabel(0, Move.START));
        assertEquals("-- 1: MOVE UP -----", SolutionRenderer.renderMoveLabel(1, Move.UP));
        assertEquals("-- 2: MOVE DOWN ---", SolutionRenderer.renderMoveLabel(2, Move.DOWN));
        assertEquals("-- 3: MOVE LEFT ---", SolutionRenderer.renderMoveLabel(3, Move.LEFT));
        assertEquals("-- 4: MOVE RIGHT --", SolutionRenderer.renderMoveLabel(4, Move.RIGHT));
    }

    @Test
    @DisplayName("Solved path renders every state under its banner")
    void testRenderSolution() {
        SolutionResult result = new PuzzleSearchEngine().search(
                PuzzleCatalog.EIGHT_EASY.instance(),
                HeuristicType.MANHATTAN
        );

        String expected = "\n*************** SOLUTION ****************\n\n"
                + "------ START ------\n"
                + "1 2 0 \n4 5 3 \n7 8 6 \n\n"
                + "-- 1: MOVE DOWN ---\n"
                + "1 2 3 \n4 5 0 \n7 8 6 \n\n"
                + "-- 2: MOVE DOWN ---\n"
                + "1 2 3 \n4 5 6 \n7 8 0 \n\n"
                + "*****************************************\n\n";
        assertEquals(expected, SolutionRenderer.renderSolution(result.getPath()));
    }

    @Test
    @DisplayName("Empty path renders the no-solution marker")
    void testRenderEmpty() {
        String expected = "\n*************** SOLUTION ****************\n\n"
                + "-- NO SOLUTION --\n\n"
                + "*****************************************\n\n";
        assertEquals(expected, SolutionRenderer.renderSolution(List.of()));
    }

    @Test
    @DisplayName("Summary reports expansions, peak frontier and depth")
    void testSummary() {
        SolutionResult result = new PuzzleSearchEngine().search(
                PuzzleCatalog.EIGHT_EASY.instance(),
                HeuristicType.UNIFORM_COST
        );

        assertEquals(
                "To solve this problem, the search algorithm expanded a total of 3 nodes.\n"
                        + "The maximum number of nodes in the queue at any one time was 4.\n"
                        + "The depth of the goal node was 3.\n",
                SolutionRenderer.renderSummary(result)
        );

        SolutionResult unsolvable = new PuzzleSearchEngine().search(
                PuzzleCatalog.EIGHT_IMPOSSIBLE.instance(),
                HeuristicType.UNIFORM_COST
        );
        assertEquals("PUZZLE IS NOT SOLVABLE\n", SolutionRenderer.renderSummary(unsolvable));
    }

    @Test
    @DisplayName("Integral costs print without decimals, others with four places")
    void testFormatCost() {
        assertEquals("2", SolutionRenderer.formatCost(2.0d));
        assertEquals("0", SolutionRenderer.formatCost(0.0d));
        assertEquals("4.4721", SolutionRenderer.formatCost(2.0d * Math.sqrt(5.0d)));
    }
}

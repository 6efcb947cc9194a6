package org.Aayush.npuzzle.core;

import org.Aayush.npuzzle.heuristic.HeuristicType;
import org.Aayush.npuzzle.state.Move;
import org.Aayush.npuzzle.state.PuzzleState;
import org.Aayush.npuzzle.testutil.PuzzleFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("PuzzleSearchEngine Tests")
class PuzzleSearchEngineTest {
    private final PuzzleSearchEngine engine = new PuzzleSearchEngine();

    private static void assertValidPath(PuzzleInstance instance, SolutionResult result) {
        List<PuzzleState> path = result.getPath();
        assertFalse(path.isEmpty());
        assertArrayEquals(instance.startState().tiles(), path.get(0).tiles());
        assertEquals(Move.START, path.get(0).move());
        assertTrue(path.get(path.size() - 1).isGoal());
        assertEquals(path.size(), result.getGoalDepth());
        for (int i = 0; i < path.size(); i++) {
            assertEquals(i, path.get(i).g(), "g along the path");
            if (i > 0) {
                assertTrue(PuzzleFixtures.isSingleSlide(path.get(i - 1), path.get(i)), "step " + i);
                assertEquals(path.get(i - 1).key(), path.get(i).parentKey());
            }
        }
    }

    private static void assertStats(SolutionResult result, int depth, int expanded, int maxFrontier) {
        assertEquals(depth, result.getGoalDepth(), "depth");
        assertEquals(expanded, result.getNodesExpanded(), "nodes expanded");
        assertEquals(maxFrontier, result.getMaxFrontierSize(), "max frontier");
    }

    @Nested
    @DisplayName("1. Small Instances")
    class SmallInstanceTests {

        @Test
        @DisplayName("Easy 8-puzzle: two DOWN moves (depth 3), uniform cost expands 3 with peak frontier 4")
        void testEasyUniformCost() {
            PuzzleInstance instance = PuzzleCatalog.EIGHT_EASY.instance();
            SolutionResult result = engine.search(instance, HeuristicType.UNIFORM_COST);

            assertTrue(result.isSolvable());
            assertTrue(result.solved());
            assertValidPath(instance, result);
            assertStats(result, 3, 3, 4);
            assertEquals(List.of(Move.DOWN, Move.DOWN), result.moves());
            assertArrayEquals(new int[]{1, 2, 3, 4, 5, 0, 7, 8, 6}, result.getPath().get(1).tiles());
            assertEquals(HeuristicType.UNIFORM_COST, result.getHeuristicType());
        }

        @Test
        @DisplayName("Easy 8-puzzle: Manhattan expands 2 with peak frontier 3")
        void testEasyManhattan() {
            PuzzleInstance instance = PuzzleCatalog.EIGHT_EASY.instance();
            SolutionResult result = engine.search(instance, HeuristicType.MANHATTAN);

            assertValidPath(instance, result);
            assertStats(result, 3, 2, 3);
            assertEquals(2.0d, result.getPath().get(0).h());
        }

        @Test
        @DisplayName("Goal depth counts path states, one more than the moves made")
        void testDepthCountsStates() {
            SolutionResult result = engine.search(PuzzleCatalog.EIGHT_DOABLE.instance(), HeuristicType.MANHATTAN);

            assertEquals(5, result.getPath().size());
            assertEquals(5, result.getGoalDepth());
            assertEquals(4, result.moves().size());
            assertEquals(4, result.getPath().get(result.getPath().size() - 1).g());
        }

        @Test
        @DisplayName("Start already at goal: single-state path of depth 1 and no expansions")
        void testTrivial() {
            for (PuzzleCatalog entry : List.of(PuzzleCatalog.EIGHT_TRIVIAL, PuzzleCatalog.FIFTEEN_TRIVIAL)) {
                for (HeuristicType type : HeuristicType.values()) {
                    SolutionResult result = engine.search(entry.instance(), type);

                    assertEquals(1, result.getPath().size(), entry + " / " + type);
                    assertStats(result, 1, 0, 0);
                    assertTrue(result.moves().isEmpty());
                }
            }
        }

        @Test
        @DisplayName("1x1 and 2x2 grids are handled")
        void testTinyGrids() {
            SolutionResult single = engine.search(PuzzleInstance.of(new int[]{0}), HeuristicType.MANHATTAN);
            assertStats(single, 1, 0, 0);

            PuzzleInstance twoByTwo = PuzzleInstance.of(new int[]{0, 1, 3, 2});
            assertTrue(twoByTwo.solvable());
            SolutionResult result = engine.search(twoByTwo, HeuristicType.MANHATTAN_LINEAR_CONFLICT);
            assertValidPath(twoByTwo, result);
        }

        @Test
        @DisplayName("Unknown heuristic falls back to uniform cost")
        void testNullHeuristic() {
            SolutionResult result = engine.search(PuzzleCatalog.EIGHT_EASY.instance(), null);

            assertEquals(HeuristicType.UNIFORM_COST, result.getHeuristicType());
            assertStats(result, 3, 3, 4);
        }
    }

    @Nested
    @DisplayName("2. Unsolvable Instances")
    class UnsolvableTests {

        @Test
        @DisplayName("Parity failure returns an empty result without searching")
        void testImpossible() {
            for (PuzzleCatalog entry : List.of(PuzzleCatalog.EIGHT_IMPOSSIBLE, PuzzleCatalog.FIFTEEN_IMPOSSIBLE)) {
                SolutionResult result = engine.search(entry.instance(), HeuristicType.MANHATTAN);

                assertFalse(result.isSolvable());
                assertFalse(result.solved());
                assertTrue(result.getPath().isEmpty());
                assertStats(result, 0, 0, 0);
            }
        }

        @Test
        @DisplayName("Observer only hears about the parity failure")
        void testObserverOnUnsolvable() {
            RecordingObserver observer = new RecordingObserver();
            engine.search(PuzzleCatalog.EIGHT_IMPOSSIBLE.instance(), HeuristicType.MANHATTAN, observer);

            assertEquals(List.of("unsolvable"), observer.events);
        }
    }

    @Nested
    @DisplayName("3. Optimality Across Heuristics")
    class OptimalityTests {

        @Test
        @DisplayName("8-puzzle catalog: every heuristic finds the optimal depth (moves plus one)")
        void testEightPuzzleDepths() {
            for (PuzzleCatalog entry : List.of(
                    PuzzleCatalog.EIGHT_EASY,
                    PuzzleCatalog.EIGHT_DOABLE,
                    PuzzleCatalog.EIGHT_OH_BOY,
                    PuzzleCatalog.EIGHT_WAIT_FOR_IT)) {
                PuzzleInstance instance = entry.instance();
                for (HeuristicType type : HeuristicType.values()) {
                    SolutionResult result = engine.search(instance, type);
                    assertEquals(entry.optimalMoves() + 1, result.getGoalDepth(), entry + " / " + type);
                    assertValidPath(instance, result);
                }
            }
        }

        @Test
        @DisplayName("Stronger heuristics expand no more nodes: LC <= Manhattan <= Misplaced <= UCS")
        void testNodeOrdering() {
            for (PuzzleCatalog entry : List.of(
                    PuzzleCatalog.EIGHT_DOABLE,
                    PuzzleCatalog.EIGHT_OH_BOY,
                    PuzzleCatalog.EIGHT_WAIT_FOR_IT,
                    PuzzleCatalog.FIFTEEN_EASY,
                    PuzzleCatalog.FIFTEEN_DOABLE)) {
                Map<HeuristicType, Integer> expanded = new EnumMap<>(HeuristicType.class);
                for (HeuristicType type : HeuristicType.values()) {
                    expanded.put(type, engine.search(entry.instance(), type).getNodesExpanded());
                }
                String label = entry + " " + expanded;
                assertTrue(expanded.get(HeuristicType.MANHATTAN_LINEAR_CONFLICT) <= expanded.get(HeuristicType.MANHATTAN), label);
                assertTrue(expanded.get(HeuristicType.MANHATTAN) <= expanded.get(HeuristicType.MISPLACED_TILE), label);
                assertTrue(expanded.get(HeuristicType.MANHATTAN) <= expanded.get(HeuristicType.EUCLIDEAN), label);
                assertTrue(expanded.get(HeuristicType.MISPLACED_TILE) <= expanded.get(HeuristicType.UNIFORM_COST), label);
            }
        }

        @Test
        @DisplayName("Reproducible statistics for the hard 8-puzzles")
        void testHardEightStatistics() {
            PuzzleInstance ohBoy = PuzzleCatalog.EIGHT_OH_BOY.instance();
            assertStats(engine.search(ohBoy, HeuristicType.UNIFORM_COST), 23, 91_120, 24_983);
            assertStats(engine.search(ohBoy, HeuristicType.MISPLACED_TILE), 23, 9_121, 5_046);
            assertStats(engine.search(ohBoy, HeuristicType.MANHATTAN), 23, 741, 407);
            assertStats(engine.search(ohBoy, HeuristicType.MANHATTAN_LINEAR_CONFLICT), 23, 466, 261);

            PuzzleInstance waitForIt = PuzzleCatalog.EIGHT_WAIT_FOR_IT.instance();
            assertStats(engine.search(waitForIt, HeuristicType.UNIFORM_COST), 32, 181_438, 25_134);
            assertStats(engine.search(waitForIt, HeuristicType.MANHATTAN), 32, 21_197, 8_862);
            assertStats(engine.search(waitForIt, HeuristicType.MANHATTAN_LINEAR_CONFLICT), 32, 12_508, 5_983);
        }

        @Test
        @DisplayName("15-puzzle catalog solved optimally by the informed heuristics")
        void testFifteenPuzzle() {
            PuzzleInstance easy = PuzzleCatalog.FIFTEEN_EASY.instance();
            assertStats(engine.search(easy, HeuristicType.UNIFORM_COST), 4, 7, 10);
            assertStats(engine.search(easy, HeuristicType.MANHATTAN), 4, 3, 4);

            PuzzleInstance doable = PuzzleCatalog.FIFTEEN_DOABLE.instance();
            assertStats(engine.search(doable, HeuristicType.UNIFORM_COST), 10, 1_790, 1_900);
            assertStats(engine.search(doable, HeuristicType.MANHATTAN), 10, 9, 14);
            assertStats(engine.search(doable, HeuristicType.MANHATTAN_LINEAR_CONFLICT), 10, 9, 14);

            PuzzleInstance waitForIt = PuzzleCatalog.FIFTEEN_WAIT_FOR_IT.instance();
            SolutionResult manhattan = engine.search(waitForIt, HeuristicType.MANHATTAN);
            SolutionResult conflict = engine.search(waitForIt, HeuristicType.MANHATTAN_LINEAR_CONFLICT);
            assertValidPath(waitForIt, manhattan);
            assertValidPath(waitForIt, conflict);
            assertEquals(36, manhattan.getGoalDepth());
            assertEquals(36, conflict.getGoalDepth());
            assertTrue(conflict.getNodesExpanded() <= manhattan.getNodesExpanded());
        }

        @Test
        @DisplayName("Random 3x3 scrambles: all heuristics agree with uniform-cost depth")
        void testRandomScrambles() {
            for (long seed = 0; seed < 25; seed++) {
                PuzzleInstance instance = PuzzleInstance.of(PuzzleFixtures.randomWalk(3, 30, seed));
                int optimal = engine.search(instance, HeuristicType.UNIFORM_COST).getGoalDepth();
                for (HeuristicType type : List.of(
                        HeuristicType.MISPLACED_TILE,
                        HeuristicType.EUCLIDEAN,
                        HeuristicType.MANHATTAN)) {
                    assertEquals(optimal, engine.search(instance, type).getGoalDepth(), "seed " + seed + " / " + type);
                }
            }
        }
    }

    @Nested
    @DisplayName("4. Observer Contract")
    class ObserverTests {

        @Test
        @DisplayName("Callbacks fire in order with running statistics")
        void testCallbackOrder() {
            RecordingObserver observer = new RecordingObserver();
            SolutionResult result = engine.search(PuzzleCatalog.EIGHT_EASY.instance(), HeuristicType.UNIFORM_COST, observer);

            assertEquals(List.of(
                    "start h=0.0",
                    "expand 1 frontier=2",
                    "expand 2 frontier=3",
                    "expand 3 frontier=4",
                    "goal expanded=3 max=4"
            ), observer.events);
            assertEquals(result.getNodesExpanded(), observer.expansions);
        }

        @Test
        @DisplayName("An observer exception aborts the search")
        void testObserverAbort() {
            SearchObserver failing = new SearchObserver() {
                @Override
                public void onExpand(PuzzleState state, int nodesExpanded, int frontierSize) {
                    throw new IllegalStateException("stop");
                }
            };

            assertThrows(
                    IllegalStateException.class,
                    () -> engine.search(PuzzleCatalog.EIGHT_DOABLE.instance(), HeuristicType.MANHATTAN, failing)
            );
        }
    }

    static final class RecordingObserver implements SearchObserver {
        final List<String> events = new ArrayList<>();
        int expansions;

        @Override
        public void onSearchStarted(PuzzleState start) {
            events.add("start h=" + start.h());
        }

        @Override
        public void onExpand(PuzzleState state, int nodesExpanded, int frontierSize) {
            expansions++;
            events.add("expand " + nodesExpanded + " frontier=" + frontierSize);
        }

        @Override
        public void onGoalReached(PuzzleState goal, int nodesExpanded, int maxFrontierSize) {
            events.add("goal expanded=" + nodesExpanded + " max=" + maxFrontierSize);
        }

        @Override
        public void onUnsolvable(PuzzleState start) {
            events.add("unsolvable");
        }
    }
}

package org.Aayush.npuzzle.heuristic;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.npuzzle.state.PuzzleState;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Heuristic factory.
 *
 * <p>Centralizes provider selection. Providers are stateless, so one shared instance per type
 * is handed out. A missing type is not an error: it degrades to uniform-cost search.</p>
 */
@Slf4j
@UtilityClass
public final class HeuristicFactory {
    private static final Map<HeuristicType, HeuristicProvider> PROVIDERS = createProviders();

    /**
     * Returns the provider for a heuristic type.
     *
     * @param type requested heuristic type; {@code null} falls back to
     * {@link HeuristicType#UNIFORM_COST}.
     * @return shared provider instance.
     */
    public static HeuristicProvider create(HeuristicType type) {
        if (type == null) {
            log.warn("No heuristic type given, falling back to {}", HeuristicType.UNIFORM_COST);
            return PROVIDERS.get(HeuristicType.UNIFORM_COST);
        }
        return PROVIDERS.get(type);
    }

    /**
     * Returns the provider for a numeric menu selector.
     *
     * @param selector menu value in {@code 1..5}; others fall back to uniform cost.
     * @return shared provider instance.
     */
    public static HeuristicProvider forSelector(int selector) {
        return create(HeuristicType.fromSelector(selector));
    }

    /**
     * Evaluates one heuristic on one state.
     *
     * <p>Convenience for callers that score single states; the search engine binds a
     * {@link GoalBoundHeuristic} once per query instead.</p>
     *
     * @param state state to score.
     * @param type heuristic type.
     * @return non-negative estimate.
     */
    public static double cost(PuzzleState state, HeuristicType type) {
        Objects.requireNonNull(state, "state");
        return create(type)
                .bindGoal(GoalLayout.forDimension(state.dimension()))
                .estimate(state);
    }

    private static Map<HeuristicType, HeuristicProvider> createProviders() {
        Map<HeuristicType, HeuristicProvider> providers = new EnumMap<>(HeuristicType.class);
        for (HeuristicType type : HeuristicType.values()) {
            providers.put(type, switch (type) {
                case UNIFORM_COST -> new NullHeuristicProvider();
                case MISPLACED_TILE -> new MisplacedTileHeuristicProvider();
                case EUCLIDEAN -> new EuclideanHeuristicProvider();
                case MANHATTAN -> new ManhattanHeuristicProvider();
                case MANHATTAN_LINEAR_CONFLICT -> new LinearConflictHeuristicProvider();
            });
        }
        return providers;
    }
}

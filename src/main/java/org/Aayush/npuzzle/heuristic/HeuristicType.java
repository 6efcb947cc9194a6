package org.Aayush.npuzzle.heuristic;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Supported heuristic modes and their numeric menu selectors.
 *
 * <p>{@code UNIFORM_COST} disables heuristic guidance (uniform-cost search).</p>
 * <p>{@code MISPLACED_TILE}, {@code EUCLIDEAN} and {@code MANHATTAN} are admissible and
 * consistent; Euclidean is weaker than Manhattan. {@code MANHATTAN_LINEAR_CONFLICT} charges every
 * conflicting pair, so a line holding three or more mutually conflicting tiles can be
 * overestimated and optimality is not guaranteed there.</p>
 */
@Slf4j
@Getter
@Accessors(fluent = true)
public enum HeuristicType {
    UNIFORM_COST(1, "Uniform Cost Search"),
    MISPLACED_TILE(2, "A* with the Misplaced Tile heuristic"),
    EUCLIDEAN(3, "A* with the Euclidean Distance heuristic"),
    MANHATTAN(4, "A* with the Manhattan Distance heuristic"),
    MANHATTAN_LINEAR_CONFLICT(5, "A* with the Manhattan Distance and Linear Conflict heuristic");

    private final int selector;
    private final String description;

    HeuristicType(int selector, String description) {
        this.selector = selector;
        this.description = description;
    }

    /**
     * Resolves a numeric menu selector.
     *
     * <p>Unknown selectors are not fatal: they degrade to {@link #UNIFORM_COST}.</p>
     *
     * @param selector menu value in {@code 1..5}.
     * @return matching heuristic type, or {@link #UNIFORM_COST}.
     */
    public static HeuristicType fromSelector(int selector) {
        for (HeuristicType type : values()) {
            if (type.selector == selector) {
                return type;
            }
        }
        log.warn("Unknown heuristic selector {}, falling back to {}", selector, UNIFORM_COST);
        return UNIFORM_COST;
    }
}

package org.Aayush.npuzzle.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.npuzzle.state.PuzzleState;

/**
 * Per-query deterministic bounds for search work and memory growth.
 *
 * <p>The engine itself never stops early; a budget is attached as a {@link SearchObserver}
 * and aborts the search by throwing once a ceiling is crossed.</p>
 */
@Slf4j
@Getter
@Accessors(fluent = true)
public final class SearchBudget implements SearchObserver {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static final String REASON_EXPANDED_EXCEEDED = "NP_BUDGET_EXPANDED_EXCEEDED";
    public static final String REASON_FRONTIER_EXCEEDED = "NP_BUDGET_FRONTIER_EXCEEDED";

    static final String PROP_MAX_EXPANDED = "npuzzle.search.maxExpandedStates";
    static final String PROP_MAX_FRONTIER = "npuzzle.search.maxFrontierSize";

    private final int maxExpandedStates;
    private final int maxFrontierSize;

    private SearchBudget(int maxExpandedStates, int maxFrontierSize) {
        this.maxExpandedStates = normalizeBound(maxExpandedStates);
        this.maxFrontierSize = normalizeBound(maxFrontierSize);
    }

    /**
     * Creates a budget with explicit bounds; non-positive values mean unbounded.
     */
    public static SearchBudget of(int maxExpandedStates, int maxFrontierSize) {
        return new SearchBudget(maxExpandedStates, maxFrontierSize);
    }

    /**
     * Creates a budget that never trips.
     */
    public static SearchBudget unbounded() {
        return new SearchBudget(UNBOUNDED, UNBOUNDED);
    }

    /**
     * Loads budget values from system properties.
     */
    public static SearchBudget defaults() {
        return SearchBudget.of(
                readBound(PROP_MAX_EXPANDED),
                readBound(PROP_MAX_FRONTIER)
        );
    }

    /**
     * @return whether both ceilings are unbounded.
     */
    public boolean isUnbounded() {
        return maxExpandedStates == UNBOUNDED && maxFrontierSize == UNBOUNDED;
    }

    @Override
    public void onExpand(PuzzleState state, int nodesExpanded, int frontierSize) {
        checkExpandedStates(nodesExpanded);
        checkFrontierSize(frontierSize);
    }

    /**
     * Validates expansion count against configured bound.
     */
    void checkExpandedStates(int nodesExpanded) {
        if (nodesExpanded > maxExpandedStates) {
            throw new BudgetExceededException(
                    REASON_EXPANDED_EXCEEDED,
                    "expanded-state budget exceeded: " + nodesExpanded + " > " + maxExpandedStates
            );
        }
    }

    /**
     * Validates frontier size against configured bound.
     */
    void checkFrontierSize(int frontierSize) {
        if (frontierSize > maxFrontierSize) {
            throw new BudgetExceededException(
                    REASON_FRONTIER_EXCEEDED,
                    "frontier budget exceeded: " + frontierSize + " > " + maxFrontierSize
            );
        }
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            log.warn("Ignoring non-numeric {}='{}', search stays unbounded", property, raw);
            return UNBOUNDED;
        }
    }

    /**
     * Deterministic exception for budget fail-fast paths.
     */
    @Getter
    @Accessors(fluent = true)
    public static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;

        BudgetExceededException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }
    }
}

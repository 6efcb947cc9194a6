package org.Aayush.npuzzle.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when attempting to extract from an empty {@link FrontierQueue}.
 */
@Getter
@Accessors(fluent = true)
public class EmptyQueueException extends IllegalStateException {
    /** States admitted over the frontier's lifetime, all of them already extracted. */
    private final long admittedStates;

    public EmptyQueueException(long admittedStates) {
        super("Frontier is empty after " + admittedStates + " admitted states");
        this.admittedStates = admittedStates;
    }
}

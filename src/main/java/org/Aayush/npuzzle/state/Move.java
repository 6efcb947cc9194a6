package org.Aayush.npuzzle.state;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Blank-square operations.
 *
 * <p>Declaration order of the four real moves is the canonical successor order and
 * therefore the tie-break order for children of equal cost.</p>
 */
@Getter
@Accessors(fluent = true)
public enum Move {
    /** Marker for the start state, which was not produced by any move. */
    START(0, "START"),
    UP(1, "MOVE UP"),
    DOWN(2, "MOVE DOWN"),
    LEFT(3, "MOVE LEFT"),
    RIGHT(4, "MOVE RIGHT");

    private final int code;
    private final String label;

    Move(int code, String label) {
        this.code = code;
        this.label = label;
    }

    /**
     * Returns the move that undoes this one.
     *
     * @return inverse move ({@link #START} maps to itself).
     */
    public Move inverse() {
        return switch (this) {
            case START -> START;
            case UP -> DOWN;
            case DOWN -> UP;
            case LEFT -> RIGHT;
            case RIGHT -> LEFT;
        };
    }
}

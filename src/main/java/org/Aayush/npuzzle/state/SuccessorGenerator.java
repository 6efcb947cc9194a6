package org.Aayush.npuzzle.state;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Produces the states reachable from one state by a single blank slide.
 *
 * <p>Children come out in UP, DOWN, LEFT, RIGHT order. They carry the swapped tiles, the new
 * blank index and the move tag only; costs and parent links are assigned by the caller.</p>
 */
@UtilityClass
public final class SuccessorGenerator {
    private static final Move[] SLIDES = {Move.UP, Move.DOWN, Move.LEFT, Move.RIGHT};

    /**
     * Generates every feasible child of a state.
     *
     * @param state state to expand.
     * @return up to four children in canonical order.
     */
    public static List<PuzzleState> successors(PuzzleState state) {
        Objects.requireNonNull(state, "state");
        List<PuzzleState> children = new ArrayList<>(SLIDES.length);
        for (Move move : SLIDES) {
            if (canMove(state, move)) {
                children.add(state.slide(targetIndex(state, move), move));
            }
        }
        return children;
    }

    /**
     * Returns whether the blank can slide in a direction without leaving the grid.
     */
    public static boolean canMove(PuzzleState state, Move move) {
        int dimension = state.dimension();
        int blankRow = state.rowOf(state.blankIndex());
        int blankCol = state.colOf(state.blankIndex());
        return switch (move) {
            case START -> false;
            case UP -> blankRow > 0;
            case DOWN -> blankRow < dimension - 1;
            case LEFT -> blankCol > 0;
            case RIGHT -> blankCol < dimension - 1;
        };
    }

    /**
     * Applies one blank slide.
     *
     * @param state source state.
     * @param move direction of the blank.
     * @return child state with unset costs.
     * @throws IllegalArgumentException when the move is {@link Move#START} or leaves the grid.
     */
    public static PuzzleState apply(PuzzleState state, Move move) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(move, "move");
        if (!canMove(state, move)) {
            throw new IllegalArgumentException(
                    "move " + move + " is not feasible with blank at index " + state.blankIndex()
            );
        }
        return state.slide(targetIndex(state, move), move);
    }

    /**
     * Returns the index whose tile swaps into the blank for a feasible move.
     */
    private static int targetIndex(PuzzleState state, Move move) {
        int blankIndex = state.blankIndex();
        int dimension = state.dimension();
        return switch (move) {
            case UP -> blankIndex - dimension;
            case DOWN -> blankIndex + dimension;
            case LEFT -> blankIndex - 1;
            case RIGHT -> blankIndex + 1;
            case START -> throw new IllegalArgumentException("START is not a slide");
        };
    }
}

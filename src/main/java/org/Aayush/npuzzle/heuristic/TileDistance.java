package org.Aayush.npuzzle.heuristic;

import lombok.experimental.UtilityClass;

/**
 * Numeric helpers for per-tile grid distances.
 */
@UtilityClass
final class TileDistance {

    /**
     * Computes straight-line distance between two grid cells.
     */
    static double euclidean(int row1, int col1, int row2, int col2) {
        return Math.hypot(row2 - row1, col2 - col1);
    }

    /**
     * Computes city-block distance between two grid cells.
     */
    static int manhattan(int row1, int col1, int row2, int col2) {
        return Math.abs(row2 - row1) + Math.abs(col2 - col1);
    }
}

package org.Aayush.npuzzle.app;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;
import org.Aayush.npuzzle.state.InvalidGridException;

import java.util.regex.Pattern;

/**
 * Parses a puzzle typed on one line, e.g. {@code "1 2 0 4 5 3 7 8 6"}.
 *
 * <p>Tokens may be separated by whitespace or commas. Only the token syntax is checked here;
 * shape and permutation rules are enforced when the grid becomes a puzzle state.</p>
 */
@UtilityClass
public final class PuzzleInputParser {
    private static final Pattern SEPARATORS = Pattern.compile("[\\s,]+");

    /**
     * @param line raw user input.
     * @return flattened grid.
     * @throws InvalidGridException when the line is empty or holds a non-integer token.
     */
    public static int[] parse(String line) {
        if (line == null || line.isBlank()) {
            throw new InvalidGridException(InvalidGridException.REASON_GRID_REQUIRED, "puzzle input is empty");
        }
        IntArrayList values = new IntArrayList();
        for (String token : SEPARATORS.split(line.trim())) {
            if (token.isEmpty()) {
                continue;
            }
            try {
                values.add(Integer.parseInt(token));
            } catch (NumberFormatException ex) {
                throw new InvalidGridException(
                        InvalidGridException.REASON_GRID_PARSE_FAILED,
                        "not an integer: '" + token + "'",
                        ex
                );
            }
        }
        return values.toIntArray();
    }
}

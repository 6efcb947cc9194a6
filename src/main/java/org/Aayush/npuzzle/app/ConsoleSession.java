package org.Aayush.npuzzle.app;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.npuzzle.core.NPuzzle;
import org.Aayush.npuzzle.core.PuzzleCatalog;
import org.Aayush.npuzzle.core.PuzzleCoreException;
import org.Aayush.npuzzle.core.SearchBudget;
import org.Aayush.npuzzle.core.SearchObserver;
import org.Aayush.npuzzle.heuristic.HeuristicType;
import org.Aayush.npuzzle.state.InvalidGridException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * One interactive solver session over a line-based console.
 *
 * <p>Prompts for a built-in or typed puzzle, a heuristic menu choice and whether to trace the
 * search, then prints the solution. Invalid menu input ends the session with a message.</p>
 */
@Slf4j
public final class ConsoleSession {
    public static final int EXIT_OK = 0;
    public static final int EXIT_INVALID_INPUT = 1;
    public static final int EXIT_SEARCH_ABORTED = 2;

    private final BufferedReader in;
    private final PrintStream out;
    private final SearchBudget budget;

    public ConsoleSession(BufferedReader in, PrintStream out) {
        this(in, out, SearchBudget.defaults());
    }

    public ConsoleSession(BufferedReader in, PrintStream out, SearchBudget budget) {
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    /**
     * Runs the session to completion.
     *
     * @return process exit status.
     */
    public int run() {
        out.println("Welcome to the N-puzzle solver.");
        out.print("Type \"1\" to use a default puzzle, or \"2\" to enter your own puzzle: ");
        int puzzleChoice = readChoice();

        int[] grid;
        if (puzzleChoice == 1) {
            grid = chooseCatalogPuzzle();
        } else if (puzzleChoice == 2) {
            grid = enterPuzzle();
        } else {
            return invalidInput();
        }
        if (grid == null) {
            return EXIT_INVALID_INPUT;
        }

        NPuzzle puzzle;
        try {
            puzzle = new NPuzzle(grid, budget);
        } catch (InvalidGridException ex) {
            out.println();
            out.println("Invalid puzzle: " + ex.getMessage());
            return EXIT_INVALID_INPUT;
        }

        out.println();
        for (HeuristicType type : HeuristicType.values()) {
            out.println(type.selector() + ". " + type.description() + ".");
        }
        out.print("Enter your choice of algorithm: ");
        int algorithmChoice = readChoice();
        if (algorithmChoice < 1 || algorithmChoice > HeuristicType.values().length) {
            return invalidInput();
        }

        out.print("Show every expansion? (y/N): ");
        boolean verbose = "y".equalsIgnoreCase(readLine().trim());
        out.println();

        SearchObserver observer = verbose ? new VerboseSearchObserver(out) : SearchObserver.NOOP;
        try {
            puzzle.solve(HeuristicType.fromSelector(algorithmChoice), observer);
        } catch (PuzzleCoreException ex) {
            out.println("Search aborted: " + ex.getMessage());
            return EXIT_SEARCH_ABORTED;
        }

        out.print(SolutionRenderer.renderSolution(puzzle.solution()));
        if (!verbose) {
            out.print(SolutionRenderer.renderSummary(puzzle.lastResult()));
        }
        return EXIT_OK;
    }

    private int[] chooseCatalogPuzzle() {
        out.println();
        PuzzleCatalog[] entries = PuzzleCatalog.values();
        for (int i = 0; i < entries.length; i++) {
            out.println((i + 1) + ". " + entries[i].title());
        }
        out.print("Choose a default puzzle: ");
        int choice = readChoice();
        if (choice < 1 || choice > entries.length) {
            invalidInput();
            return null;
        }
        return entries[choice - 1].grid();
    }

    private int[] enterPuzzle() {
        out.println();
        out.println("Enter your puzzle on one line. Use space between numbers,");
        out.println("and 0 to represent the blank. Press ENTER/RETURN when done.");
        out.print("Enter puzzle: ");
        try {
            return PuzzleInputParser.parse(readLine());
        } catch (InvalidGridException ex) {
            out.println();
            out.println("Invalid puzzle: " + ex.getMessage());
            return null;
        }
    }

    private int invalidInput() {
        out.println();
        out.println("Invalid input. Exiting...");
        return EXIT_INVALID_INPUT;
    }

    /**
     * Reads a menu number; anything unparsable maps to {@code -1}.
     */
    private int readChoice() {
        String line = readLine().trim();
        try {
            return Integer.parseInt(line);
        } catch (NumberFormatException ex) {
            log.debug("Menu input '{}' is not a number", line);
            return -1;
        }
    }

    /**
     * Reads one line; end of input reads as an empty line.
     */
    private String readLine() {
        try {
            String line = in.readLine();
            return line == null ? "" : line;
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to read console input", ex);
        }
    }
}

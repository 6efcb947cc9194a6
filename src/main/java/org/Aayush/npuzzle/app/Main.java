package org.Aayush.npuzzle.app;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Console entry point of the N-puzzle solver.
 */
public class Main {
    /**
     * Launches one interactive solver session on standard input and output.
     *
     * @param args command-line arguments (unused).
     */
    public static void main(String[] args) {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        int status = new ConsoleSession(in, System.out).run();
        if (status != ConsoleSession.EXIT_OK) {
            System.exit(status);
        }
    }
}

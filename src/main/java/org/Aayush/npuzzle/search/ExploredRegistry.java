package org.Aayush.npuzzle.search;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.Aayush.npuzzle.state.PuzzleState;
import org.Aayush.npuzzle.state.StateKey;

import java.util.Objects;

/**
 * Registry of expanded states, keyed by canonical tile identity.
 * <p>
 * The registry is the single owner of finalized states. Parent links are stored as keys and
 * resolved through {@link #get(StateKey)}, so entries are never evicted while a search is alive.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> This class is NOT thread-safe. It is intended
 * for use within one search invocation.
 * </p>
 */
public class ExploredRegistry {

    private final Object2ObjectOpenHashMap<StateKey, PuzzleState> explored;

    public ExploredRegistry() {
        this.explored = new Object2ObjectOpenHashMap<>();
    }

    /**
     * Marks a state as explored if it hasn't been explored already.
     *
     * @param state costed state being expanded.
     * @return {@code true} if the state was recorded (was NOT previously explored).
     * {@code false} if its key was already present; the stored copy is kept.
     */
    public boolean markExplored(PuzzleState state) {
        Objects.requireNonNull(state, "state");
        return explored.putIfAbsent(state.key(), state) == null;
    }

    /**
     * Checks if a tile arrangement has been explored.
     */
    public boolean isExplored(StateKey key) {
        return explored.containsKey(key);
    }

    /**
     * Returns the explored copy of a state, or {@code null} when absent.
     */
    public PuzzleState get(StateKey key) {
        return explored.get(key);
    }

    /**
     * @return number of explored states.
     */
    public int size() {
        return explored.size();
    }
}

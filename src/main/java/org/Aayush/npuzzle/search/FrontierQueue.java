package org.Aayush.npuzzle.search;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.npuzzle.state.PuzzleState;
import org.Aayush.npuzzle.state.StateKey;

import java.util.Arrays;
import java.util.Objects;

/**
 * Min-priority frontier for best-first puzzle search, paired with a key registry.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Atomic admission:</strong> {@link #admit(PuzzleState)} inserts into the binary heap and the
 * key registry together; {@link #extractMin()} removes from both, so duplicate detection never sees a
 * stale entry.</li>
 * <li><strong>No duplicates:</strong> a key can be present at most once. Callers are expected to check
 * {@link #contains(StateKey)} first; admitting a present key is a contract violation.</li>
 * <li><strong>Deterministic order:</strong> ascending {@code f}, then ascending {@code g} (shallower
 * states first), then admission order. With a consistent heuristic this pops every state
 * after all states on its optimal path, so its first-admitted copy is never beaten later.</li>
 * </ul>
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. It is intended for single-threaded use.</p>
 */
public class FrontierQueue {
    private static final int DEFAULT_CAPACITY = 64;

    // The Binary Heap (1-based indexing for easier parent/child math)
    private Entry[] heap;
    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    private final Object2ObjectOpenHashMap<StateKey, PuzzleState> registry;
    private long nextSequence = 0L;

    /**
     * Creates a frontier with default initial capacity.
     */
    public FrontierQueue() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Creates a frontier with an initial capacity hint. The heap grows on demand.
     *
     * @param initialCapacity expected number of simultaneous entries, must be positive.
     * @throws IllegalArgumentException if capacity is not positive.
     */
    public FrontierQueue(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive");
        }
        // +1 for 1-based heap indexing
        this.heap = new Entry[initialCapacity + 1];
        this.registry = new Object2ObjectOpenHashMap<>(initialCapacity);
    }

    /**
     * Admits a costed state into the frontier.
     *
     * @param state state with {@code g}, {@code h} and parent key assigned.
     * @throws IllegalStateException if the state's key is already in the frontier.
     */
    public void admit(PuzzleState state) {
        Objects.requireNonNull(state, "state");
        StateKey key = state.key();
        if (registry.containsKey(key)) {
            throw new IllegalStateException("State already in frontier: " + key);
        }

        if (size >= heap.length - 1) {
            heap = Arrays.copyOf(heap, (heap.length - 1) * 2 + 1);
        }

        registry.put(key, state);
        size++;
        heap[size] = new Entry(state, nextSequence++);
        swim(size);
    }

    /**
     * Extracts the state with the minimum priority and drops its registry entry.
     *
     * @return the minimum state.
     * @throws EmptyQueueException if the frontier is empty.
     */
    public PuzzleState extractMin() {
        if (isEmpty()) {
            throw new EmptyQueueException(nextSequence);
        }

        Entry min = heap[1];
        heap[1] = heap[size];
        heap[size] = null; // Remove reference from heap to prevent accidental access
        size--;
        if (size > 1) {
            sink(1);
        }

        registry.remove(min.state.key());
        return min.state;
    }

    /**
     * Checks whether a tile arrangement is currently waiting in the frontier.
     */
    public boolean contains(StateKey key) {
        return registry.containsKey(key);
    }

    /**
     * Checks if the frontier is empty.
     * @return true if empty, false otherwise.
     */
    public boolean isEmpty() {
        return size == 0;
    }

    // --- Heap Helper Methods ---

    /**
     * Heap up-heap operation for newly admitted states.
     */
    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    /**
     * Heap down-heap operation after min extraction.
     */
    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    /**
     * Returns whether heap index {@code i} has lower priority than index {@code j}.
     */
    private boolean greater(int i, int j) {
        return heap[i].compareTo(heap[j]) > 0;
    }

    private void swap(int i, int j) {
        Entry tmp = heap[i];
        heap[i] = heap[j];
        heap[j] = tmp;
    }

    private record Entry(PuzzleState state, long sequence) implements Comparable<Entry> {
        /**
         * Orders by {@code f}, then shallower {@code g} first, then admission order.
         */
        @Override
        public int compareTo(Entry other) {
            int byPriority = Double.compare(state.f(), other.state.f());
            if (byPriority != 0) {
                return byPriority;
            }
            int byDepth = Integer.compare(state.g(), other.state.g());
            if (byDepth != 0) {
                return byDepth;
            }
            return Long.compare(sequence, other.sequence);
        }
    }
}

package org.drakulus.search;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;

/**
 * Binary min-heap of {@code (distance, vertex)} frontier entries for Dijkstra.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Lazy Deletion:</strong> there is no decrease-key. An improved distance is pushed as a new
 * entry and the caller discards stale entries on extraction by comparing against its best-known distance.</li>
 * <li><strong>Deterministic Ties:</strong> entries with equal distance leave the heap in insertion order.</li>
 * <li><strong>SoA Layout:</strong> vertex, distance and sequence live in parallel primitive arrays that
 * grow by doubling; no per-entry objects are allocated.</li>
 * </ul>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. One instance serves one search.</p>
 */
final class FrontierQueue {
    private static final int DEFAULT_CAPACITY = 16;

    // 1-based heap for simpler parent/child math
    private int[] vertices;
    private long[] distances;
    private long[] sequences;

    @Getter
    @Accessors(fluent = true)
    private int size = 0;
    @Getter
    @Accessors(fluent = true)
    private int peakSize = 0;

    private long nextSequence = 0L;

    FrontierQueue() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param initialCapacity expected number of simultaneous entries; must be positive.
     */
    FrontierQueue(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.vertices = new int[initialCapacity + 1];
        this.distances = new long[initialCapacity + 1];
        this.sequences = new long[initialCapacity + 1];
    }

    /**
     * Pushes a frontier entry.
     *
     * @param vertex   dense vertex id.
     * @param distance tentative distance from the source, non-negative.
     */
    void insert(int vertex, long distance) {
        if (size + 1 >= vertices.length) {
            grow();
        }
        size++;
        vertices[size] = vertex;
        distances[size] = distance;
        sequences[size] = nextSequence++;
        if (size > peakSize) {
            peakSize = size;
        }
        swim(size);
    }

    /**
     * Returns the vertex of the minimum entry without removing it.
     *
     * @throws EmptyQueueException if queue is empty.
     */
    int minVertex() {
        requireNonEmpty();
        return vertices[1];
    }

    /**
     * Returns the distance of the minimum entry without removing it.
     *
     * @throws EmptyQueueException if queue is empty.
     */
    long minDistance() {
        requireNonEmpty();
        return distances[1];
    }

    /**
     * Removes the minimum entry.
     *
     * @throws EmptyQueueException if queue is empty.
     */
    void removeMin() {
        requireNonEmpty();
        if (size > 1) {
            move(size, 1);
        }
        size--;
        if (size > 1) {
            sink(1);
        }
    }

    boolean isEmpty() {
        return size == 0;
    }

    // --- Heap Helper Methods ---

    private void requireNonEmpty() {
        if (size == 0) {
            throw new EmptyQueueException("Frontier is empty");
        }
    }

    private void grow() {
        int capacity = vertices.length * 2;
        vertices = Arrays.copyOf(vertices, capacity);
        distances = Arrays.copyOf(distances, capacity);
        sequences = Arrays.copyOf(sequences, capacity);
    }

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

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
        int distanceCompare = Long.compare(distances[i], distances[j]);
        if (distanceCompare != 0) {
            return distanceCompare > 0;
        }
        return sequences[i] > sequences[j];
    }

    private void swap(int i, int j) {
        int vertex = vertices[i];
        long distance = distances[i];
        long sequence = sequences[i];
        move(j, i);
        vertices[j] = vertex;
        distances[j] = distance;
        sequences[j] = sequence;
    }

    private void move(int from, int to) {
        vertices[to] = vertices[from];
        distances[to] = distances[from];
        sequences[to] = sequences[from];
    }
}

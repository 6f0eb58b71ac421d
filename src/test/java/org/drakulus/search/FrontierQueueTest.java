package org.drakulus.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.PriorityQueue;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FrontierQueue Tests")
class FrontierQueueTest {

    @Test
    @DisplayName("Basic Insert and Extract Order")
    void testHeapOrdering() {
        FrontierQueue queue = new FrontierQueue();
        queue.insert(1, 50L);
        queue.insert(2, 10L);
        queue.insert(3, 30L);

        assertEquals(2, queue.minVertex());
        assertEquals(10L, queue.minDistance());
        queue.removeMin();
        assertEquals(3, queue.minVertex());
        queue.removeMin();
        assertEquals(1, queue.minVertex());
        queue.removeMin();
        assertTrue(queue.isEmpty());
    }

    @Test
    @DisplayName("Equal distances leave in insertion order")
    void testDeterministicTies() {
        FrontierQueue queue = new FrontierQueue(2);
        int[] order = {7, 3, 9, 1, 5};
        for (int vertex : order) {
            queue.insert(vertex, 4L);
        }
        for (int vertex : order) {
            assertEquals(vertex, queue.minVertex());
            queue.removeMin();
        }
    }

    @Test
    @DisplayName("Duplicate vertex entries are kept (lazy deletion)")
    void testDuplicatesKept() {
        FrontierQueue queue = new FrontierQueue();
        queue.insert(5, 50L);
        queue.insert(5, 30L);
        assertEquals(2, queue.size());
        assertEquals(30L, queue.minDistance());
    }

    @Test
    @DisplayName("Empty queue access throws EmptyQueueException")
    void testEmptyAccess() {
        FrontierQueue queue = new FrontierQueue();
        assertThrows(EmptyQueueException.class, queue::minVertex);
        assertThrows(EmptyQueueException.class, queue::minDistance);
        assertThrows(EmptyQueueException.class, queue::removeMin);
    }

    @Test
    @DisplayName("Validation: non-positive capacity")
    void testConstructorValidation() {
        assertThrows(IllegalArgumentException.class, () -> new FrontierQueue(0));
    }

    @Test
    @DisplayName("Stress: 50k random operations against PriorityQueue")
    void testRandomOperations() {
        FrontierQueue queue = new FrontierQueue(1);
        PriorityQueue<Long> reference = new PriorityQueue<>();
        Random rand = new Random(42);

        for (int i = 0; i < 50_000; i++) {
            if (reference.isEmpty() || rand.nextInt(3) > 0) {
                long distance = rand.nextInt(1_000);
                queue.insert(i, distance);
                reference.add(distance);
            } else {
                assertEquals(reference.poll().longValue(), queue.minDistance());
                queue.removeMin();
            }
            assertEquals(reference.size(), queue.size());
        }
        assertTrue(queue.peakSize() >= queue.size());
    }
}

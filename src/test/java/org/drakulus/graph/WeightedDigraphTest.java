package org.drakulus.graph;

import org.drakulus.core.id.IDMapper;
import org.drakulus.testutil.GraphFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WeightedDigraph Tests")
class WeightedDigraphTest {

    @Nested
    @DisplayName("1. Construction and Invariants")
    class ConstructionTests {

        @Test
        @DisplayName("Edge targets are declared as vertices with empty adjacency")
        void testImplicitSinkVertex() {
            WeightedDigraph graph = GraphFixtures.graph("1->2:10");

            assertEquals(2, graph.vertexCount());
            assertEquals(1, graph.edgeCount());
            assertEquals(List.of("1", "2"), graph.vertices());
            assertEquals(Map.of(), graph.successors("2"), "Sink must have empty adjacency, not be absent");
        }

        @Test
        @DisplayName("Self-loop is rejected")
        void testSelfLoopRejected() {
            GraphModelException ex = assertThrows(GraphModelException.class,
                    () -> WeightedDigraph.builder().addEdge("a", "a", 1));
            assertEquals(WeightedDigraph.Builder.REASON_SELF_LOOP, ex.getReasonCode());
            assertTrue(ex.getMessage().startsWith("[" + WeightedDigraph.Builder.REASON_SELF_LOOP + "]"));
        }

        @Test
        @DisplayName("Negative weight is rejected")
        void testNegativeWeightRejected() {
            GraphModelException ex = assertThrows(GraphModelException.class,
                    () -> WeightedDigraph.builder().addEdge("a", "b", -1));
            assertEquals(WeightedDigraph.Builder.REASON_NEGATIVE_WEIGHT, ex.getReasonCode());
        }

        @Test
        @DisplayName("Blank and null labels are rejected")
        void testBlankLabelRejected() {
            GraphModelException ex = assertThrows(GraphModelException.class,
                    () -> WeightedDigraph.builder().addVertex("  "));
            assertEquals(WeightedDigraph.Builder.REASON_BLANK_VERTEX, ex.getReasonCode());
            assertThrows(NullPointerException.class, () -> WeightedDigraph.builder().addVertex(null));
        }

        @Test
        @DisplayName("Re-adding an ordered pair overwrites the weight (no multigraph)")
        void testParallelEdgeOverwrites() {
            WeightedDigraph graph = WeightedDigraph.builder()
                    .addEdge("a", "b", 5)
                    .addEdge("a", "b", 3)
                    .build();

            assertEquals(1, graph.edgeCount());
            assertEquals(OptionalInt.of(3), graph.weight("a", "b"));
        }

        @Test
        @DisplayName("Zero weight is allowed")
        void testZeroWeight() {
            WeightedDigraph graph = GraphFixtures.graph("a->b:0");
            assertEquals(OptionalInt.of(0), graph.weight("a", "b"));
        }

        @Test
        @DisplayName("fromAdjacency keeps vertex and edge order")
        void testFromAdjacency() {
            Map<String, Map<String, Integer>> adjacency = new LinkedHashMap<>();
            Map<String, Integer> fromOne = new LinkedHashMap<>();
            fromOne.put("3", 6);
            fromOne.put("2", 5);
            adjacency.put("1", fromOne);
            adjacency.put("2", Map.of("3", 4));
            adjacency.put("3", Map.of("1", 5));
            adjacency.put("4", Map.of());

            WeightedDigraph graph = WeightedDigraph.fromAdjacency(adjacency);

            assertEquals(List.of("1", "2", "3", "4"), graph.vertices());
            assertEquals(1, graph.indexOf("2"));
            assertEquals(2, graph.indexOf("3"));
            assertEquals(List.of("3", "2"), List.copyOf(graph.successors("1").keySet()));
            assertEquals(adjacency, graph.toAdjacencyMap());
        }
    }

    @Nested
    @DisplayName("2. Accessors")
    class AccessorTests {

        private final WeightedDigraph graph = GraphFixtures.graph("a->b:2", "a->c:7", "b->c:1", "d");

        @Test
        @DisplayName("Edge lookup by label")
        void testWeightLookup() {
            assertEquals(OptionalInt.of(7), graph.weight("a", "c"));
            assertTrue(graph.hasEdge("b", "c"));
            assertFalse(graph.hasEdge("c", "b"), "Graph is directed");
            assertEquals(OptionalInt.empty(), graph.weight("a", "zzz"));
        }

        @Test
        @DisplayName("Dense iteration matches label view")
        void testDenseIteration() {
            int a = graph.indexOf("a");
            assertEquals(2, graph.getOutDegree(a));
            assertEquals(0, graph.getOutDegree(graph.indexOf("d")));
            assertEquals(-1, graph.indexOf("zzz"));

            WeightedDigraph.EdgeIterator iterator = graph.iterator().resetForVertex(a);
            int sum = 0;
            while (iterator.hasNext()) {
                int edge = iterator.next();
                sum += graph.getEdgeWeight(edge);
                assertNotEquals(a, graph.getEdgeTarget(edge));
            }
            assertEquals(9, sum);
        }

        @Test
        @DisplayName("successors of unknown vertex throws")
        void testUnknownSuccessors() {
            assertThrows(IDMapper.UnknownIDException.class, () -> graph.successors("zzz"));
            assertThrows(IndexOutOfBoundsException.class, () -> graph.getOutDegree(99));
        }

        @Test
        @DisplayName("Views are read-only")
        void testReadOnlyViews() {
            assertThrows(UnsupportedOperationException.class, () -> graph.vertices().add("x"));
            assertThrows(UnsupportedOperationException.class, () -> graph.successors("a").put("d", 1));
        }
    }

    @Nested
    @DisplayName("3. Value Equality")
    class EqualityTests {

        @Test
        @DisplayName("Equal mappings are equal regardless of declaration order")
        void testOrderInsensitiveEquality() {
            WeightedDigraph first = GraphFixtures.graph("a->b:1", "b->c:2", "d");
            WeightedDigraph second = GraphFixtures.graph("d", "b->c:2", "a->b:1");

            assertEquals(first, second);
            assertEquals(first.hashCode(), second.hashCode());
        }

        @Test
        @DisplayName("Different weight, edge or vertex set breaks equality")
        void testInequality() {
            WeightedDigraph base = GraphFixtures.graph("a->b:1");
            assertNotEquals(base, GraphFixtures.graph("a->b:2"));
            assertNotEquals(base, GraphFixtures.graph("b->a:1"));
            assertNotEquals(base, GraphFixtures.graph("a->b:1", "c"));
        }
    }
}

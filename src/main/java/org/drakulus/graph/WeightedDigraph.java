package org.drakulus.graph;

import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.drakulus.core.id.IDMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Immutable weighted digraph over opaque string vertex labels.
 * <p>
 * Layout:
 * <ul>
 * <li>CSR (Compressed Sparse Row): {@code firstEdge[v] .. firstEdge[v + 1]} is the outgoing edge
 * range of dense vertex {@code v}.</li>
 * <li>{@code edgeTarget[e]} / {@code edgeWeight[e]} hold the head vertex and weight of edge {@code e}.</li>
 * <li>An {@link IDMapper} translates labels to dense ids in declaration order.</li>
 * </ul>
 * <p>
 * Invariants enforced by {@link Builder}: no self-loops, non-negative integer weights, at most one
 * edge per ordered pair, and every vertex present (a sink has an empty adjacency, not a missing one).
 * <p>
 * Equality is value equality of the label to adjacency mapping, independent of declaration order.
 */
public final class WeightedDigraph {

    private final IDMapper vertexIds;
    private final int[] firstEdge;
    private final int[] edgeTarget;
    private final int[] edgeWeight;
    private final int hash;

    @Getter
    @Accessors(fluent = true)
    private final int vertexCount;
    @Getter
    @Accessors(fluent = true)
    private final int edgeCount;

    private WeightedDigraph(IDMapper vertexIds, int[] firstEdge, int[] edgeTarget, int[] edgeWeight) {
        this.vertexIds = vertexIds;
        this.firstEdge = firstEdge;
        this.edgeTarget = edgeTarget;
        this.edgeWeight = edgeWeight;
        this.vertexCount = vertexIds.size();
        this.edgeCount = edgeTarget.length;
        this.hash = computeHash();
    }

    /**
     * Creates an empty builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a graph from a label to adjacency mapping.
     * <p>
     * Targets that are not keys of {@code adjacency} are still declared as vertices.
     *
     * @param adjacency vertex label to (adjacent label to weight).
     * @return immutable graph.
     * @throws GraphModelException if an invariant is violated.
     */
    public static WeightedDigraph fromAdjacency(Map<String, ? extends Map<String, Integer>> adjacency) {
        Objects.requireNonNull(adjacency, "adjacency");
        Builder builder = builder();
        // keys first so vertex ids follow key order, not first mention as an edge target
        for (String vertex : adjacency.keySet()) {
            builder.addVertex(vertex);
        }
        for (Map.Entry<String, ? extends Map<String, Integer>> vertex : adjacency.entrySet()) {
            Map<String, Integer> edges = vertex.getValue();
            if (edges == null) {
                continue;
            }
            for (Map.Entry<String, Integer> edge : edges.entrySet()) {
                builder.addEdge(vertex.getKey(), edge.getKey(),
                        Objects.requireNonNull(edge.getValue(), "weight"));
            }
        }
        return builder.build();
    }

    // ========================================================================
    // LABEL VIEW
    // ========================================================================

    /**
     * Returns vertex labels in declaration order.
     */
    public List<String> vertices() {
        List<String> labels = new ArrayList<>(vertexCount);
        for (int v = 0; v < vertexCount; v++) {
            labels.add(vertexIds.toExternal(v));
        }
        return Collections.unmodifiableList(labels);
    }

    public boolean containsVertex(String label) {
        return vertexIds.containsExternal(label);
    }

    /**
     * Returns the outgoing adjacency of a vertex in insertion order.
     *
     * @throws IDMapper.UnknownIDException if the label is not a vertex.
     */
    public Map<String, Integer> successors(String label) {
        int v = vertexIds.toInternal(label);
        Map<String, Integer> adjacency = new LinkedHashMap<>();
        for (int e = firstEdge[v]; e < firstEdge[v + 1]; e++) {
            adjacency.put(vertexIds.toExternal(edgeTarget[e]), edgeWeight[e]);
        }
        return Collections.unmodifiableMap(adjacency);
    }

    /**
     * Returns the weight of edge {@code from -> to}, or empty when absent or either label is unknown.
     */
    public OptionalInt weight(String from, String to) {
        int u = vertexIds.indexOf(from);
        int v = vertexIds.indexOf(to);
        if (u < 0 || v < 0) {
            return OptionalInt.empty();
        }
        int e = findEdge(u, v);
        return e < 0 ? OptionalInt.empty() : OptionalInt.of(edgeWeight[e]);
    }

    public boolean hasEdge(String from, String to) {
        return weight(from, to).isPresent();
    }

    /**
     * Copies the graph into a mutable label to adjacency mapping.
     */
    public Map<String, Map<String, Integer>> toAdjacencyMap() {
        Map<String, Map<String, Integer>> adjacency = new LinkedHashMap<>();
        for (int v = 0; v < vertexCount; v++) {
            Map<String, Integer> edges = new LinkedHashMap<>();
            for (int e = firstEdge[v]; e < firstEdge[v + 1]; e++) {
                edges.put(vertexIds.toExternal(edgeTarget[e]), edgeWeight[e]);
            }
            adjacency.put(vertexIds.toExternal(v), edges);
        }
        return adjacency;
    }

    // ========================================================================
    // DENSE VIEW (search hot path)
    // ========================================================================

    /**
     * Returns the dense id of a label, or {@code -1} when unknown.
     */
    public int indexOf(String label) {
        return vertexIds.indexOf(label);
    }

    public String label(int vertexId) {
        return vertexIds.toExternal(vertexId);
    }

    /**
     * UNCHECKED - caller must ensure edgeId is valid.
     */
    public int getEdgeTarget(int edgeId) {
        assert edgeId >= 0 && edgeId < edgeCount : "Edge " + edgeId + " out of bounds";
        return edgeTarget[edgeId];
    }

    /**
     * UNCHECKED - caller must ensure edgeId is valid.
     */
    public int getEdgeWeight(int edgeId) {
        assert edgeId >= 0 && edgeId < edgeCount : "Edge " + edgeId + " out of bounds";
        return edgeWeight[edgeId];
    }

    public int getOutDegree(int vertexId) {
        if (vertexId < 0 || vertexId >= vertexCount) {
            throw new IndexOutOfBoundsException("Vertex " + vertexId + " out of bounds");
        }
        return firstEdge[vertexId + 1] - firstEdge[vertexId];
    }

    /**
     * Returns a reusable iterator over edge ids.
     */
    public EdgeIterator iterator() {
        return new EdgeIterator(this);
    }

    /**
     * Allocation-free iterator over the outgoing edge ids of one vertex.
     */
    public static final class EdgeIterator {
        private final WeightedDigraph graph;
        private int current;
        private int end;

        EdgeIterator(WeightedDigraph graph) {
            this.graph = graph;
        }

        /**
         * Resets iterator to traverse edges outgoing from {@code vertexId}.
         */
        public EdgeIterator resetForVertex(int vertexId) {
            this.current = graph.firstEdge[vertexId];
            this.end = graph.firstEdge[vertexId + 1];
            return this;
        }

        public boolean hasNext() {
            return current < end;
        }

        public int next() {
            if (current >= end) throw new NoSuchElementException();
            return current++;
        }
    }

    private int findEdge(int from, int to) {
        for (int e = firstEdge[from]; e < firstEdge[from + 1]; e++) {
            if (edgeTarget[e] == to) {
                return e;
            }
        }
        return -1;
    }

    private int computeHash() {
        // Map.hashCode semantics so that equal mappings hash equally regardless of order
        int h = 0;
        for (int v = 0; v < vertexCount; v++) {
            int adjacencyHash = 0;
            for (int e = firstEdge[v]; e < firstEdge[v + 1]; e++) {
                adjacencyHash += vertexIds.toExternal(edgeTarget[e]).hashCode() ^ Integer.hashCode(edgeWeight[e]);
            }
            h += vertexIds.toExternal(v).hashCode() ^ adjacencyHash;
        }
        return h;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WeightedDigraph)) return false;
        WeightedDigraph other = (WeightedDigraph) o;
        if (hash != other.hash || vertexCount != other.vertexCount || edgeCount != other.edgeCount) {
            return false;
        }
        for (int v = 0; v < vertexCount; v++) {
            int u = other.indexOf(vertexIds.toExternal(v));
            if (u < 0 || other.getOutDegree(u) != getOutDegree(v)) {
                return false;
            }
            for (int e = firstEdge[v]; e < firstEdge[v + 1]; e++) {
                int target = other.indexOf(vertexIds.toExternal(edgeTarget[e]));
                if (target < 0) {
                    return false;
                }
                int otherEdge = other.findEdge(u, target);
                if (otherEdge < 0 || other.edgeWeight[otherEdge] != edgeWeight[e]) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return String.format("WeightedDigraph[vertices=%d, edges=%d, avgOutDegree=%.2f]",
                vertexCount, edgeCount, vertexCount > 0 ? (double) edgeCount / vertexCount : 0);
    }

    /**
     * Mutable accumulator that validates invariants and freezes into a {@link WeightedDigraph}.
     * <p>
     * Not thread-safe.
     */
    public static final class Builder {
        public static final String REASON_BLANK_VERTEX = "GRAPH_BLANK_VERTEX";
        public static final String REASON_SELF_LOOP = "GRAPH_SELF_LOOP";
        public static final String REASON_NEGATIVE_WEIGHT = "GRAPH_NEGATIVE_WEIGHT";

        private final LinkedHashMap<String, Object2IntLinkedOpenHashMap<String>> adjacency = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Declares a vertex. Declaring an existing vertex is a no-op.
         */
        public Builder addVertex(String label) {
            requireLabel(label);
            adjacency.computeIfAbsent(label, ignored -> new Object2IntLinkedOpenHashMap<>());
            return this;
        }

        /**
         * Adds or overwrites the directed edge {@code from -> to}, declaring both endpoints.
         */
        public Builder addEdge(String from, String to, int weight) {
            requireLabel(from);
            requireLabel(to);
            if (from.equals(to)) {
                throw new GraphModelException(REASON_SELF_LOOP, "self-loop on vertex " + from);
            }
            if (weight < 0) {
                throw new GraphModelException(REASON_NEGATIVE_WEIGHT,
                        "negative weight " + weight + " on edge " + from + " -> " + to);
            }
            addVertex(from);
            addVertex(to);
            adjacency.get(from).put(to, weight);
            return this;
        }

        public boolean hasEdge(String from, String to) {
            Object2IntLinkedOpenHashMap<String> edges = adjacency.get(from);
            return edges != null && edges.containsKey(to);
        }

        public WeightedDigraph build() {
            List<String> labels = new ArrayList<>(adjacency.keySet());
            IDMapper ids = IDMapper.createImmutable(labels);
            int vertexCount = labels.size();
            int edgeCount = 0;
            for (Object2IntLinkedOpenHashMap<String> edges : adjacency.values()) {
                edgeCount += edges.size();
            }

            int[] firstEdge = new int[vertexCount + 1];
            int[] edgeTarget = new int[edgeCount];
            int[] edgeWeight = new int[edgeCount];
            int cursor = 0;
            int v = 0;
            for (Object2IntLinkedOpenHashMap<String> edges : adjacency.values()) {
                firstEdge[v++] = cursor;
                for (Object2IntMap.Entry<String> edge : edges.object2IntEntrySet()) {
                    edgeTarget[cursor] = ids.toInternal(edge.getKey());
                    edgeWeight[cursor] = edge.getIntValue();
                    cursor++;
                }
            }
            firstEdge[vertexCount] = cursor;
            return new WeightedDigraph(ids, firstEdge, edgeTarget, edgeWeight);
        }

        private static void requireLabel(String label) {
            Objects.requireNonNull(label, "label");
            if (label.isBlank()) {
                throw new GraphModelException(REASON_BLANK_VERTEX, "vertex label must be non-blank");
            }
        }
    }
}

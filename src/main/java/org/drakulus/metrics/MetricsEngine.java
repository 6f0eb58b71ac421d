package org.drakulus.metrics;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.drakulus.graph.WeightedDigraph;
import org.drakulus.search.DijkstraResult;
import org.drakulus.search.PathResult;
import org.drakulus.search.ShortestPathEngine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.DoubleBinaryOperator;

/**
 * Eccentricity, radius and diameter of weighted digraphs.
 *
 * <p>Eccentricity of {@code v} is the maximum, under a {@link WeightFunction}, over every other vertex
 * finalized by a full Dijkstra run from {@code v}; it is {@code +INF} when {@code v} reaches no other
 * vertex. Radius and diameter are the minimum and maximum eccentricity over all vertices and go through
 * the owned {@link EccentricityCache}.</p>
 *
 * <p>Unless a weight function is given, {@link WeightFunctions#EDGE_COUNT} is used.</p>
 */
public final class MetricsEngine {
    public static final String REASON_GRAPH_REQUIRED = "METRICS_GRAPH_REQUIRED";
    public static final String REASON_UNKNOWN_VERTEX = "METRICS_UNKNOWN_VERTEX";
    public static final String REASON_EMPTY_GRAPH = "METRICS_EMPTY_GRAPH";

    private final ShortestPathEngine shortestPathEngine;
    @Getter
    @Accessors(fluent = true)
    private final EccentricityCache cache;

    /**
     * Creates an engine with a cache sized from {@link MetricsRuntimeConfig#defaults()}.
     */
    public MetricsEngine() {
        this(MetricsRuntimeConfig.defaults());
    }

    public MetricsEngine(MetricsRuntimeConfig config) {
        this(new ShortestPathEngine(), EccentricityCache.of(config));
    }

    public MetricsEngine(ShortestPathEngine shortestPathEngine, EccentricityCache cache) {
        this.shortestPathEngine = Objects.requireNonNull(shortestPathEngine, "shortestPathEngine");
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    public double eccentricity(WeightedDigraph graph, String vertex) {
        return eccentricity(graph, vertex, WeightFunctions.EDGE_COUNT);
    }

    /**
     * Computes the eccentricity of {@code vertex} without consulting the cache.
     *
     * @return maximum weight over reachable vertices, or {@code +INF} if none is reachable.
     * @throws MetricsException when the graph is null or the vertex is unknown.
     */
    public double eccentricity(WeightedDigraph graph, String vertex, WeightFunction weightFunction) {
        requireVertex(graph, vertex);
        Objects.requireNonNull(weightFunction, "weightFunction");

        DijkstraResult result = shortestPathEngine.dijkstra(graph, vertex);
        double eccentricity = Double.NEGATIVE_INFINITY;
        boolean reachesOther = false;
        for (Map.Entry<String, PathResult> entry : result.asMap().entrySet()) {
            if (entry.getKey().equals(vertex)) {
                continue;
            }
            reachesOther = true;
            eccentricity = Math.max(eccentricity, weightFunction.apply(entry.getValue()));
        }
        return reachesOther ? eccentricity : Double.POSITIVE_INFINITY;
    }

    public double eccentricityMemo(WeightedDigraph graph, String vertex) {
        return eccentricityMemo(graph, vertex, WeightFunctions.EDGE_COUNT);
    }

    /**
     * Same contract as {@link #eccentricity(WeightedDigraph, String, WeightFunction)}, memoized.
     */
    public double eccentricityMemo(WeightedDigraph graph, String vertex, WeightFunction weightFunction) {
        requireVertex(graph, vertex);
        Objects.requireNonNull(weightFunction, "weightFunction");
        return cache.getOrCompute(graph, vertex, weightFunction,
                () -> eccentricity(graph, vertex, weightFunction));
    }

    public Map<String, Double> eccentricities(WeightedDigraph graph) {
        return eccentricities(graph, WeightFunctions.EDGE_COUNT);
    }

    /**
     * Returns the memoized eccentricity of every vertex, in vertex declaration order.
     */
    public Map<String, Double> eccentricities(WeightedDigraph graph, WeightFunction weightFunction) {
        requireGraph(graph);
        Map<String, Double> eccentricities = new LinkedHashMap<>();
        for (String vertex : graph.vertices()) {
            eccentricities.put(vertex, eccentricityMemo(graph, vertex, weightFunction));
        }
        return eccentricities;
    }

    public double radius(WeightedDigraph graph) {
        return radius(graph, WeightFunctions.EDGE_COUNT);
    }

    /**
     * Minimum eccentricity over all vertices.
     *
     * @throws MetricsException when the graph has no vertices.
     */
    public double radius(WeightedDigraph graph, WeightFunction weightFunction) {
        return eccentricitiesBy(graph, weightFunction, Math::min);
    }

    public double diameter(WeightedDigraph graph) {
        return diameter(graph, WeightFunctions.EDGE_COUNT);
    }

    /**
     * Maximum eccentricity over all vertices.
     *
     * @throws MetricsException when the graph has no vertices.
     */
    public double diameter(WeightedDigraph graph, WeightFunction weightFunction) {
        return eccentricitiesBy(graph, weightFunction, Math::max);
    }

    private double eccentricitiesBy(WeightedDigraph graph, WeightFunction weightFunction, DoubleBinaryOperator select) {
        requireGraph(graph);
        if (graph.vertexCount() == 0) {
            throw new MetricsException(REASON_EMPTY_GRAPH, "metrics are undefined for a graph without vertices");
        }
        double selected = Double.NaN;
        for (String vertex : graph.vertices()) {
            double eccentricity = eccentricityMemo(graph, vertex, weightFunction);
            selected = Double.isNaN(selected) ? eccentricity : select.applyAsDouble(selected, eccentricity);
        }
        return selected;
    }

    private static void requireGraph(WeightedDigraph graph) {
        if (graph == null) {
            throw new MetricsException(REASON_GRAPH_REQUIRED, "graph must be provided");
        }
    }

    private static void requireVertex(WeightedDigraph graph, String vertex) {
        requireGraph(graph);
        if (!graph.containsVertex(vertex)) {
            throw new MetricsException(REASON_UNKNOWN_VERTEX, "unknown vertex: " + vertex);
        }
    }
}

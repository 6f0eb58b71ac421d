package org.drakulus.search;

import org.drakulus.graph.WeightedDigraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * Single-source shortest paths over non-negative integer weights (Dijkstra).
 *
 * <p>The frontier is a {@link FrontierQueue} paired with a best-known distance per vertex; a stale
 * entry (vertex already finalized, or distance worse than best-known) is skipped on extraction.
 * A candidate replaces the frontier entry of a vertex only when strictly shorter, so among equal
 * paths the first discovered one is kept.</p>
 *
 * <p>Stateless and thread-safe: all search state lives in one invocation.</p>
 */
public final class ShortestPathEngine {
    public static final String REASON_GRAPH_REQUIRED = "SP_GRAPH_REQUIRED";
    public static final String REASON_UNKNOWN_VERTEX = "SP_UNKNOWN_VERTEX";

    private static final Logger log = LoggerFactory.getLogger(ShortestPathEngine.class);
    private static final long NO_ENTRY = Long.MAX_VALUE;
    private static final int NO_PREDECESSOR = -1;

    /**
     * Full single-source run: every vertex reachable from {@code start} is finalized.
     */
    public DijkstraResult dijkstra(WeightedDigraph graph, String start) {
        return dijkstra(graph, start, null);
    }

    /**
     * Runs Dijkstra from {@code start}, returning as soon as {@code destination} is finalized.
     *
     * <p>A {@code null} destination, or one that is not a vertex of the graph, never gets finalized,
     * so the search runs until the frontier is exhausted.</p>
     *
     * @param graph graph to search.
     * @param start source vertex label.
     * @param destination optional early-exit target.
     * @return vertices finalized when the search stopped; always contains {@code start -> (0, [start])}.
     * @throws ShortestPathException when the graph is null or {@code start} is not a vertex.
     */
    public DijkstraResult dijkstra(WeightedDigraph graph, String start, String destination) {
        if (graph == null) {
            throw new ShortestPathException(REASON_GRAPH_REQUIRED, "graph must be provided");
        }
        int source = graph.indexOf(start);
        if (source < 0) {
            throw new ShortestPathException(REASON_UNKNOWN_VERTEX, "unknown start vertex: " + start);
        }
        int target = destination == null ? NO_PREDECESSOR : graph.indexOf(destination);

        int vertexCount = graph.vertexCount();
        long[] best = new long[vertexCount];
        Arrays.fill(best, NO_ENTRY);
        int[] predecessor = new int[vertexCount];
        Arrays.fill(predecessor, NO_PREDECESSOR);
        List<List<String>> settledPaths = new ArrayList<>(Collections.nCopies(vertexCount, null));

        LinkedHashMap<String, PathResult> settled = new LinkedHashMap<>();
        FrontierQueue frontier = new FrontierQueue();
        WeightedDigraph.EdgeIterator iterator = graph.iterator();

        best[source] = 0L;
        frontier.insert(source, 0L);

        while (!frontier.isEmpty()) {
            if (target >= 0 && settledPaths.get(target) != null) {
                break;
            }
            int current = frontier.minVertex();
            long distance = frontier.minDistance();
            frontier.removeMin();
            if (settledPaths.get(current) != null || distance > best[current]) {
                continue;
            }

            List<String> path = extend(
                    predecessor[current] == NO_PREDECESSOR ? null : settledPaths.get(predecessor[current]),
                    graph.label(current)
            );
            settledPaths.set(current, path);
            settled.put(graph.label(current), new PathResult(distance, path));

            iterator.resetForVertex(current);
            while (iterator.hasNext()) {
                int edgeId = iterator.next();
                int adjacent = graph.getEdgeTarget(edgeId);
                if (settledPaths.get(adjacent) != null) {
                    continue;
                }
                long candidate = distance + graph.getEdgeWeight(edgeId);
                if (candidate < best[adjacent]) {
                    best[adjacent] = candidate;
                    predecessor[adjacent] = current;
                    frontier.insert(adjacent, candidate);
                }
            }
        }

        if (log.isTraceEnabled()) {
            log.trace("dijkstra from {} to {}: settled={}, frontierPeak={}",
                    start, destination, settled.size(), frontier.peakSize());
        }
        return new DijkstraResult(start, settled);
    }

    /**
     * Returns the shortest path from {@code start} to {@code destination}, or an empty list if
     * {@code destination} is unreachable.
     */
    public List<String> shortestPath(WeightedDigraph graph, String start, String destination) {
        Objects.requireNonNull(destination, "destination");
        return dijkstra(graph, start, destination).path(destination);
    }

    /**
     * Returns the shortest distance from {@code start} to {@code destination}, or {@code +INF} if
     * {@code destination} is unreachable.
     */
    public double distance(WeightedDigraph graph, String start, String destination) {
        Objects.requireNonNull(destination, "destination");
        return dijkstra(graph, start, destination).distance(destination);
    }

    private static List<String> extend(List<String> prefix, String vertex) {
        if (prefix == null) {
            return List.of(vertex);
        }
        List<String> path = new ArrayList<>(prefix.size() + 1);
        path.addAll(prefix);
        path.add(vertex);
        return Collections.unmodifiableList(path);
    }
}

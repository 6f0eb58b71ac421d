package org.drakulus.search;

import lombok.Value;

import java.util.List;

/**
 * Shortest-path outcome for one target vertex.
 *
 * <p>When the target is unreachable, {@code distance} is {@code +INF} and {@code path} is empty.
 * Otherwise {@code path} runs from the source to the target, both inclusive.</p>
 */
@Value
public class PathResult {
    private static final PathResult UNREACHABLE = new PathResult(Double.POSITIVE_INFINITY, List.of());

    /** Sum of edge weights along {@code path}, or {@code +INF}. */
    double distance;
    /** Vertex labels from source to target. */
    List<String> path;

    public PathResult(double distance, List<String> path) {
        if (Double.isNaN(distance) || distance < 0.0d) {
            throw new IllegalArgumentException("distance must be non-negative, got " + distance);
        }
        this.distance = distance;
        this.path = List.copyOf(path);
    }

    public static PathResult unreachable() {
        return UNREACHABLE;
    }

    public boolean isReachable() {
        return !path.isEmpty();
    }

    /**
     * Number of edges on the path, {@code -1} when unreachable.
     */
    public int edgeCount() {
        return path.size() - 1;
    }
}

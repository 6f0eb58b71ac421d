package org.drakulus.search;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Vertices finalized by one {@link ShortestPathEngine#dijkstra} run, each with its {@link PathResult}.
 *
 * <p>Iteration order is settle order, i.e. non-decreasing distance. A vertex absent from the result
 * was not finalized: either unreachable, or not reached before an early exit.</p>
 */
public final class DijkstraResult {
    @Getter
    @Accessors(fluent = true)
    private final String source;
    private final Map<String, PathResult> settled;

    DijkstraResult(String source, LinkedHashMap<String, PathResult> settled) {
        this.source = Objects.requireNonNull(source, "source");
        this.settled = Collections.unmodifiableMap(settled);
    }

    public Optional<PathResult> get(String vertex) {
        return Optional.ofNullable(settled.get(vertex));
    }

    /**
     * Returns the result for {@code vertex}, or {@link PathResult#unreachable()} when absent.
     */
    public PathResult getOrUnreachable(String vertex) {
        PathResult result = settled.get(vertex);
        return result == null ? PathResult.unreachable() : result;
    }

    public boolean contains(String vertex) {
        return settled.containsKey(vertex);
    }

    public double distance(String vertex) {
        return getOrUnreachable(vertex).getDistance();
    }

    public List<String> path(String vertex) {
        return getOrUnreachable(vertex).getPath();
    }

    /**
     * Finalized vertices in settle order.
     */
    public Set<String> vertices() {
        return settled.keySet();
    }

    public int size() {
        return settled.size();
    }

    /**
     * Read-only view in settle order.
     */
    public Map<String, PathResult> asMap() {
        return settled;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DijkstraResult)) return false;
        DijkstraResult other = (DijkstraResult) o;
        return source.equals(other.source) && settled.equals(other.settled);
    }

    @Override
    public int hashCode() {
        return 31 * source.hashCode() + settled.hashCode();
    }

    @Override
    public String toString() {
        return "DijkstraResult{source=" + source + ", settled=" + settled + '}';
    }
}

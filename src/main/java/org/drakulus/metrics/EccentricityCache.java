package org.drakulus.metrics;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.drakulus.graph.WeightedDigraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.DoubleSupplier;

/**
 * Fixed-capacity LRU memo of eccentricities keyed by {@code (graph, vertex, weightFunction)}.
 *
 * <p>Graphs are keyed by value equality. Every read and write runs under one lock; the value of a
 * missing key is computed outside the lock, so two concurrent misses on the same key may both compute,
 * and the first stored value is returned to both.</p>
 */
public final class EccentricityCache {
    private static final Logger log = LoggerFactory.getLogger(EccentricityCache.class);

    @Getter
    @Accessors(fluent = true)
    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<CacheKey, Double> entries = new LinkedHashMap<>(16, 0.75f, true);

    private long hits;
    private long misses;
    private long evictions;

    /**
     * @param capacity maximum number of entries, must be positive.
     */
    public EccentricityCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    /**
     * Creates a cache sized by {@link MetricsRuntimeConfig#effectiveCacheCapacity()}.
     */
    public static EccentricityCache of(MetricsRuntimeConfig config) {
        return new EccentricityCache(Objects.requireNonNull(config, "config").effectiveCacheCapacity());
    }

    /**
     * Returns the memoized value for the key, computing and storing it on a miss.
     */
    public double getOrCompute(
            WeightedDigraph graph,
            String vertex,
            WeightFunction weightFunction,
            DoubleSupplier computation
    ) {
        CacheKey key = new CacheKey(graph, vertex, weightFunction);
        lock.lock();
        try {
            Double cached = entries.get(key);
            if (cached != null) {
                hits++;
                return cached;
            }
            misses++;
        } finally {
            lock.unlock();
        }

        double computed = computation.getAsDouble();

        lock.lock();
        try {
            Double existing = entries.get(key);
            if (existing != null) {
                return existing;
            }
            entries.put(key, computed);
            if (entries.size() > capacity) {
                Iterator<Map.Entry<CacheKey, Double>> iterator = entries.entrySet().iterator();
                Map.Entry<CacheKey, Double> eldest = iterator.next();
                iterator.remove();
                evictions++;
                log.debug("Evicted eccentricity of vertex {} (capacity={})", eldest.getKey().vertex(), capacity);
            }
            return computed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns whether a value is currently memoized, without touching recency.
     */
    public boolean contains(WeightedDigraph graph, String vertex, WeightFunction weightFunction) {
        lock.lock();
        try {
            return entries.containsKey(new CacheKey(graph, vertex, weightFunction));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops all entries. Counters are kept.
     */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(hits, misses, evictions, entries.size(), capacity);
        } finally {
            lock.unlock();
        }
    }

    private record CacheKey(WeightedDigraph graph, String vertex, WeightFunction weightFunction) {
    }
}

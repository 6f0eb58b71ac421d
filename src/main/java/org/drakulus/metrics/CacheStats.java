package org.drakulus.metrics;

import lombok.Value;

/**
 * Point-in-time counters of an {@link EccentricityCache}.
 */
@Value
public class CacheStats {
    long hits;
    long misses;
    long evictions;
    int size;
    int capacity;
}

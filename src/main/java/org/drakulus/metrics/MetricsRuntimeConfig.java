package org.drakulus.metrics;

import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runtime configuration for {@link MetricsEngine}.
 */
@Value
@Builder
public class MetricsRuntimeConfig {
    public static final int DEFAULT_CACHE_CAPACITY = 512;

    public static final String PROP_CACHE_CAPACITY = "drakulus.metrics.cacheCapacity";

    private static final Logger log = LoggerFactory.getLogger(MetricsRuntimeConfig.class);

    /**
     * Maximum number of memoized eccentricities before least-recently-used eviction.
     *
     * <p>Non-positive values fall back to {@link #DEFAULT_CACHE_CAPACITY}.</p>
     */
    int cacheCapacity;

    /**
     * Loads configuration from system properties, falling back to defaults.
     */
    public static MetricsRuntimeConfig defaults() {
        return MetricsRuntimeConfig.builder()
                .cacheCapacity(readCapacity())
                .build();
    }

    /**
     * Returns the configured capacity normalized to a positive value.
     */
    public int effectiveCacheCapacity() {
        return cacheCapacity > 0 ? cacheCapacity : DEFAULT_CACHE_CAPACITY;
    }

    private static int readCapacity() {
        String raw = System.getProperty(PROP_CACHE_CAPACITY);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_CACHE_CAPACITY;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            return parsed > 0 ? parsed : DEFAULT_CACHE_CAPACITY;
        } catch (NumberFormatException ex) {
            log.warn("Ignoring unparsable {}={}", PROP_CACHE_CAPACITY, raw);
            return DEFAULT_CACHE_CAPACITY;
        }
    }
}

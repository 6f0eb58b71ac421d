package org.drakulus.metrics;

import org.drakulus.search.PathResult;

/**
 * Maps one shortest-path outcome to the scalar an eccentricity is measured in.
 *
 * <p>Implementations used with a memoizing {@link MetricsEngine} should be long-lived instances
 * (constants), since the cache keys on the function's identity/equality.</p>
 */
@FunctionalInterface
public interface WeightFunction {

    /**
     * @param result reachable path outcome from the eccentricity source.
     * @return scalar value, may be {@code +INF}.
     */
    double apply(PathResult result);
}

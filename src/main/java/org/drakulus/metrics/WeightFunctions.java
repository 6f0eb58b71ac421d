package org.drakulus.metrics;

import lombok.experimental.UtilityClass;

/**
 * Built-in {@link WeightFunction}s.
 */
@UtilityClass
public final class WeightFunctions {

    /**
     * Number of edges on the shortest path. Default for all metrics.
     */
    public static final WeightFunction EDGE_COUNT = result -> result.edgeCount();

    /**
     * Summed edge weight of the shortest path.
     */
    public static final WeightFunction DISTANCE = result -> result.getDistance();
}

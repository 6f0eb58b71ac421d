package org.drakulus.graph;

import it.unimi.dsi.fastutil.longs.Long2LongOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

/**
 * Random weighted digraph generator.
 *
 * <p>For {@code v} vertices and {@code e} edges with {@code v - 1 <= e <= v * (v - 1)}:
 * <ul>
 * <li>{@code e == v * (v - 1)}: the complete digraph with uniform random weights.</li>
 * <li>otherwise: a random-walk spanning tree of {@code v - 1} edges, topped up with
 * {@code e - (v - 1)} distinct ordered pairs drawn uniformly from the pairs not already in the tree.</li>
 * </ul>
 * Vertex labels are the decimal strings {@code "0" .. "v-1"}; weights are uniform in
 * {@code [0, maxWeight)}. All randomness comes from the injected {@link RandomGenerator}, so a
 * seeded source reproduces the same graph.</p>
 *
 * <p>Instances are not thread-safe unless the injected random source is.</p>
 */
public final class GraphGenerator {
    public static final String REASON_INVALID_VERTEX_COUNT = "GEN_INVALID_VERTEX_COUNT";
    public static final String REASON_INVALID_EDGE_COUNT = "GEN_INVALID_EDGE_COUNT";
    public static final String REASON_INVALID_MAX_WEIGHT = "GEN_INVALID_MAX_WEIGHT";

    public static final int DEFAULT_MAX_WEIGHT = 100;

    static final String PROP_DEFAULT_MAX_WEIGHT = "drakulus.generator.defaultMaxWeight";
    static final String PROP_SEED = "drakulus.generator.seed";

    private static final Logger log = LoggerFactory.getLogger(GraphGenerator.class);

    private final RandomGenerator random;
    private final int defaultMaxWeight;

    /**
     * Creates a generator drawing from {@code random} with {@link #DEFAULT_MAX_WEIGHT}.
     */
    public GraphGenerator(RandomGenerator random) {
        this(random, DEFAULT_MAX_WEIGHT);
    }

    /**
     * Creates a generator drawing from {@code random}.
     *
     * @param random uniform random source.
     * @param defaultMaxWeight exclusive weight bound used by {@link #makeGraph(int, int)}.
     */
    public GraphGenerator(RandomGenerator random, int defaultMaxWeight) {
        this.random = Objects.requireNonNull(random, "random");
        this.defaultMaxWeight = requireMaxWeight(defaultMaxWeight);
    }

    /**
     * Creates a generator configured from system properties.
     *
     * <p>{@code drakulus.generator.seed} seeds the random source when set;
     * {@code drakulus.generator.defaultMaxWeight} overrides the default weight bound.</p>
     */
    public static GraphGenerator defaults() {
        String rawSeed = System.getProperty(PROP_SEED);
        RandomGenerator random;
        if (rawSeed == null || rawSeed.isBlank()) {
            random = new SplittableRandom();
        } else {
            try {
                random = new SplittableRandom(Long.parseLong(rawSeed.trim()));
            } catch (NumberFormatException ex) {
                log.warn("Ignoring unparsable {}={}", PROP_SEED, rawSeed);
                random = new SplittableRandom();
            }
        }
        return new GraphGenerator(random, readPositiveInt(PROP_DEFAULT_MAX_WEIGHT, DEFAULT_MAX_WEIGHT));
    }

    /**
     * Generates a random graph using the configured default weight bound.
     */
    public WeightedDigraph makeGraph(int vertexCount, int edgeCount) {
        return makeGraph(vertexCount, edgeCount, defaultMaxWeight);
    }

    /**
     * Generates a random graph.
     *
     * @param vertexCount number of vertices, at least 1.
     * @param edgeCount number of directed edges in {@code [vertexCount - 1, vertexCount * (vertexCount - 1)]}.
     * @param maxWeight exclusive upper bound of edge weights, at least 1.
     * @return graph with exactly {@code vertexCount} vertices and {@code edgeCount} edges.
     * @throws GraphGenerationException when any argument is out of range.
     */
    public WeightedDigraph makeGraph(int vertexCount, int edgeCount, int maxWeight) {
        if (vertexCount < 1) {
            throw new GraphGenerationException(REASON_INVALID_VERTEX_COUNT,
                    "vertex count must be >= 1, got " + vertexCount);
        }
        if (maxWeight < 1) {
            throw new GraphGenerationException(REASON_INVALID_MAX_WEIGHT,
                    "max weight must be >= 1, got " + maxWeight);
        }
        long maxEdges = (long) vertexCount * (vertexCount - 1);
        if (edgeCount < vertexCount - 1 || edgeCount > maxEdges) {
            throw new GraphGenerationException(REASON_INVALID_EDGE_COUNT,
                    "count of edges must be in range [" + (vertexCount - 1) + ".." + maxEdges
                            + "], got " + edgeCount);
        }

        WeightedDigraph.Builder builder = emptyGraph(vertexCount);
        if (edgeCount == maxEdges) {
            addCompleteEdges(builder, vertexCount, maxWeight);
        } else {
            addSpanningTree(builder, vertexCount, maxWeight);
            addRandomEdges(builder, vertexCount, edgeCount - (vertexCount - 1), maxWeight);
        }
        WeightedDigraph graph = builder.build();
        log.debug("Generated {} (maxWeight={})", graph, maxWeight);
        return graph;
    }

    private static WeightedDigraph.Builder emptyGraph(int vertexCount) {
        WeightedDigraph.Builder builder = WeightedDigraph.builder();
        for (int i = 0; i < vertexCount; i++) {
            builder.addVertex(label(i));
        }
        return builder;
    }

    private void addCompleteEdges(WeightedDigraph.Builder builder, int vertexCount, int maxWeight) {
        for (int i = 0; i < vertexCount; i++) {
            for (int j = 0; j < vertexCount; j++) {
                if (i != j) {
                    builder.addEdge(label(i), label(j), random.nextInt(maxWeight));
                }
            }
        }
    }

    /**
     * Random walk: every newly discovered vertex is attached to the vertex the walk came from.
     */
    private void addSpanningTree(WeightedDigraph.Builder builder, int vertexCount, int maxWeight) {
        boolean[] visited = new boolean[vertexCount];
        int current = random.nextInt(vertexCount);
        visited[current] = true;
        int visitedCount = 1;
        while (visitedCount < vertexCount) {
            int next = random.nextInt(vertexCount);
            if (!visited[next]) {
                builder.addEdge(label(current), label(next), random.nextInt(maxWeight));
                visited[next] = true;
                visitedCount++;
            }
            current = next;
        }
    }

    /**
     * Draws ordered pairs without replacement (lazy Fisher-Yates over the pair index space)
     * until {@code remaining} pairs not already present have been added.
     */
    private void addRandomEdges(WeightedDigraph.Builder builder, int vertexCount, int remaining, int maxWeight) {
        if (remaining == 0) {
            return;
        }
        long pairCount = (long) vertexCount * (vertexCount - 1);
        Long2LongOpenHashMap displaced = new Long2LongOpenHashMap();
        displaced.defaultReturnValue(-1L);

        int added = 0;
        for (long drawn = 0; drawn < pairCount && added < remaining; drawn++) {
            long pick = drawn + random.nextLong(pairCount - drawn);
            long pair = slot(displaced, pick);
            displaced.put(pick, slot(displaced, drawn));

            int from = (int) (pair / (vertexCount - 1));
            int to = (int) (pair % (vertexCount - 1));
            if (to >= from) {
                to++;
            }
            if (builder.hasEdge(label(from), label(to))) {
                continue;
            }
            builder.addEdge(label(from), label(to), random.nextInt(maxWeight));
            added++;
        }
    }

    private static long slot(Long2LongOpenHashMap displaced, long index) {
        long value = displaced.get(index);
        return value < 0 ? index : value;
    }

    static String label(int index) {
        return Integer.toString(index);
    }

    private static int requireMaxWeight(int maxWeight) {
        if (maxWeight < 1) {
            throw new GraphGenerationException(REASON_INVALID_MAX_WEIGHT,
                    "max weight must be >= 1, got " + maxWeight);
        }
        return maxWeight;
    }

    private static int readPositiveInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            return parsed > 0 ? parsed : fallback;
        } catch (NumberFormatException ex) {
            log.warn("Ignoring unparsable {}={}", property, raw);
            return fallback;
        }
    }
}

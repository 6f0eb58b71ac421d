package org.drakulus.testutil;

import org.drakulus.graph.WeightedDigraph;

/**
 * Shared graph fixtures for tests.
 */
public final class GraphFixtures {

    private GraphFixtures() {
    }

    /**
     * Parses tokens of the form {@code "a->b:w"} (edge) or {@code "v"} (bare vertex), in order.
     */
    public static WeightedDigraph graph(String... tokens) {
        WeightedDigraph.Builder builder = WeightedDigraph.builder();
        for (String token : tokens) {
            int arrow = token.indexOf("->");
            if (arrow < 0) {
                builder.addVertex(token);
                continue;
            }
            int colon = token.lastIndexOf(':');
            builder.addEdge(
                    token.substring(0, arrow),
                    token.substring(arrow + 2, colon),
                    Integer.parseInt(token.substring(colon + 1))
            );
        }
        return builder.build();
    }

    /**
     * Directed chain {@code 0 -> 1 -> ... -> n-1}, every edge of weight {@code weight}.
     */
    public static WeightedDigraph chain(int vertexCount, int weight) {
        WeightedDigraph.Builder builder = WeightedDigraph.builder();
        builder.addVertex("0");
        for (int i = 1; i < vertexCount; i++) {
            builder.addEdge(Integer.toString(i - 1), Integer.toString(i), weight);
        }
        return builder.build();
    }

    /**
     * Directed cycle {@code 0 -> 1 -> ... -> n-1 -> 0}, every edge of weight {@code weight}.
     */
    public static WeightedDigraph cycle(int vertexCount, int weight) {
        WeightedDigraph.Builder builder = WeightedDigraph.builder();
        for (int i = 0; i < vertexCount; i++) {
            builder.addEdge(Integer.toString(i), Integer.toString((i + 1) % vertexCount), weight);
        }
        return builder.build();
    }
}

package org.drakulus.render;

import lombok.experimental.UtilityClass;
import org.drakulus.graph.WeightedDigraph;

import java.util.Objects;

/**
 * Converts a {@link WeightedDigraph} into Graphviz DOT text for an external renderer.
 *
 * <p>Each adjacency entry becomes {@code "a" -> "b" [weight=w, label="w"];}. Vertices with no incident
 * edge are emitted as bare node statements so the drawing keeps them. Inside quoted identifiers only
 * {@code "} is escaped; DOT passes backslashes through to the renderer.</p>
 */
@UtilityClass
public final class DotGraphExporter {
    private static final String INDENT = "  ";

    /**
     * Exports with graph name {@code G}.
     */
    public static String export(WeightedDigraph graph) {
        return export(graph, "G");
    }

    public static String export(WeightedDigraph graph, String graphName) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(graphName, "graphName");

        int vertexCount = graph.vertexCount();
        boolean[] incident = new boolean[vertexCount];
        StringBuilder edges = new StringBuilder();
        WeightedDigraph.EdgeIterator iterator = graph.iterator();
        for (int v = 0; v < vertexCount; v++) {
            iterator.resetForVertex(v);
            while (iterator.hasNext()) {
                int edgeId = iterator.next();
                int target = graph.getEdgeTarget(edgeId);
                int weight = graph.getEdgeWeight(edgeId);
                incident[v] = true;
                incident[target] = true;
                edges.append(INDENT)
                        .append(quote(graph.label(v)))
                        .append(" -> ")
                        .append(quote(graph.label(target)))
                        .append(" [weight=").append(weight)
                        .append(", label=\"").append(weight).append("\"];\n");
            }
        }

        StringBuilder dot = new StringBuilder();
        dot.append("digraph ").append(quote(graphName)).append(" {\n");
        for (int v = 0; v < vertexCount; v++) {
            if (!incident[v]) {
                dot.append(INDENT).append(quote(graph.label(v))).append(";\n");
            }
        }
        dot.append(edges);
        dot.append("}\n");
        return dot.toString();
    }

    static String quote(String id) {
        return '"' + id.replace("\"", "\\\"") + '"';
    }
}

package com.hcltech.multiway;

import java.util.Objects;

/**
 * A built graph together with how to present its nodes and edges. This is what the export and
 * render collaborators consume.
 */
public record GraphView<N>(String name, GraphKind kind, DirectedGraph<N> graph, NodeTC<N> nodes, EdgeTC<N> edges) {
    public GraphView {
        Objects.requireNonNull(name);
        Objects.requireNonNull(kind);
        Objects.requireNonNull(graph);
        Objects.requireNonNull(nodes);
        Objects.requireNonNull(edges);
    }

    public static GraphView<MultiwayNode> multiway(String name, DirectedGraph<MultiwayNode> graph) {
        return new GraphView<>(name, GraphKind.MULTIWAY, graph, MultiwayPresentation.INSTANCE, MultiwayPresentation.INSTANCE);
    }

    public static GraphView<Event> causal(String name, CausalGraph causal) {
        return new GraphView<>(name, GraphKind.CAUSAL, causal.graph(), CausalPresentation.INSTANCE, CausalPresentation.INSTANCE);
    }

    public int nodeCount() {
        return graph.nodes().size();
    }

    public int edgeCount() {
        return graph.edges().size();
    }

    /** Always directed. */
    public boolean directed() {
        return true;
    }
}

package com.hcltech.multiway;

import com.hcltech.multiway.MultiwayNode.StateNode;
import com.hcltech.multiway.MultiwayNode.SuperSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Builds the multiway graph: every enumerated state is a node, and each bubble transition out of
 * each state is an edge. States nobody reaches stay in the graph as sources.
 */
public final class MultiwayGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(MultiwayGraphBuilder.class);

    private MultiwayGraphBuilder() {}

    public static DirectedGraph<MultiwayNode> build(Collection<State> states) {
        Objects.requireNonNull(states);
        requireSameSize(states);

        Set<MultiwayNode> nodes = new LinkedHashSet<>();
        for (State s : states) nodes.add(MultiwayNode.of(s));

        Set<Edge<MultiwayNode>> edges = new LinkedHashSet<>();
        for (State p : states) {
            for (Transition t : Transitions.of(p)) {
                // successors of a permutation are permutations of the same multiset, so already nodes
                edges.add(new Edge<>(MultiwayNode.of(p), MultiwayNode.of(t.target())));
            }
        }
        log.debug("Multiway graph: {} nodes, {} edges", nodes.size(), edges.size());
        return new DirectedGraph<>(nodes, edges);
    }

    public static DirectedGraph<MultiwayNode> build(Collection<State> states, boolean withSuperSource) {
        DirectedGraph<MultiwayNode> graph = build(states);
        return withSuperSource ? withSuperSource(graph) : graph;
    }

    /** Adds the super-source with an edge to every state node. Existing nodes and edges are kept as they are. */
    public static DirectedGraph<MultiwayNode> withSuperSource(DirectedGraph<MultiwayNode> graph) {
        Set<MultiwayNode> nodes = new LinkedHashSet<>();
        nodes.add(SuperSource.INSTANCE);
        nodes.addAll(graph.nodes());

        Set<Edge<MultiwayNode>> edges = new LinkedHashSet<>(graph.edges());
        for (MultiwayNode n : graph.nodes()) {
            if (n instanceof StateNode) edges.add(new Edge<>(SuperSource.INSTANCE, n));
        }
        return new DirectedGraph<>(nodes, edges);
    }

    public static boolean isSuperSourceEdge(Edge<MultiwayNode> edge) {
        return edge.from() == SuperSource.INSTANCE;
    }

    static void requireSameSize(Collection<State> states) {
        Set<Integer> sizes = new TreeSet<>();
        for (State s : states) sizes.add(s.size());
        if (sizes.size() > 1)
            throw new IllegalArgumentException("All states must have the same length, found lengths " + sizes);
    }
}

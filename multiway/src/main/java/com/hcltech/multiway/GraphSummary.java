package com.hcltech.multiway;

import java.util.Optional;

/**
 * Statistics a caller reports after a build. {@code sortedPresent}/{@code sortedIsSink} are empty
 * when no sorted node was named.
 */
public record GraphSummary(int nodes, int edges, boolean dag, int sources, int sinks,
                           Optional<Boolean> sortedPresent, Optional<Boolean> sortedIsSink) {

    public static <N> GraphSummary of(DirectedGraph<N> graph) {
        return new GraphSummary(graph.nodes().size(), graph.edges().size(), Topo.isAcyclic(graph),
                graph.sources().size(), graph.sinks().size(), Optional.empty(), Optional.empty());
    }

    /** As {@link #of(DirectedGraph)}, also checking the named sorted node. */
    public static <N> GraphSummary of(DirectedGraph<N> graph, N sorted) {
        boolean present = graph.nodes().contains(sorted);
        boolean sink = present && graph.sinks().contains(sorted);
        GraphSummary base = of(graph);
        return new GraphSummary(base.nodes, base.edges, base.dag, base.sources, base.sinks,
                Optional.of(present), Optional.of(sink));
    }
}

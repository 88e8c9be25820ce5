package com.hcltech.multiway;

import java.util.*;

/**
 * Events plus the causal edges between them, with the two lookups used to derive them:
 * the events that produce a state and the events that consume it.
 */
public record CausalGraph(DirectedGraph<Event> graph,
                          Map<State, List<Event>> producedBy,
                          Map<State, List<Event>> consumedBy) {
    public CausalGraph {
        Objects.requireNonNull(graph);
        producedBy = freeze(producedBy);
        consumedBy = freeze(consumedBy);
    }

    public Set<Event> events() {
        return graph.nodes();
    }

    public Set<Edge<Event>> edges() {
        return graph.edges();
    }

    public List<Event> producing(State state) {
        return producedBy.getOrDefault(state, List.of());
    }

    public List<Event> consuming(State state) {
        return consumedBy.getOrDefault(state, List.of());
    }

    private static Map<State, List<Event>> freeze(Map<State, List<Event>> m) {
        Map<State, List<Event>> copy = new LinkedHashMap<>();
        m.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }
}

package com.hcltech.multiway;

import java.util.*;

public final class Topo {
    private Topo() {}

    /**
     * Kahn’s algorithm: generation 0 holds the sources, generation k the nodes whose last
     * predecessor sits in generation k-1.
     *
     * @throws IllegalStateException if the graph has a cycle
     */
    public static <N> List<Set<N>> topoSort(DirectedGraph<N> graph) {
        Map<N, Integer> indeg = graph.inDegrees();
        List<Set<N>> gens = generations(graph, indeg);
        int placed = gens.stream().mapToInt(Set::size).sum();
        if (placed != graph.nodes().size()) {
            Set<N> stuck = new LinkedHashSet<>();
            for (var en : indeg.entrySet()) if (en.getValue() > 0) stuck.add(en.getKey());
            throw new IllegalStateException("Cycle detected among nodes: " + stuck);
        }
        return gens;
    }

    public static <N> boolean isAcyclic(DirectedGraph<N> graph) {
        return generations(graph, graph.inDegrees()).stream().mapToInt(Set::size).sum() == graph.nodes().size();
    }

    /** Peels off zero in-degree layers; indeg is consumed. Nodes on or behind a cycle are never placed. */
    private static <N> List<Set<N>> generations(DirectedGraph<N> graph, Map<N, Integer> indeg) {
        Map<N, Set<N>> adj = graph.adjacency();
        List<N> current = new ArrayList<>();
        for (var en : indeg.entrySet()) if (en.getValue() == 0) current.add(en.getKey());

        List<Set<N>> gens = new ArrayList<>();
        while (!current.isEmpty()) {
            gens.add(Collections.unmodifiableSet(new LinkedHashSet<>(current)));
            List<N> next = new ArrayList<>();
            for (N n : current) {
                for (N m : adj.get(n)) {
                    if (indeg.merge(m, -1, Integer::sum) == 0) next.add(m);
                }
            }
            current = next;
        }
        return gens;
    }

    /** Every node reachable from {@code start}, including start itself. */
    public static <N> Set<N> descendants(DirectedGraph<N> graph, N start) {
        Map<N, Set<N>> adj = graph.adjacency();
        if (!adj.containsKey(start)) throw new IllegalArgumentException("Not a node of the graph: " + start);
        Set<N> seen = new LinkedHashSet<>();
        Deque<N> todo = new ArrayDeque<>();
        todo.add(start);
        while (!todo.isEmpty()) {
            N n = todo.poll();
            if (seen.add(n)) todo.addAll(adj.get(n));
        }
        return seen;
    }
}

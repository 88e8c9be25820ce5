package com.hcltech.multiway;

import java.util.*;

/** Immutable directed graph: nodes + (from→to) edges, both in insertion order. */
public record DirectedGraph<N>(Set<N> nodes, Set<Edge<N>> edges) {
    public DirectedGraph {
        nodes = Collections.unmodifiableSet(new LinkedHashSet<>(nodes));
        edges = Collections.unmodifiableSet(new LinkedHashSet<>(edges));
        for (Edge<N> e : edges) {
            if (!nodes.contains(e.from()) || !nodes.contains(e.to()))
                throw new IllegalArgumentException("Edge " + e + " refers to a node outside the graph");
        }
    }

    public Map<N, Integer> outDegrees() {
        Map<N, Integer> out = zeroes();
        for (Edge<N> e : edges) out.merge(e.from(), 1, Integer::sum);
        return out;
    }

    public Map<N, Integer> inDegrees() {
        Map<N, Integer> in = zeroes();
        for (Edge<N> e : edges) in.merge(e.to(), 1, Integer::sum);
        return in;
    }

    public int outDegree(N node) {
        return (int) edges.stream().filter(e -> e.from().equals(node)).count();
    }

    public int inDegree(N node) {
        return (int) edges.stream().filter(e -> e.to().equals(node)).count();
    }

    /** Nodes with no incoming edge. */
    public Set<N> sources() {
        return withDegreeZero(inDegrees());
    }

    /** Nodes with no outgoing edge. */
    public Set<N> sinks() {
        return withDegreeZero(outDegrees());
    }

    public Map<N, Set<N>> adjacency() {
        Map<N, Set<N>> adj = new LinkedHashMap<>();
        for (N n : nodes) adj.put(n, new LinkedHashSet<>());
        for (Edge<N> e : edges) adj.get(e.from()).add(e.to());
        return adj;
    }

    private Map<N, Integer> zeroes() {
        Map<N, Integer> m = new LinkedHashMap<>();
        for (N n : nodes) m.put(n, 0);
        return m;
    }

    private static <N> Set<N> withDegreeZero(Map<N, Integer> degrees) {
        Set<N> result = new LinkedHashSet<>();
        degrees.forEach((n, d) -> { if (d == 0) result.add(n); });
        return Collections.unmodifiableSet(result);
    }
}

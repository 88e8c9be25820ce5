package com.hcltech.multiway;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.hcltech.multiway.MultiwayFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class TopoTest {

    private static DirectedGraph<String> graph(Set<String> nodes, List<Edge<String>> edges) {
        return new DirectedGraph<>(nodes, Set.copyOf(edges));
    }

    @Test
    void forkAndJoinGenerations() {
        var g = graph(Set.of("A", "B", "C", "D"),
                List.of(new Edge<>("A", "B"), new Edge<>("A", "C"), new Edge<>("B", "D"), new Edge<>("C", "D")));
        assertEquals(List.of(Set.of("A"), Set.of("B", "C"), Set.of("D")), Topo.topoSort(g));
    }

    @Test
    void noEdgesAllInFirstGeneration() {
        var g = graph(Set.of("X", "Y"), List.of());
        assertEquals(List.of(Set.of("X", "Y")), Topo.topoSort(g));
    }

    @Test
    void cycleIsDetected() {
        var g = graph(Set.of("A", "B", "C", "Z"),
                List.of(new Edge<>("A", "B"), new Edge<>("B", "C"), new Edge<>("C", "A")));
        var ex = assertThrows(IllegalStateException.class, () -> Topo.topoSort(g));
        assertTrue(ex.getMessage().contains("Cycle"), ex.getMessage());
        assertFalse(Topo.isAcyclic(g));
    }

    @Test
    void multiwayGenerationsFollowInversionCount() {
        var g = MultiwayGraphBuilder.build(n3());
        var gens = Topo.topoSort(g);
        assertEquals(4, gens.size());
        for (int i = 0; i < gens.size(); i++) {
            for (MultiwayNode n : gens.get(i)) {
                assertEquals(3 - i, ((MultiwayNode.StateNode) n).state().inversions());
            }
        }
    }

    @Test
    void descendantsIncludeStart() {
        var g = MultiwayGraphBuilder.build(n3());
        assertEquals(Set.of(node(1, 3, 2), node(1, 2, 3)), Topo.descendants(g, node(1, 3, 2)));
        assertEquals(6, Topo.descendants(g, node(3, 2, 1)).size());
        assertThrows(IllegalArgumentException.class, () -> Topo.descendants(g, node(9, 9, 9)));
    }

    @Test
    void edgesOutsideTheNodeSetAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> graph(Set.of("A"), List.of(new Edge<>("A", "B"))));
    }
}

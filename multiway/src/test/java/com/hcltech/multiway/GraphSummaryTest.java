package com.hcltech.multiway;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.hcltech.multiway.MultiwayFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class GraphSummaryTest {

    @Test
    void sizeThreeWithoutSuperSource() {
        var summary = GraphSummary.of(MultiwayGraphBuilder.build(n3()), node(1, 2, 3));
        assertEquals(new GraphSummary(6, 6, true, 1, 1, Optional.of(true), Optional.of(true)), summary);
    }

    @Test
    void superSourceBecomesTheOnlySource() {
        var summary = GraphSummary.of(MultiwayGraphBuilder.build(n3(), true), node(1, 2, 3));
        assertEquals(7, summary.nodes());
        assertEquals(12, summary.edges());
        assertEquals(1, summary.sources());
        assertEquals(1, summary.sinks());
    }

    @Test
    void singleNodeIsSourceAndSink() {
        var summary = GraphSummary.of(MultiwayGraphBuilder.build(values(1, 1)), node(1, 1));
        assertEquals(new GraphSummary(1, 0, true, 1, 1, Optional.of(true), Optional.of(true)), summary);
    }

    @Test
    void absentSortedStateIsReported() {
        var summary = GraphSummary.of(MultiwayGraphBuilder.build(n3()), node(1, 2));
        assertEquals(Optional.of(false), summary.sortedPresent());
        assertEquals(Optional.of(false), summary.sortedIsSink());
    }

    @Test
    void causalSummaryHasNoSortedCheck() {
        var summary = GraphSummary.of(CausalGraphBuilder.build(values(3, 2, 1)).graph());
        assertEquals(6, summary.nodes());
        assertEquals(4, summary.edges());
        assertEquals(2, summary.sources());
        assertEquals(2, summary.sinks());
        assertTrue(summary.sortedPresent().isEmpty());
    }
}

package com.hcltech.multiway;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

import static com.hcltech.multiway.MultiwayFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class CausalGraphBuilderTest {

    @Test
    void singleSwapIsOneEventAndNoEdges() {
        var g = CausalGraphBuilder.build(values(2, 1));
        assertEquals(Set.of("21->12@0"), triples(g.events()));
        assertTrue(g.edges().isEmpty());
    }

    @Test
    void reversedTripleEvents() {
        var g = CausalGraphBuilder.build(values(3, 2, 1));
        assertEquals(Set.of(
                "321->231@0", "321->312@1",
                "231->213@1", "312->132@0",
                "213->123@0", "132->123@1"), triples(g.events()));
    }

    @Test
    void reversedTripleCausalEdges() {
        var g = CausalGraphBuilder.build(values(3, 2, 1));
        assertEquals(Set.of(
                "321->231@0 => 231->213@1",
                "321->312@1 => 312->132@0",
                "231->213@1 => 213->123@0",
                "312->132@0 => 132->123@1"), causalTriples(g));
    }

    @Test
    void idsFollowEnumerationOrderAndSwapIndex() {
        var g = CausalGraphBuilder.build(values(3, 2, 1));
        List<Event> events = new ArrayList<>(g.events());
        assertEquals(IntStream.range(0, 6).boxed().toList(), events.stream().map(Event::id).toList());
        // 1,3,2 is the first state with a successor
        assertEquals(new Event(0, s(1, 3, 2), s(1, 2, 3), 1), events.get(0));
        assertEquals(new Event(4, s(3, 2, 1), s(2, 3, 1), 0), events.get(4));
        assertEquals(new Event(5, s(3, 2, 1), s(3, 1, 2), 1), events.get(5));
    }

    @Test
    void lookupsIndexProducersAndConsumers() {
        var g = CausalGraphBuilder.build(values(3, 2, 1));
        assertEquals(2, g.producing(s(1, 2, 3)).size());
        assertTrue(g.consuming(s(1, 2, 3)).isEmpty());
        assertTrue(g.producing(s(3, 2, 1)).isEmpty());
        assertEquals(2, g.consuming(s(3, 2, 1)).size());
    }

    @Test
    void everyProducerLinksToEveryConsumer() {
        var states = values(2, 2, 1, 1, 3);
        var g = CausalGraphBuilder.build(states);
        int expected = 0;
        for (State st : states) {
            int produced = g.producing(st).size();
            int consumed = g.consuming(st).size();
            expected += produced * consumed;
            for (Event e1 : g.producing(st)) {
                for (Event e2 : g.consuming(st)) {
                    assertTrue(g.edges().contains(new Edge<>(e1, e2)), e1 + " => " + e2);
                }
            }
        }
        assertEquals(expected, g.edges().size());
    }

    @Test
    void everyEdgeChainsThroughItsIntermediateState() {
        var g = CausalGraphBuilder.build(StateEnumerator.ofSize(4));
        for (Edge<Event> e : g.edges()) assertEquals(e.from().target(), e.to().source());
        assertTrue(Topo.isAcyclic(g.graph()));
    }

    @Test
    void countsForKnownInputs() {
        var n4 = CausalGraphBuilder.build(StateEnumerator.ofSize(4));
        assertEquals(36, n4.events().size());
        assertEquals(44, n4.edges().size());

        var multiset = CausalGraphBuilder.build(values(3, 1, 1, 2));
        assertEquals(15, multiset.events().size());
        assertEquals(16, multiset.edges().size());
    }

    @Test
    void eventsAndEdgesDoNotDependOnEnumerationOrder() {
        List<State> reversed = new ArrayList<>(StateEnumerator.ofSize(4));
        Collections.reverse(reversed);
        var a = CausalGraphBuilder.build(StateEnumerator.ofSize(4));
        var b = CausalGraphBuilder.build(reversed);
        assertEquals(triples(a.events()), triples(b.events()));
        assertEquals(causalTriples(a), causalTriples(b));
    }

    @Test
    void sameStateTwiceYieldsItsEventsOnce() {
        var g = CausalGraphBuilder.build(List.of(s(2, 1), s(2, 1)));
        assertEquals(1, g.events().size());
    }

    @Test
    void sharedSourceAndTargetStillDistinctEvents() {
        var a = new Event(0, s(2, 1), s(1, 2), 0);
        var b = new Event(1, s(2, 1), s(1, 2), 0);
        assertNotEquals(a, b);
        assertEquals(a.label(), b.label());
        assertEquals("21→12 @0", a.label());
        assertThrows(IllegalArgumentException.class, () -> new Event(-1, s(2, 1), s(1, 2), 0));
    }
}

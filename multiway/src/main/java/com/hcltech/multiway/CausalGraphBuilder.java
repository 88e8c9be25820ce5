package com.hcltech.multiway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Re-expresses transitions as events and links e1 → e2 whenever e1's target is e2's source.
 * <p>
 * Every event producing a state is linked to every event consuming it, whichever starting
 * state each came from. Ids are handed out in a single pass: states in the given order, swap
 * indices ascending within a state.
 */
public final class CausalGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(CausalGraphBuilder.class);

    private CausalGraphBuilder() {}

    public static CausalGraph build(Collection<State> states) {
        Objects.requireNonNull(states);
        MultiwayGraphBuilder.requireSameSize(states);

        List<Event> events = new ArrayList<>();
        Map<State, List<Event>> consumedBy = new LinkedHashMap<>();
        Map<State, List<Event>> producedBy = new LinkedHashMap<>();

        for (State p : new LinkedHashSet<>(states)) {
            for (Transition t : Transitions.of(p)) {
                Event e = Event.of(events.size(), t);
                events.add(e);
                consumedBy.computeIfAbsent(p, k -> new ArrayList<>()).add(e);
                producedBy.computeIfAbsent(t.target(), k -> new ArrayList<>()).add(e);
            }
        }

        Set<Edge<Event>> edges = new LinkedHashSet<>();
        for (var en : producedBy.entrySet()) {
            List<Event> consumers = consumedBy.get(en.getKey());
            if (consumers == null) continue; // sorted state: nothing consumes it
            for (Event e1 : en.getValue()) {
                for (Event e2 : consumers) edges.add(new Edge<>(e1, e2));
            }
        }
        log.debug("Causal graph: {} events, {} causal edges", events.size(), edges.size());
        return new CausalGraph(new DirectedGraph<>(new LinkedHashSet<>(events), edges), producedBy, consumedBy);
    }
}

package com.hcltech.multiway;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

final class CausalPresentation implements NodeTC<Event>, EdgeTC<Event> {
    static final CausalPresentation INSTANCE = new CausalPresentation();

    private CausalPresentation() {}

    @Override
    public String id(Event event) {
        return String.valueOf(event.id());
    }

    @Override
    public String label(Event event) {
        return event.label();
    }

    @Override
    public Map<String, Object> attributes(Event e) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("source", e.source().csv());
        attrs.put("target", e.target().csv());
        attrs.put("swap_index", e.swapIndex());
        attrs.put("label", e.label());
        attrs.put("source_inversions", e.source().inversions());
        attrs.put("target_inversions", e.target().inversions());
        return attrs;
    }

    /** Events are layered by the state they consume. */
    @Override
    public Optional<State> layoutState(Event event) {
        return Optional.of(event.source());
    }

    @Override
    public Comparator<Event> layerOrder() {
        return Comparator.comparing(Event::label).thenComparingInt(Event::id);
    }

    @Override
    public Map<String, Object> attributes(Edge<Event> edge) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("via", edge.from().target().csv());
        return attrs;
    }
}

package com.hcltech.multiway;

import com.hcltech.multiway.MultiwayNode.StateNode;
import com.hcltech.multiway.MultiwayNode.SuperSource;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

final class MultiwayPresentation implements NodeTC<MultiwayNode>, EdgeTC<MultiwayNode> {
    static final MultiwayPresentation INSTANCE = new MultiwayPresentation();

    private MultiwayPresentation() {}

    @Override
    public String id(MultiwayNode node) {
        return node.toString();
    }

    @Override
    public String label(MultiwayNode node) {
        return node instanceof StateNode s ? s.state().label() : SuperSource.LABEL;
    }

    @Override
    public Map<String, Object> attributes(MultiwayNode node) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("label", label(node));
        if (node instanceof StateNode s) {
            attrs.put("kind", "state");
            attrs.put("inversions", s.state().inversions());
        } else {
            attrs.put("kind", "super");
        }
        return attrs;
    }

    @Override
    public Optional<State> layoutState(MultiwayNode node) {
        return node instanceof StateNode s ? Optional.of(s.state()) : Optional.empty();
    }

    @Override
    public Comparator<MultiwayNode> layerOrder() {
        return Comparator.comparing((MultiwayNode n) -> n instanceof StateNode s ? s.state() : null,
                Comparator.<State>nullsFirst(Comparator.<State>naturalOrder()));
    }

    @Override
    public Map<String, Object> attributes(Edge<MultiwayNode> edge) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        if (edge.from() instanceof StateNode from && edge.to() instanceof StateNode to) {
            attrs.put("kind", "transition");
            attrs.put("swap_index", swapIndex(from.state(), to.state()));
        } else {
            attrs.put("kind", "super");
        }
        return attrs;
    }

    /** A bubble edge differs from its source at exactly two adjacent positions; the first one is the swap index. */
    static int swapIndex(State from, State to) {
        for (int i = 0; i < from.size(); i++) {
            if (from.get(i) != to.get(i)) return i;
        }
        throw new IllegalArgumentException("No swap between " + from + " and " + to);
    }
}

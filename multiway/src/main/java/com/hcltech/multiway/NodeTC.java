package com.hcltech.multiway;

import java.util.Comparator;
import java.util.Map;
import java.util.Optional;

/** How a node type presents itself to exporters, layout and rendering. */
public interface NodeTC<N> {
    /** Scalar key, unique within one graph. */
    String id(N node);

    /** Human readable label (defaults to toString). */
    default String label(N node) { return String.valueOf(node); }

    /** Ordered attribute map; values are String, Integer, Long, Double or Boolean. */
    Map<String, Object> attributes(N node);

    /** The sequence whose inversion count places the node; empty for synthetic nodes. */
    Optional<State> layoutState(N node);

    /** Tie-break inside one layout layer. */
    default Comparator<N> layerOrder() { return Comparator.comparing(this::label); }

    /** Synthetic nodes get a distinguishing style when rendered. */
    default boolean isSynthetic(N node) { return layoutState(node).isEmpty(); }
}

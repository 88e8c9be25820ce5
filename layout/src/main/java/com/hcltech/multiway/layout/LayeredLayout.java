package com.hcltech.multiway.layout;

import com.hcltech.multiway.DirectedGraph;
import com.hcltech.multiway.NodeTC;
import com.hcltech.multiway.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Places nodes in horizontal bands by the inversion count of their layout state: most inversions
 * at the top (y = 0), zero inversions at the bottom, one unit between bands. Nodes in a band are
 * centred on x = 0, one unit apart, in the node type's layer order. Synthetic nodes sit one unit
 * above the top band.
 * <p>
 * Reads the graph only; the edges are not consulted.
 */
public final class LayeredLayout {
    private static final Logger log = LoggerFactory.getLogger(LayeredLayout.class);

    /** Layer index given to synthetic nodes. */
    public static final int SYNTHETIC_LAYER = -1;

    private LayeredLayout() {}

    public static <N> Map<N, Point> layout(DirectedGraph<N> graph, NodeTC<N> tc) {
        SortedMap<Integer, List<N>> layers = layers(graph, tc);
        Map<N, Point> pos = new LinkedHashMap<>();
        layers.forEach((layer, row) -> {
            double y = -layer;
            double offset = (row.size() - 1) / 2.0;
            for (int i = 0; i < row.size(); i++) pos.put(row.get(i), new Point(i - offset, y));
        });
        log.debug("Laid out {} nodes in {} layers", pos.size(), layers.size());
        return Collections.unmodifiableMap(pos);
    }

    /** Layer index per node: 0 for the highest inversion count, {@link #SYNTHETIC_LAYER} for synthetic nodes. */
    public static <N> Map<N, Integer> layerIndices(DirectedGraph<N> graph, NodeTC<N> tc) {
        Map<N, Integer> out = new LinkedHashMap<>();
        layers(graph, tc).forEach((layer, row) -> row.forEach(n -> out.put(n, layer)));
        return Collections.unmodifiableMap(out);
    }

    /** Layer index → nodes in that layer, already ordered. */
    static <N> SortedMap<Integer, List<N>> layers(DirectedGraph<N> graph, NodeTC<N> tc) {
        SortedMap<Integer, List<N>> byInversions = new TreeMap<>(Comparator.reverseOrder());
        List<N> synthetic = new ArrayList<>();
        for (N n : graph.nodes()) {
            Optional<State> st = tc.layoutState(n);
            if (st.isPresent()) byInversions.computeIfAbsent(st.get().inversions(), k -> new ArrayList<>()).add(n);
            else synthetic.add(n);
        }

        SortedMap<Integer, List<N>> layers = new TreeMap<>();
        if (!synthetic.isEmpty()) layers.put(SYNTHETIC_LAYER, sorted(synthetic, tc));
        int index = 0;
        for (List<N> row : byInversions.values()) layers.put(index++, sorted(row, tc));
        return layers;
    }

    private static <N> List<N> sorted(List<N> row, NodeTC<N> tc) {
        List<N> copy = new ArrayList<>(row);
        copy.sort(tc.layerOrder());
        return List.copyOf(copy);
    }
}

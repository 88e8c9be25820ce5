package com.hcltech.multiway.export;

import com.hcltech.multiway.GraphView;

import java.util.LinkedHashMap;
import java.util.Map;

final class GraphMetadata {
    private GraphMetadata() {}

    static <N> Map<String, Object> attributes(GraphView<N> view) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("name", view.name());
        attrs.put("kind", view.kind().prefix());
        attrs.put("node_count", view.nodeCount());
        attrs.put("edge_count", view.edgeCount());
        return attrs;
    }
}

package com.hcltech.multiway.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.hcltech.multiway.Edge;
import com.hcltech.multiway.GraphView;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Node-link JSON: {@code {"directed", "multigraph", "graph", "nodes": [{"id", ...}], "links": [{"source", "target", ...}]}}.
 */
public final class JsonGraphExporter implements GraphExporter {
    private final ObjectMapper mapper;

    public JsonGraphExporter() {
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public String extension() {
        return "json";
    }

    @Override
    public <N> void write(GraphView<N> view, OutputStream out) throws IOException {
        mapper.writeValue(out, document(view));
    }

    static <N> Map<String, Object> document(GraphView<N> view) {
        List<Map<String, Object>> nodes = new ArrayList<>();
        for (N n : view.graph().nodes()) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("id", view.nodes().id(n));
            node.putAll(view.nodes().attributes(n));
            nodes.add(node);
        }
        List<Map<String, Object>> links = new ArrayList<>();
        for (Edge<N> e : view.graph().edges()) {
            Map<String, Object> link = new LinkedHashMap<>();
            link.put("source", view.nodes().id(e.from()));
            link.put("target", view.nodes().id(e.to()));
            link.putAll(view.edges().attributes(e));
            links.add(link);
        }
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("directed", view.directed());
        doc.put("multigraph", false);
        doc.put("graph", GraphMetadata.attributes(view));
        doc.put("nodes", nodes);
        doc.put("links", links);
        return doc;
    }
}

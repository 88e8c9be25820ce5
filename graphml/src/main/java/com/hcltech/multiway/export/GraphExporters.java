package com.hcltech.multiway.export;

import java.util.*;

/** Exporters registered through {@code META-INF/services}, keyed by format name. */
public final class GraphExporters {
    private GraphExporters() {}

    public static Map<String, GraphExporter> available() {
        return available(GraphExporters.class.getClassLoader());
    }

    public static Map<String, GraphExporter> available(ClassLoader loader) {
        Map<String, GraphExporter> byFormat = new TreeMap<>();
        for (GraphExporter e : ServiceLoader.load(GraphExporter.class, loader)) byFormat.putIfAbsent(e.format(), e);
        return Collections.unmodifiableMap(byFormat);
    }

    public static Optional<GraphExporter> find(String format) {
        return Optional.ofNullable(available().get(format.toLowerCase(Locale.ROOT)));
    }
}

package com.hcltech.multiway.render;

import java.util.Locale;
import java.util.Optional;
import java.util.ServiceLoader;

public final class GraphRenderers {
    private GraphRenderers() {}

    public static Optional<GraphRenderer> find(String format) {
        return find(format, GraphRenderers.class.getClassLoader());
    }

    public static Optional<GraphRenderer> find(String format, ClassLoader loader) {
        String wanted = format.toLowerCase(Locale.ROOT);
        for (GraphRenderer r : ServiceLoader.load(GraphRenderer.class, loader)) {
            if (r.format().equals(wanted)) return Optional.of(r);
        }
        return Optional.empty();
    }
}

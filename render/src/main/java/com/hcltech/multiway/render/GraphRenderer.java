package com.hcltech.multiway.render;

import com.hcltech.multiway.GraphView;
import com.hcltech.multiway.common.errorsor.ErrorsOr;
import com.hcltech.multiway.layout.Point;

import java.nio.file.Path;
import java.util.Map;

/** Draws a laid-out graph to an image file. Found through {@link GraphRenderers}. */
public interface GraphRenderer {

    /** Image format name, e.g. {@code png}. */
    String format();

    <N> ErrorsOr<Path> render(GraphView<N> view, Map<N, Point> layout, RenderOptions options, Path out);
}

package com.hcltech.multiway.render;

import com.hcltech.multiway.layout.Point;

import java.awt.geom.Point2D;
import java.util.Collection;

/** Maps layout coordinates (y up) into image pixels (y down), keeping a margin on every side. */
final class Viewport {
    private final double minX, maxX, minY, maxY;
    private final int width, height, margin;

    Viewport(Collection<Point> points, int width, int height, int margin) {
        double x0 = Double.POSITIVE_INFINITY, x1 = Double.NEGATIVE_INFINITY;
        double y0 = Double.POSITIVE_INFINITY, y1 = Double.NEGATIVE_INFINITY;
        for (Point p : points) {
            x0 = Math.min(x0, p.x());
            x1 = Math.max(x1, p.x());
            y0 = Math.min(y0, p.y());
            y1 = Math.max(y1, p.y());
        }
        if (points.isEmpty()) x0 = x1 = y0 = y1 = 0;
        this.minX = x0;
        this.maxX = x1;
        this.minY = y0;
        this.maxY = y1;
        this.width = width;
        this.height = height;
        this.margin = Math.min(margin, Math.min(width, height) / 2);
    }

    Point2D toPixel(Point p) {
        return new Point2D.Double(axis(p.x(), minX, maxX, width, false), axis(p.y(), minY, maxY, height, true));
    }

    private double axis(double v, double lo, double hi, int size, boolean flip) {
        double usable = size - 2.0 * margin;
        if (hi - lo == 0) return size / 2.0;
        double t = (v - lo) / (hi - lo);
        return margin + (flip ? 1 - t : t) * usable;
    }
}

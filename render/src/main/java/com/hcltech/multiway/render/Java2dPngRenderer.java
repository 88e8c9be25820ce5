package com.hcltech.multiway.render;

import com.hcltech.multiway.Edge;
import com.hcltech.multiway.GraphView;
import com.hcltech.multiway.common.errorsor.ErrorsOr;
import com.hcltech.multiway.layout.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.geom.Ellipse2D;
import java.awt.geom.Line2D;
import java.awt.geom.Path2D;
import java.awt.geom.Point2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Headless PNG rendering with Java2D: straight arrowed edges, filled circles, centred labels.
 * Synthetic nodes are drawn half again as large in the super-source colour.
 */
public final class Java2dPngRenderer implements GraphRenderer {
    private static final Logger log = LoggerFactory.getLogger(Java2dPngRenderer.class);

    private static final Color EDGE_COLOR = new Color(0x55, 0x55, 0x55);
    private static final Color OUTLINE_COLOR = new Color(0x33, 0x33, 0x33);
    private static final double SYNTHETIC_GROWTH = 1.5;

    @Override
    public String format() {
        return "png";
    }

    @Override
    public <N> ErrorsOr<Path> render(GraphView<N> view, Map<N, Point> layout, RenderOptions options, Path out) {
        return ErrorsOr.trying("{0}: {1}", () -> {
            BufferedImage image = draw(view, layout, options);
            Path parent = out.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (OutputStream os = Files.newOutputStream(out)) {
                if (!ImageIO.write(image, "png", os)) throw new IOException("No PNG image writer available");
            }
            log.debug("Rendered '{}' at {}x{}", view.name(), image.getWidth(), image.getHeight());
            return out;
        }).addPrefixIfError("Could not render png to " + out + ": ");
    }

    <N> BufferedImage draw(GraphView<N> view, Map<N, Point> layout, RenderOptions options) {
        int w = options.pixelWidth();
        int h = options.pixelHeight();
        double diameter = options.nodeSize() * options.scale();
        Viewport viewport = viewport(layout, options);

        BufferedImage image = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, w, h);

            g.setStroke(new BasicStroke((float) Math.max(0.8, 0.8 * options.scale())));
            for (Edge<N> e : view.graph().edges()) {
                Point from = layout.get(e.from());
                Point to = layout.get(e.to());
                if (from == null || to == null) continue; // node left out of the layout
                double r = radius(view, e.to(), diameter);
                drawArrow(g, viewport.toPixel(from), viewport.toPixel(to), r, diameter / 3);
            }

            Font font = new Font(Font.SANS_SERIF, Font.PLAIN, (int) Math.max(1, Math.round(options.fontSize() * options.scale())));
            g.setFont(font);
            for (N n : view.graph().nodes()) {
                Point p = layout.get(n);
                if (p == null) continue;
                Point2D c = viewport.toPixel(p);
                double r = radius(view, n, diameter);
                Shape circle = new Ellipse2D.Double(c.getX() - r, c.getY() - r, 2 * r, 2 * r);
                g.setColor(view.nodes().isSynthetic(n) ? options.superColor() : options.nodeColor());
                g.fill(circle);
                g.setColor(OUTLINE_COLOR);
                g.draw(circle);
                drawCentred(g, view.nodes().label(n), c);
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    static Viewport viewport(Map<?, Point> layout, RenderOptions options) {
        int margin = (int) Math.ceil(options.nodeSize() * options.scale() * SYNTHETIC_GROWTH);
        return new Viewport(layout.values(), options.pixelWidth(), options.pixelHeight(), margin);
    }

    private static <N> double radius(GraphView<N> view, N node, double diameter) {
        return (view.nodes().isSynthetic(node) ? diameter * SYNTHETIC_GROWTH : diameter) / 2;
    }

    private static void drawArrow(Graphics2D g, Point2D from, Point2D to, double targetRadius, double head) {
        double dx = to.getX() - from.getX();
        double dy = to.getY() - from.getY();
        double len = Math.hypot(dx, dy);
        if (len <= targetRadius) return;
        double ux = dx / len, uy = dy / len;
        double tipX = to.getX() - ux * targetRadius;
        double tipY = to.getY() - uy * targetRadius;

        g.setColor(EDGE_COLOR);
        g.draw(new Line2D.Double(from.getX(), from.getY(), tipX, tipY));
        Path2D arrow = new Path2D.Double();
        arrow.moveTo(tipX, tipY);
        arrow.lineTo(tipX - ux * head - uy * head / 2, tipY - uy * head + ux * head / 2);
        arrow.lineTo(tipX - ux * head + uy * head / 2, tipY - uy * head - ux * head / 2);
        arrow.closePath();
        g.fill(arrow);
    }

    private static void drawCentred(Graphics2D g, String text, Point2D c) {
        FontMetrics fm = g.getFontMetrics();
        float x = (float) (c.getX() - fm.stringWidth(text) / 2.0);
        float y = (float) (c.getY() + (fm.getAscent() - fm.getDescent()) / 2.0);
        g.setColor(Color.BLACK);
        g.drawString(text, x, y);
    }
}

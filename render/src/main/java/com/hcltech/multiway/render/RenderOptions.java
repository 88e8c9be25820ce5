package com.hcltech.multiway.render;

import com.hcltech.multiway.common.errorsor.ErrorsOr;

import java.awt.Color;
import java.util.ArrayList;
import java.util.List;

/**
 * Presentation hints supplied by the caller. Sizes are in pixels before scaling; the image is
 * {@code width * scale} by {@code height * scale}.
 */
public record RenderOptions(Color nodeColor, Color superColor, int nodeSize, int fontSize,
                            double scale, int width, int height) {

    public static final String DEFAULT_SUPER_COLOR = "#fd8d3c";

    /** Validates every hint, collecting all problems. A non-positive scale falls back to 1.0. */
    public static ErrorsOr<RenderOptions> of(String nodeColor, String superColor, int nodeSize, int fontSize,
                                             double scale, int width, int height) {
        List<String> errors = new ArrayList<>();
        Color node = parseColor("node colour", nodeColor, errors);
        Color sup = parseColor("super-source colour", superColor, errors);
        if (nodeSize <= 0) errors.add("Node size must be > 0 but was " + nodeSize);
        if (fontSize <= 0) errors.add("Font size must be > 0 but was " + fontSize);
        if (width <= 0 || height <= 0) errors.add("Image size must be positive but was " + width + "x" + height);
        if (!errors.isEmpty()) return ErrorsOr.errors(errors);
        double s = scale > 0 && Double.isFinite(scale) ? scale : 1.0;
        return ErrorsOr.lift(new RenderOptions(node, sup, nodeSize, fontSize, s, width, height));
    }

    public int pixelWidth() {
        return Math.max(1, (int) Math.round(width * scale));
    }

    public int pixelHeight() {
        return Math.max(1, (int) Math.round(height * scale));
    }

    private static Color parseColor(String what, String value, List<String> errors) {
        if (value == null) {
            errors.add("Missing " + what);
            return null;
        }
        try {
            return Color.decode(value.startsWith("#") ? value : "#" + value);
        } catch (NumberFormatException e) {
            errors.add("Invalid " + what + " '" + value + "'. Expected hex such as #9ecae1");
            return null;
        }
    }
}

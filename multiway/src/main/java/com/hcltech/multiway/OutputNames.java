package com.hcltech.multiway;

/** Default artifact names, a pure function of what was built and from which input. */
public interface OutputNames {

    /** {@code multiway_n3}, {@code causal_values_3-1-1-2}: the graph name and file stem. */
    static String graphName(GraphKind kind, InputSelector selector) {
        return kind.prefix() + "_" + selector.descriptor();
    }

    /** {@code multiway_n3.graphml}, {@code causal_values_3-1-1-2.json}, ... */
    static String defaultName(GraphKind kind, InputSelector selector, String extension) {
        String ext = extension.startsWith(".") ? extension.substring(1) : extension;
        return graphName(kind, selector) + "." + ext;
    }
}

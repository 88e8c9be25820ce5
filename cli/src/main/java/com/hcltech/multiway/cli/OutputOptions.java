package com.hcltech.multiway.cli;

import picocli.CommandLine;

import java.nio.file.Path;

/** Output files and presentation hints. Unset hints fall back to {@code multiway.properties}. */
public class OutputOptions {

    @CommandLine.Option(names = "--output-dir", paramLabel = "<dir>", defaultValue = ".",
            description = "Directory for default-named outputs (default: ${DEFAULT-VALUE}).")
    Path outputDir;

    @CommandLine.Option(names = "--graphml", paramLabel = "<path>",
            description = "GraphML output path (default: <kind>_<input>.graphml).")
    Path graphml;

    @CommandLine.Option(names = "--json", paramLabel = "<path>", arity = "0..1", fallbackValue = "",
            description = "Also write node-link JSON; without a path the default name is used.")
    String json;

    @CommandLine.Option(names = "--png", paramLabel = "<path>", description = "Render the layered layout to a PNG.")
    Path png;

    @CommandLine.Option(names = "--scale", description = "Image scale factor; non-positive means 1.0.")
    Double scale;

    @CommandLine.Option(names = "--node-color", paramLabel = "<hex>", description = "Node fill colour, e.g. #9ecae1.")
    String nodeColor;

    @CommandLine.Option(names = "--node-size", paramLabel = "<px>", description = "Node diameter in pixels.")
    Integer nodeSize;

    @CommandLine.Option(names = "--font-size", paramLabel = "<px>", description = "Label font size in pixels.")
    Integer fontSize;
}

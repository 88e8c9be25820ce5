package com.hcltech.multiway.cli;

interface ConfigKeys {
    String WARN_SIZE = "multiway.warn.size";
    String NODE_COLOR_STATES = "render.node.color.states";
    String NODE_COLOR_CAUSAL = "render.node.color.causal";
    String NODE_SIZE = "render.node.size";
    String FONT_SIZE = "render.font.size";
    String SCALE = "render.scale";
    String WIDTH = "render.width";
    String HEIGHT = "render.height";

    int DEFAULT_WARN_SIZE = 8;
    String DEFAULT_NODE_COLOR_STATES = "#9ecae1";
    String DEFAULT_NODE_COLOR_CAUSAL = "#fdd0a2";
    int DEFAULT_NODE_SIZE = 36;
    int DEFAULT_FONT_SIZE = 10;
    double DEFAULT_SCALE = 1.0;
    int DEFAULT_WIDTH = 1200;
    int DEFAULT_HEIGHT = 900;
}

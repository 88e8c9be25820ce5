package com.hcltech.multiway;

import java.util.Map;

public interface EdgeTC<N> {
    /** Ordered attribute map; values are String, Integer, Long, Double or Boolean. */
    Map<String, Object> attributes(Edge<N> edge);
}

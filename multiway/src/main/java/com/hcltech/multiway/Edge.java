package com.hcltech.multiway;

import java.util.Objects;

public record Edge<N>(N from, N to) {
    public Edge {
        Objects.requireNonNull(from);
        Objects.requireNonNull(to);
    }
}

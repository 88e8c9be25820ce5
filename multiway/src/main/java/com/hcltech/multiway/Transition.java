package com.hcltech.multiway;

import java.util.Objects;

/** One bubble step: {@code target} is {@code source} with positions swapIndex and swapIndex + 1 exchanged. */
public record Transition(State source, State target, int swapIndex) {
    public Transition {
        Objects.requireNonNull(source);
        Objects.requireNonNull(target);
    }
}

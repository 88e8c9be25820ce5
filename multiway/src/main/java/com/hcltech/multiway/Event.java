package com.hcltech.multiway;

import java.util.Objects;

/**
 * One occurrence of a bubble swap. Events are identified by {@code id}: two events may share
 * source and target and still be different events.
 */
public record Event(int id, State source, State target, int swapIndex) {
    public Event {
        if (id < 0) throw new IllegalArgumentException("Event id must be >= 0 but was " + id);
        Objects.requireNonNull(source);
        Objects.requireNonNull(target);
    }

    static Event of(int id, Transition t) {
        return new Event(id, t.source(), t.target(), t.swapIndex());
    }

    /** {@code 321→231 @0} */
    public String label() {
        return source.label() + "→" + target.label() + " @" + swapIndex;
    }
}

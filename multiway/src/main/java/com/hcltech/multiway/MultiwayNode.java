package com.hcltech.multiway;

import java.util.Objects;

/**
 * A node of the multiway graph: either a real {@link State} or the synthetic super-source.
 * The super-source is a different type from every state node, so it can never equal one.
 */
public interface MultiwayNode {

    static StateNode of(State state) {
        return new StateNode(state);
    }

    static StateNode of(int... values) {
        return new StateNode(State.of(values));
    }

    record StateNode(State state) implements MultiwayNode {
        public StateNode {
            Objects.requireNonNull(state);
        }

        @Override
        public String toString() {
            return state.toString();
        }
    }

    enum SuperSource implements MultiwayNode {
        INSTANCE;

        public static final String ID = "__START__";
        public static final String LABEL = "ALL STARTS";

        @Override
        public String toString() {
            return ID;
        }
    }
}

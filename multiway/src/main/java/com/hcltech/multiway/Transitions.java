package com.hcltech.multiway;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Bubble-sort successors of a state: one per adjacent pair that is strictly out of order.
 * Equal neighbours never swap, so no transition is a self-loop.
 */
public final class Transitions {
    private Transitions() {}

    /** Lazy and restartable: every call to {@code iterator()} rescans the state from index 0. */
    public static Iterable<Transition> of(State state) {
        return () -> new TransitionIterator(state);
    }

    public static Stream<Transition> stream(State state) {
        return StreamSupport.stream(of(state).spliterator(), false);
    }

    public static Stream<State> successors(State state) {
        return stream(state).map(Transition::target);
    }

    private static final class TransitionIterator implements Iterator<Transition> {
        private final State state;
        private int next;

        TransitionIterator(State state) {
            this.state = state;
            this.next = advance(0);
        }

        private int advance(int from) {
            for (int i = from; i + 1 < state.size(); i++) {
                if (state.get(i) > state.get(i + 1)) return i;
            }
            return -1;
        }

        @Override
        public boolean hasNext() {
            return next >= 0;
        }

        @Override
        public Transition next() {
            if (next < 0) throw new NoSuchElementException();
            int i = next;
            next = advance(i + 1);
            return new Transition(state, state.swapAdjacent(i), i);
        }
    }
}

package com.hcltech.multiway;

import java.util.*;

/**
 * Reusable fixture for graph tests.
 * - Short state / node constructors
 * - Common inputs (n=3, 3,1,1,2)
 * - Transition triples for comparing event sets without ids
 */
public final class MultiwayFixture {

    public static State s(int... values) {
        return State.of(values);
    }

    public static MultiwayNode node(int... values) {
        return MultiwayNode.of(values);
    }

    public static Edge<MultiwayNode> edge(State from, State to) {
        return new Edge<>(MultiwayNode.of(from), MultiwayNode.of(to));
    }

    public static List<State> n3() {
        return StateEnumerator.ofSize(3);
    }

    public static List<State> values(Integer... values) {
        return StateEnumerator.ofValues(List.of(values));
    }

    /** Event identity without the id: "321->231@0". */
    public static String triple(Event e) {
        return e.source().label() + "->" + e.target().label() + "@" + e.swapIndex();
    }

    public static Set<String> triples(Collection<Event> events) {
        Set<String> out = new TreeSet<>();
        for (Event e : events) out.add(triple(e));
        return out;
    }

    public static Set<String> causalTriples(CausalGraph g) {
        Set<String> out = new TreeSet<>();
        for (Edge<Event> e : g.edges()) out.add(triple(e.from()) + " => " + triple(e.to()));
        return out;
    }

    private MultiwayFixture() {}
}

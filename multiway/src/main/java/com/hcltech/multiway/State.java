package com.hcltech.multiway;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An arrangement of values. Equality, hashing and ordering are by contents, so two states built
 * along different paths that hold the same sequence are the same node.
 * Ordering is lexicographic, then shorter-first.
 */
public final class State implements Comparable<State> {
    private final int[] values;

    private State(int[] values) {
        this.values = values;
    }

    public static State of(int... values) {
        return new State(Objects.requireNonNull(values).clone());
    }

    public static State of(List<Integer> values) {
        return new State(values.stream().mapToInt(Integer::intValue).toArray());
    }

    public int size() {
        return values.length;
    }

    public int get(int index) {
        return values[index];
    }

    /** Defensive copy. */
    public int[] values() {
        return values.clone();
    }

    public List<Integer> toList() {
        return Arrays.stream(values).boxed().toList();
    }

    /** The state with positions i and i + 1 exchanged. */
    public State swapAdjacent(int i) {
        if (i < 0 || i + 1 >= values.length)
            throw new IndexOutOfBoundsException("Swap index " + i + " out of range for size " + values.length);
        int[] copy = values.clone();
        int tmp = copy[i];
        copy[i] = copy[i + 1];
        copy[i + 1] = tmp;
        return new State(copy);
    }

    public int inversions() {
        return Inversions.count(values);
    }

    /** Non-descending, i.e. zero inversions. */
    public boolean isSorted() {
        for (int i = 0; i + 1 < values.length; i++) {
            if (values[i] > values[i + 1]) return false;
        }
        return true;
    }

    public State sorted() {
        int[] copy = values.clone();
        Arrays.sort(copy);
        return new State(copy);
    }

    /** Digits run together when every value is a single digit ("321"), otherwise comma separated. */
    public String label() {
        boolean digits = Arrays.stream(values).allMatch(v -> v >= 0 && v <= 9);
        return digits ? Arrays.stream(values).mapToObj(String::valueOf).collect(Collectors.joining())
                : csv();
    }

    public String csv() {
        return Arrays.stream(values).mapToObj(String::valueOf).collect(Collectors.joining(","));
    }

    @Override
    public int compareTo(State other) {
        return Arrays.compare(values, other.values);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof State other && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.stream(values).mapToObj(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}

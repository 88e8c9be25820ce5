package com.hcltech.multiway;

import com.hcltech.multiway.common.errorsor.ErrorsOr;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Which multiset to enumerate: either {@code 1..n} or an explicit list of values (duplicates allowed).
 */
public final class InputSelector {

    public enum Mode {SIZE, VALUES}

    private final Mode mode;
    private final List<Integer> values;

    private InputSelector(Mode mode, List<Integer> values) {
        this.mode = mode;
        this.values = List.copyOf(values);
    }

    public static ErrorsOr<InputSelector> ofSize(int n) {
        if (n < 0) return ErrorsOr.error("Size n must be >= 0 but was " + n);
        return ErrorsOr.lift(new InputSelector(Mode.SIZE, IntStream.rangeClosed(1, n).boxed().toList()));
    }

    public static InputSelector ofValues(List<Integer> values) {
        return new InputSelector(Mode.VALUES, Objects.requireNonNull(values));
    }

    public static ErrorsOr<InputSelector> ofValues(String csv) {
        return ValueParser.parse(csv).map(InputSelector::ofValues);
    }

    /** Exactly one of {@code n} and {@code csv} must be non-null. */
    public static ErrorsOr<InputSelector> resolve(Integer n, String csv) {
        if (n != null && csv != null) return ErrorsOr.error("Give either -n or --values, not both");
        if (n != null) return ofSize(n);
        if (csv != null) return ofValues(csv);
        return ErrorsOr.error("One of -n or --values is required");
    }

    public Mode mode() {
        return mode;
    }

    public List<Integer> values() {
        return values;
    }

    public int size() {
        return values.size();
    }

    /** The unique zero-inversion arrangement of the multiset. */
    public State sortedState() {
        return State.of(values).sorted();
    }

    /**
     * Inversions of the descending arrangement, the most any state of this multiset has and so the
     * longest possible path in the multiway graph. {@code n(n-1)/2} when the values are distinct.
     */
    public int maxInversions() {
        int[] sorted = sortedState().values();
        int[] descending = new int[sorted.length];
        for (int i = 0; i < sorted.length; i++) descending[i] = sorted[sorted.length - 1 - i];
        return Inversions.count(descending);
    }

    /** Stable, file-name safe description: {@code n3} or {@code values_3-1-1-2}. */
    public String descriptor() {
        if (mode == Mode.SIZE) return "n" + values.size();
        if (values.isEmpty()) return "values_empty";
        return "values_" + values.stream()
                .map(v -> v < 0 ? "m" + (-(long) v) : String.valueOf(v))
                .collect(Collectors.joining("-"));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof InputSelector other && mode == other.mode && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, values);
    }

    @Override
    public String toString() {
        return mode == Mode.SIZE ? "n=" + values.size() : "values=" + values;
    }
}

package com.hcltech.multiway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.IntStream;

/**
 * Enumerates the distinct permutations of a multiset in ascending lexicographic order.
 * Equal values are indistinguishable, so {@code [1,1]} has exactly one arrangement.
 */
public final class StateEnumerator {
    private static final Logger log = LoggerFactory.getLogger(StateEnumerator.class);

    private StateEnumerator() {}

    /** All n! permutations of {@code 1..n}. */
    public static List<State> ofSize(int n) {
        if (n < 0) throw new IllegalArgumentException("n must be >= 0 but was " + n);
        return ofValues(IntStream.rangeClosed(1, n).boxed().toList());
    }

    public static List<State> ofValues(List<Integer> values) {
        int[] current = values.stream().mapToInt(Integer::intValue).sorted().toArray();
        List<State> states = new ArrayList<>();
        do {
            states.add(State.of(current));
        } while (nextPermutation(current));
        log.debug("Enumerated {} distinct states for {}", states.size(), values);
        return List.copyOf(states);
    }

    public static List<State> of(InputSelector selector) {
        return ofValues(selector.values());
    }

    /**
     * Number of distinct arrangements: size! divided by the factorial of each value's multiplicity.
     */
    public static BigInteger distinctCount(List<Integer> values) {
        Map<Integer, Integer> multiplicity = new TreeMap<>();
        for (Integer v : values) multiplicity.merge(v, 1, Integer::sum);
        BigInteger result = factorial(values.size());
        for (int m : multiplicity.values()) result = result.divide(factorial(m));
        return result;
    }

    private static BigInteger factorial(int n) {
        BigInteger f = BigInteger.ONE;
        for (int i = 2; i <= n; i++) f = f.multiply(BigInteger.valueOf(i));
        return f;
    }

    /** Rearranges a into its lexicographic successor; false (and a untouched) when a is the last one. */
    static boolean nextPermutation(int[] a) {
        int i = a.length - 2;
        while (i >= 0 && a[i] >= a[i + 1]) i--;
        if (i < 0) return false;
        int j = a.length - 1;
        while (a[j] <= a[i]) j--;
        swap(a, i, j);
        reverse(a, i + 1);
        return true;
    }

    private static void swap(int[] a, int i, int j) {
        int tmp = a[i];
        a[i] = a[j];
        a[j] = tmp;
    }

    private static void reverse(int[] a, int from) {
        for (int i = from, j = a.length - 1; i < j; i++, j--) swap(a, i, j);
    }
}

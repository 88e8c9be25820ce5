package com.hcltech.multiway;

public final class Inversions {
    private Inversions() {}

    /** Number of index pairs (i, j), i < j, with values[i] > values[j]. Equal values are not inversions. */
    public static int count(int[] values) {
        int inv = 0;
        for (int i = 0; i < values.length; i++) {
            for (int j = i + 1; j < values.length; j++) {
                if (values[i] > values[j]) inv++;
            }
        }
        return inv;
    }

    public static int count(State state) {
        return count(state.values());
    }
}

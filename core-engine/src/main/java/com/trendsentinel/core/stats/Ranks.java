package com.trendsentinel.core.stats;

import java.util.Arrays;
import java.util.Objects;

/**
 * Rank utilities shared by the surrogate generators.
 *
 * <p>
 * All orderings are <strong>stable</strong>: equal values keep their index
 * order, so the rank of every element is deterministic even with
 * duplicates.
 * </p>
 *
 * @since 1.0.0
 */
public final class Ranks {

    private Ranks() {
        // utility class, not instantiable
    }

    /**
     * Indices that sort {@code values} ascending, ties broken by index.
     *
     * @param values input values
     * @return permutation {@code p} with {@code values[p[0]] <= values[p[1]] <= ...}
     */
    public static int[] stableOrder(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        Integer[] boxed = new Integer[values.length];
        for (int i = 0; i < boxed.length; i++) {
            boxed[i] = i;
        }
        // object sort is a stable merge sort
        Arrays.sort(boxed, (a, b) -> Double.compare(values[a], values[b]));
        int[] order = new int[boxed.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = boxed[i];
        }
        return order;
    }

    /**
     * Stable ordinal ranks, starting at 0.
     *
     * @param values input values
     * @return {@code rank[i]} = position of {@code values[i]} in the stable order
     */
    public static int[] ordinalRanks(double[] values) {
        int[] order = stableOrder(values);
        int[] ranks = new int[order.length];
        for (int k = 0; k < order.length; k++) {
            ranks[order[k]] = k;
        }
        return ranks;
    }

    /**
     * Rank substitution: replace each element of {@code shape} with the
     * element of {@code sortedTarget} at the same rank. The result has
     * exactly the multiset of {@code sortedTarget} and the ordering of
     * {@code shape}.
     *
     * @param shape        series providing the ordering
     * @param sortedTarget ascending values providing the amplitudes
     * @return the rank-adjusted series
     */
    public static double[] substitute(double[] shape, double[] sortedTarget) {
        if (shape.length != sortedTarget.length) {
            throw new IllegalArgumentException("Length mismatch: " + shape.length + " != " + sortedTarget.length);
        }
        int[] ranks = ordinalRanks(shape);
        double[] out = new double[shape.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = sortedTarget[ranks[i]];
        }
        return out;
    }

    /**
     * @param values input values
     * @return an ascending copy
     */
    public static double[] sortedCopy(double[] values) {
        double[] copy = values.clone();
        Arrays.sort(copy);
        return copy;
    }
}

package com.probgraph.inference;

import java.util.Arrays;

public class MathUtil {

    /**
     * Scales {@code x} in place to sum to 1. Leaves an all-zero array alone.
     *
     * @return the sum before scaling
     */
    public static double normalize(double[] x) {
        double sum = 0.0;
        for (double v : x) {
            sum += v;
        }
        if (sum > 0) {
            for (int i = 0; i < x.length; i++) {
                x[i] /= sum;
            }
        }
        return sum;
    }

    /**
     * Computes the maximum absolute difference between two arrays.
     */
    public static double maxAbsDelta(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Arrays must have same length");
        }
        double maxDelta = 0.0;
        for (int i = 0; i < a.length; i++) {
            double delta = Math.abs(a[i] - b[i]);
            if (delta > maxDelta) {
                maxDelta = delta;
            }
        }
        return maxDelta;
    }

    public static double[] ones(int n) {
        double[] x = new double[n];
        Arrays.fill(x, 1.0);
        return x;
    }
}

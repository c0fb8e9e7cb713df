package com.finance.audit.engine;

import java.util.Arrays;

/**
 * Small numeric helpers shared by the classifier and scanners.
 */
public final class DescriptiveStats {

    private DescriptiveStats() {}

    public static double mean(double[] values) {
        if (values.length == 0) return 0.0;
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation (divides by n).
     */
    public static double populationStd(double[] values, double mean) {
        if (values.length == 0) return 0.0;
        double sumSq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / values.length);
    }

    /**
     * Percentile of an ascending-sorted array using linear interpolation between
     * the closest ranks: position = p * (n - 1). Returns 0 for an empty array.
     *
     * @param sorted   values sorted ascending
     * @param length   number of leading elements of {@code sorted} to use
     * @param fraction percentile as a fraction in [0, 1]
     */
    public static double percentileSorted(double[] sorted, int length, double fraction) {
        if (length == 0) return 0.0;
        if (length == 1) return sorted[0];
        double position = fraction * (length - 1);
        int lower = (int) Math.floor(position);
        int upper = Math.min(lower + 1, length - 1);
        double weight = position - lower;
        return sorted[lower] + weight * (sorted[upper] - sorted[lower]);
    }

    public static double percentile(double[] values, double fraction) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        return percentileSorted(sorted, sorted.length, fraction);
    }
}

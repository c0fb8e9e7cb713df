package com.finance.audit.engine;

import lombok.Value;

import java.util.Arrays;

/**
 * Summary statistics of a history window: value count, mean and quartiles.
 */
@Value
public class Baseline {

    public static final Baseline NONE = new Baseline(0, 0.0, 0.0, 0.0);

    int count;
    double mean;
    double q1;
    double q3;

    public double iqr() {
        return q3 - q1;
    }

    /**
     * Baseline over all given values, no filtering.
     */
    public static Baseline of(double[] values) {
        if (values.length == 0) {
            return NONE;
        }
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        return new Baseline(sorted.length,
                DescriptiveStats.mean(sorted),
                DescriptiveStats.percentileSorted(sorted, sorted.length, 0.25),
                DescriptiveStats.percentileSorted(sorted, sorted.length, 0.75));
    }
}

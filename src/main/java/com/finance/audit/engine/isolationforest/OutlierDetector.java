package com.finance.audit.engine.isolationforest;

/**
 * Flags outliers in a one-dimensional batch of values. Implementations may be
 * randomized; the seed makes a run repeatable.
 */
public interface OutlierDetector {

    /**
     * @param values        the batch, in input order
     * @param contamination expected share of outliers, in (0, 0.5]
     * @param seed          random seed for randomized implementations
     * @return one flag per input value, true for a candidate outlier
     */
    boolean[] detect(double[] values, double contamination, long seed);
}

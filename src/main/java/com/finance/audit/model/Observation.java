package com.finance.audit.model;

import lombok.Value;

/**
 * Aggregated value of one dimension key in one period (sum of its raw rows).
 */
@Value
public class Observation {
    DimensionKey dimensionKey;
    Period period;
    double value;
}

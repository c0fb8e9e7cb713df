package com.finance.audit.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One row of the latest-period report: the group's per-period values plus the
 * classification of its most recent period.
 */
@Value
@Builder
public class RowSummary {

    DimensionKey key;

    Map<String, String> dimensions;

    // Period -> value, in ascending period order
    Map<Period, Double> values;

    AnomalyStatus status;

    double latestValue;

    double baselineMean;

    // Signed percentage (latest - mean) / mean * 100, 0 when mean is 0
    double pctChange;
}

package com.finance.audit.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A (dimension group, period) flagged by the rolling time-series scan.
 */
@Value
@Builder
public class RollingAnomalyRecord {

    DimensionKey key;

    Map<String, String> dimensions;

    Period period;

    double value;

    AnomalyStatus status;

    double rollingMean;

    int rollingCount;

    String comparedWith;
}

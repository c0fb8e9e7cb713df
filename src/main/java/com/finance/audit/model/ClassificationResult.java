package com.finance.audit.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of classifying one value against its baseline. Baseline fields are 0
 * when the decision was made before a baseline existed (negative value or
 * insufficient history).
 */
@Value
@Builder
public class ClassificationResult {

    AnomalyStatus status;

    double currentValue;

    double baselineMean;

    double baselineQ1;

    double baselineQ3;

    // Relative change |current - mean| / mean, 0 when no positive mean
    double pctChange;

    // Number of history values the baseline was built from
    int baselineCount;
}

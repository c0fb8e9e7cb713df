package com.finance.audit.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Run parameters of the status decision table.
 */
@Value
@Builder(toBuilder = true)
public class ClassifierParams {

    // Minimum positive history values before any baseline comparison
    @Builder.Default
    int minHistory = 3;

    // IQR fence multiplier
    @Builder.Default
    double k = 2.0;

    // Relative change below which a value is always normal
    @Builder.Default
    double pctThreshold1 = 0.10;

    // Relative change below which a value is normal against a constant history
    @Builder.Default
    double pctThreshold2 = 0.15;

    public static ClassifierParams defaults() {
        return ClassifierParams.builder().build();
    }
}

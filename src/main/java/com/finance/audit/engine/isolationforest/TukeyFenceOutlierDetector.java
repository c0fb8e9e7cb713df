package com.finance.audit.engine.isolationforest;

import com.finance.audit.engine.Baseline;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Deterministic stand-in for the forest vote: flags values outside the
 * 1.5 * IQR Tukey fences of the batch. Contamination and seed are ignored.
 */
@Component
@ConditionalOnProperty(prefix = "audit.peer", name = "detector", havingValue = "tukey")
public class TukeyFenceOutlierDetector implements OutlierDetector {

    private static final double FENCE_MULTIPLIER = 1.5;

    @Override
    public boolean[] detect(double[] values, double contamination, long seed) {
        boolean[] flags = new boolean[values.length];
        if (values.length < 2) {
            return flags;
        }
        Baseline quartiles = Baseline.of(values);
        double lower = quartiles.getQ1() - FENCE_MULTIPLIER * quartiles.iqr();
        double upper = quartiles.getQ3() + FENCE_MULTIPLIER * quartiles.iqr();
        for (int i = 0; i < values.length; i++) {
            flags[i] = values[i] < lower || values[i] > upper;
        }
        return flags;
    }
}

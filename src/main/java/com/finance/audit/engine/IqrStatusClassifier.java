package com.finance.audit.engine;

import com.finance.audit.model.AnomalyStatus;
import com.finance.audit.model.ClassificationResult;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Classifies a value against its history with a relative-change guard followed by
 * IQR fences.
 *
 * Decision order (the order is part of the contract):
 *   1. negative value                          -> NEGATIVE_VALUE
 *   2. insufficient history                    -> NEW_ITEM if value > 0, else NOT_ENOUGH_DATA
 *   3. |value - mean| / mean < pctThreshold1   -> NORMAL, even outside the fences
 *   4. IQR == 0 (constant history):
 *        change < pctThreshold2                -> NORMAL
 *        Q1 == 0 and value > 0                 -> HIGH_SPIKE
 *        value != Q1                           -> SPIKE_VS_CONSTANT
 *        otherwise                             -> NORMAL
 *   5. value > Q3 + k*IQR                      -> HIGH_SPIKE
 *      value < max(0, Q1 - k*IQR)              -> LOW_SPIKE
 *      otherwise                               -> NORMAL
 *
 * Example: history [100, 100, 100] gives IQR = 0. A value of 105 changes 5% and is
 * normal; 150 changes 50% and differs from Q1 = 100, so it is SPIKE_VS_CONSTANT.
 */
@Component
public class IqrStatusClassifier implements StatusClassifier {

    @Override
    public ClassificationResult classify(double current, double[] history, ClassifierParams params) {
        double[] positive = Arrays.stream(history).filter(h -> h > 0).toArray();
        return classifyBaseline(current, Baseline.of(positive), params.getMinHistory(), params);
    }

    @Override
    public ClassificationResult classifyBaseline(double current, Baseline baseline, int minCount,
                                                 ClassifierParams params) {
        if (current < 0) {
            return withoutBaseline(AnomalyStatus.NEGATIVE_VALUE, current, baseline);
        }

        if (baseline.getCount() < minCount) {
            AnomalyStatus status = current > 0 ? AnomalyStatus.NEW_ITEM : AnomalyStatus.NOT_ENOUGH_DATA;
            return withoutBaseline(status, current, baseline);
        }

        double mean = baseline.getMean();
        double pctChange = mean > 0 ? Math.abs(current - mean) / mean : 0.0;

        if (pctChange < params.getPctThreshold1()) {
            return against(AnomalyStatus.NORMAL, current, baseline, pctChange);
        }

        double q1 = baseline.getQ1();
        double iqr = baseline.iqr();

        if (iqr == 0) {
            if (pctChange < params.getPctThreshold2()) {
                return against(AnomalyStatus.NORMAL, current, baseline, pctChange);
            }
            if (q1 == 0 && current > 0) {
                return against(AnomalyStatus.HIGH_SPIKE, current, baseline, pctChange);
            }
            if (current != q1) {
                return against(AnomalyStatus.SPIKE_VS_CONSTANT, current, baseline, pctChange);
            }
            return against(AnomalyStatus.NORMAL, current, baseline, pctChange);
        }

        double lowerFence = Math.max(0.0, q1 - params.getK() * iqr);
        double upperFence = baseline.getQ3() + params.getK() * iqr;

        if (current > upperFence) {
            return against(AnomalyStatus.HIGH_SPIKE, current, baseline, pctChange);
        }
        if (current < lowerFence) {
            return against(AnomalyStatus.LOW_SPIKE, current, baseline, pctChange);
        }
        return against(AnomalyStatus.NORMAL, current, baseline, pctChange);
    }

    private ClassificationResult against(AnomalyStatus status, double current, Baseline baseline, double pctChange) {
        return ClassificationResult.builder()
                .status(status)
                .currentValue(current)
                .baselineMean(baseline.getMean())
                .baselineQ1(baseline.getQ1())
                .baselineQ3(baseline.getQ3())
                .pctChange(pctChange)
                .baselineCount(baseline.getCount())
                .build();
    }

    private ClassificationResult withoutBaseline(AnomalyStatus status, double current, Baseline baseline) {
        return ClassificationResult.builder()
                .status(status)
                .currentValue(current)
                .baselineMean(0.0)
                .baselineQ1(0.0)
                .baselineQ3(0.0)
                .pctChange(0.0)
                .baselineCount(baseline.getCount())
                .build();
    }
}

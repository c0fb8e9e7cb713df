package com.finance.audit.engine;

import com.finance.audit.model.ClassificationResult;

/**
 * Stateless decision procedure that labels a value given its history.
 * Every scanner depends on this interface directly.
 */
public interface StatusClassifier {

    /**
     * Classify {@code current} against an ordered history. Only positive history
     * values form the baseline; fewer than {@code params.minHistory} of them means
     * the history is insufficient.
     *
     * @param current the value being judged
     * @param history earlier values, oldest first; may be empty
     * @param params  run parameters
     * @return the classification, never null
     */
    ClassificationResult classify(double current, double[] history, ClassifierParams params);

    default ClassificationResult classify(double current, double[] history) {
        return classify(current, history, ClassifierParams.defaults());
    }

    /**
     * Classify {@code current} against a precomputed baseline. The history is
     * insufficient when {@code baseline.count < minCount}; the rest of the decision
     * table is identical to {@link #classify(double, double[], ClassifierParams)}.
     */
    ClassificationResult classifyBaseline(double current, Baseline baseline, int minCount, ClassifierParams params);
}

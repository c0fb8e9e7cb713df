package com.finance.audit.engine.isolationforest;

import com.finance.audit.config.AuditThresholdConfig;
import com.finance.audit.engine.DescriptiveStats;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Outlier vote from an isolation forest fitted on the batch itself.
 *
 * A value is flagged when its anomaly score is strictly above the
 * (1 - contamination) quantile of all scores in the batch, so roughly a
 * {@code contamination} share of the batch is flagged. Tied scores are never
 * split, which keeps constant batches unflagged.
 *
 * The forest is randomized. Results are repeatable for a fixed seed within this
 * implementation but are not bit-identical to other isolation forest libraries.
 */
@Component
@ConditionalOnProperty(prefix = "audit.peer", name = "detector", havingValue = "isolation-forest", matchIfMissing = true)
public class IsolationForestOutlierDetector implements OutlierDetector {

    private final int numTrees;
    private final int sampleSize;

    public IsolationForestOutlierDetector(AuditThresholdConfig config) {
        this.numTrees = config.getPeer().getNumTrees();
        this.sampleSize = config.getPeer().getSampleSize();
    }

    @Override
    public boolean[] detect(double[] values, double contamination, long seed) {
        if (contamination <= 0 || contamination > 0.5) {
            throw new IllegalArgumentException("Contamination must be in (0, 0.5], got " + contamination);
        }
        boolean[] flags = new boolean[values.length];
        if (values.length < 2) {
            return flags;
        }

        double[][] data = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            data[i] = new double[]{values[i]};
        }

        IsolationForest forest = IsolationForest.fit(data, numTrees, sampleSize, seed);
        double[] scores = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scores[i] = forest.score(data[i]);
        }

        double threshold = DescriptiveStats.percentile(scores, 1.0 - contamination);
        for (int i = 0; i < values.length; i++) {
            flags[i] = scores[i] > threshold;
        }
        return flags;
    }
}

package com.finance.audit.engine.scanners;

import com.finance.audit.engine.Baseline;
import com.finance.audit.engine.ClassifierParams;
import com.finance.audit.engine.RollingWindow;
import com.finance.audit.engine.StatusClassifier;
import com.finance.audit.model.AggregatedFrame;
import com.finance.audit.model.AnomalyStatus;
import com.finance.audit.model.ClassificationResult;
import com.finance.audit.model.DimensionGroup;
import com.finance.audit.model.Observation;
import com.finance.audit.model.RollingAnomalyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Classifies every (dimension group, period) against a trailing window of the
 * group's previous {@code window} periods.
 *
 * The baseline of period i is built from periods [i - window, i - 1]; the value
 * being judged never enters its own baseline. Window values are used as they are
 * (zeros and negatives included). With fewer than max(1, window - 1) prior
 * periods the baseline is empty (mean, count and quartiles 0), and a count below
 * window - 1 is reported as NEW_ITEM (value > 0) or NOT_ENOUGH_DATA.
 *
 * Each group keeps one bounded sliding window updated in period order, so a scan
 * costs O(observations * window). Only findings outside {NORMAL, NOT_ENOUGH_DATA}
 * are emitted, ordered by group key then period.
 */
@Component
public class RollingTimeSeriesScanner {

    private static final Logger log = LoggerFactory.getLogger(RollingTimeSeriesScanner.class);

    // Above this many groups the per-group scans are spread over the common pool.
    private static final int PARALLEL_GROUP_THRESHOLD = 2_000;

    private final StatusClassifier classifier;

    public RollingTimeSeriesScanner(StatusClassifier classifier) {
        this.classifier = classifier;
    }

    public List<RollingAnomalyRecord> scan(AggregatedFrame frame, int window, ClassifierParams params) {
        if (window < 1) {
            throw new IllegalArgumentException("Rolling window must be at least 1, got " + window);
        }
        if (frame.isEmpty()) {
            log.info("Rolling scan: no groups to scan");
            return List.of();
        }

        Stream<DimensionGroup> groups = frame.getGroups().size() > PARALLEL_GROUP_THRESHOLD
                ? frame.getGroups().parallelStream()
                : frame.getGroups().stream();

        List<RollingAnomalyRecord> anomalies = groups
                .flatMap(group -> scanGroup(frame, group, window, params).stream())
                .collect(Collectors.toList());

        log.info("Rolling scan (window={}): {} groups, {} observations, {} anomalies",
                window, frame.getGroups().size(), frame.observationCount(), anomalies.size());
        return anomalies;
    }

    List<RollingAnomalyRecord> scanGroup(AggregatedFrame frame, DimensionGroup group, int window,
                                         ClassifierParams params) {
        int minPeriods = Math.max(1, window - 1);
        int minCount = window - 1;
        RollingWindow history = new RollingWindow(window);
        List<RollingAnomalyRecord> found = new ArrayList<>();

        for (Observation obs : group.getObservations()) {
            Baseline baseline = history.baseline(minPeriods);
            ClassificationResult result = classifier.classifyBaseline(obs.getValue(), baseline, minCount, params);
            history.add(obs.getValue());

            AnomalyStatus status = result.getStatus();
            if (status == AnomalyStatus.NORMAL || status == AnomalyStatus.NOT_ENOUGH_DATA) {
                continue;
            }
            found.add(RollingAnomalyRecord.builder()
                    .key(group.getKey())
                    .dimensions(frame.describe(group.getKey()))
                    .period(obs.getPeriod())
                    .value(obs.getValue())
                    .status(status)
                    .rollingMean(baseline.getMean())
                    .rollingCount(baseline.getCount())
                    .comparedWith(String.format(Locale.US, "Avg Past %d: %,.2f (Count: %d)",
                            window, baseline.getMean(), baseline.getCount()))
                    .build());
        }
        return found;
    }
}

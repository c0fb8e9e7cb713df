package com.finance.audit.engine.scanners;

import com.finance.audit.engine.ClassifierParams;
import com.finance.audit.engine.StatusClassifier;
import com.finance.audit.model.AggregatedFrame;
import com.finance.audit.model.AnomalyMap;
import com.finance.audit.model.AnomalyStatus;
import com.finance.audit.model.ClassificationResult;
import com.finance.audit.model.DimensionKey;
import com.finance.audit.model.LatestPeriodReportResult;
import com.finance.audit.model.Period;
import com.finance.audit.model.PivotTable;
import com.finance.audit.model.RowSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Crosstab report of the most recent period.
 *
 * Every cell of the pivot is classified against the strictly earlier cells of its
 * row (the first period therefore has no history). The row status is the
 * classification of the last cell, i.e. the latest period against the full
 * history of the row, not a trailing window.
 *
 * Cells classified NORMAL or NEW_ITEM are left out of the cell map; the pivot
 * must already hold 0 for absent (dimension, period) combinations.
 */
@Component
public class LatestPeriodReport {

    private static final Logger log = LoggerFactory.getLogger(LatestPeriodReport.class);

    private static final Set<AnomalyStatus> UNMARKED_CELLS = EnumSet.of(AnomalyStatus.NORMAL, AnomalyStatus.NEW_ITEM);

    private final StatusClassifier classifier;

    public LatestPeriodReport(StatusClassifier classifier) {
        this.classifier = classifier;
    }

    public LatestPeriodReportResult build(AggregatedFrame frame, ClassifierParams params) {
        return build(PivotTable.from(frame), params);
    }

    public LatestPeriodReportResult build(PivotTable pivot, int minHistory) {
        return build(pivot, ClassifierParams.builder().minHistory(minHistory).build());
    }

    public LatestPeriodReportResult build(PivotTable pivot, ClassifierParams params) {
        if (pivot.isEmpty()) {
            log.debug("Latest-period report skipped: pivot has no rows or no periods");
            return LatestPeriodReportResult.empty(pivot.getDimensionColumns());
        }

        List<Period> periods = pivot.getPeriods();
        AnomalyMap.Builder cells = AnomalyMap.builder(UNMARKED_CELLS);
        List<RowSummary> summaries = new ArrayList<>(pivot.rowCount());

        for (int r = 0; r < pivot.rowCount(); r++) {
            DimensionKey key = pivot.getKeys().get(r);
            double[] row = pivot.row(r);

            ClassificationResult latest = null;
            for (int c = 0; c < row.length; c++) {
                ClassificationResult cell = classifier.classify(row[c], Arrays.copyOfRange(row, 0, c), params);
                cells.put(key, periods.get(c), cell);
                latest = cell;
            }
            summaries.add(summarize(pivot, key, row, latest));
        }

        AnomalyMap cellAnomalies = cells.build();
        log.info("Latest-period report: {} rows x {} periods (latest {}), {} flagged cells",
                pivot.rowCount(), periods.size(), periods.get(periods.size() - 1), cellAnomalies.size());

        return new LatestPeriodReportResult(pivot.getDimensionColumns(), periods,
                List.copyOf(summaries), cellAnomalies);
    }

    private RowSummary summarize(PivotTable pivot, DimensionKey key, double[] row, ClassificationResult latest) {
        Map<Period, Double> values = new LinkedHashMap<>();
        for (int c = 0; c < row.length; c++) {
            values.put(pivot.getPeriods().get(c), row[c]);
        }

        Map<String, String> dimensions = new LinkedHashMap<>();
        List<String> columns = pivot.getDimensionColumns();
        for (int i = 0; i < columns.size() && i < key.size(); i++) {
            dimensions.put(columns.get(i), key.get(i));
        }

        double mean = latest.getBaselineMean();
        double pctChange = mean != 0 ? (latest.getCurrentValue() - mean) / mean * 100.0 : 0.0;

        return RowSummary.builder()
                .key(key)
                .dimensions(dimensions)
                .values(values)
                .status(latest.getStatus())
                .latestValue(latest.getCurrentValue())
                .baselineMean(mean)
                .pctChange(pctChange)
                .build();
    }
}

package com.finance.audit.model;

import lombok.Value;

import java.util.List;

@Value
public class LatestPeriodReportResult {

    List<String> dimensionColumns;
    List<Period> periods;
    List<RowSummary> rowSummaries;
    AnomalyMap cellAnomalies;

    public static LatestPeriodReportResult empty(List<String> dimensionColumns) {
        return new LatestPeriodReportResult(List.copyOf(dimensionColumns), List.of(), List.of(), AnomalyMap.empty());
    }

    public boolean isEmpty() {
        return rowSummaries.isEmpty();
    }
}

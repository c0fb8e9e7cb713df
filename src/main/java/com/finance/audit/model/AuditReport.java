package com.finance.audit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Combined output of one audit run, handed to the report rendering collaborator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditReport {

    private int totalRows;

    private LatestPeriodReportResult crosstab;

    @Builder.Default
    private List<RollingAnomalyRecord> timeSeriesAnomalies = new ArrayList<>();

    @Builder.Default
    private List<PeerOutlierRecord> peerOutliers = new ArrayList<>();

    // Scanners abandoned by the run timeout or failed
    @Builder.Default
    private List<String> incompleteScans = new ArrayList<>();

    private long generatedAt;

    public boolean isComplete() {
        return incompleteScans.isEmpty();
    }
}

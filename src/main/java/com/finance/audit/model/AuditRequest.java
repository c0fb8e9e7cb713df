package com.finance.audit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Column mapping and scanner toggles for one audit run.
 * Empty time-series or peer dimension lists fall back to the crosstab dimensions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditRequest {

    private String periodColumn;

    private String valueColumn;

    @Builder.Default
    private List<String> crosstabDimensions = new ArrayList<>();

    @Builder.Default
    private List<String> timeSeriesDimensions = new ArrayList<>();

    @Builder.Default
    private List<String> peerGroupDimensions = new ArrayList<>();

    // Line item identifier carried on peer records, e.g. the cost centre
    private String peerItemColumn;

    @Builder.Default
    private boolean runCrosstabReport = true;

    @Builder.Default
    private boolean runTimeSeries = true;

    @Builder.Default
    private boolean runPeerGroup = true;

    public List<String> effectiveTimeSeriesDimensions() {
        return timeSeriesDimensions == null || timeSeriesDimensions.isEmpty()
                ? crosstabDimensions : timeSeriesDimensions;
    }

    public List<String> effectivePeerGroupDimensions() {
        return peerGroupDimensions == null || peerGroupDimensions.isEmpty()
                ? crosstabDimensions : peerGroupDimensions;
    }

    /**
     * Every column the enabled scanners read.
     */
    public List<String> requiredColumns() {
        Set<String> required = new LinkedHashSet<>();
        required.add(periodColumn);
        required.add(valueColumn);
        if (runCrosstabReport) {
            required.addAll(crosstabDimensions);
        }
        if (runTimeSeries) {
            required.addAll(effectiveTimeSeriesDimensions());
        }
        if (runPeerGroup) {
            required.addAll(effectivePeerGroupDimensions());
            if (peerItemColumn != null) {
                required.add(peerItemColumn);
            }
        }
        return new ArrayList<>(required);
    }
}

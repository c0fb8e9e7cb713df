package com.finance.audit.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A line item flagged as a cross-sectional outlier among its same-period peers.
 */
@Value
@Builder
public class PeerOutlierRecord {

    // Original input row, unchanged
    Map<String, Object> fields;

    Period period;

    String peerGroup;

    // Line item identifier, null when no item column was configured
    String itemId;

    double value;

    double zScore;

    double groupMean;

    AnomalyStatus status;

    String comparedWith;
}

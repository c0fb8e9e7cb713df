package com.finance.audit.model;

import lombok.Value;

import java.util.List;

@Value
public class PeerScanResult {

    List<PeerOutlierRecord> outliers;
    List<SkippedPeerBatch> skipped;

    // False when a deadline stopped the scan before every batch was scored
    boolean complete;

    public static PeerScanResult empty() {
        return new PeerScanResult(List.of(), List.of(), true);
    }
}

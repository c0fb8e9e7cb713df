package com.finance.audit.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Run parameters of the cross-sectional peer-group scan.
 */
@Value
@Builder
public class PeerScanParams {

    @Builder.Default
    double contamination = 0.05;

    /** Slack on the z cutoff so values that equal it in exact arithmetic are not lost to rounding. */
    public static final double Z_SCORE_TOLERANCE = 1e-9;

    // Confirmation threshold, inclusive within Z_SCORE_TOLERANCE: |z| >= zScoreThreshold - Z_SCORE_TOLERANCE
    @Builder.Default
    double zScoreThreshold = 2.0;

    @Builder.Default
    int minBatchSize = 5;

    @Builder.Default
    long seed = 42L;

    public static PeerScanParams defaults() {
        return PeerScanParams.builder().build();
    }
}

package com.finance.audit.model;

import lombok.Value;

/**
 * A peer batch that was not scored. Skips are never fatal to the scan.
 */
@Value
public class SkippedPeerBatch {

    public enum Reason { UNDERSIZED, MALFORMED_KEY, DETECTOR_FAILURE, DEADLINE }

    Period period;
    String peerGroup;
    Reason reason;
    int size;
}

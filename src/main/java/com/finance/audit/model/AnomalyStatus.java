package com.finance.audit.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed status vocabulary. The enum names are the stable strings consumed by
 * downstream report rendering.
 */
public enum AnomalyStatus {
    NORMAL("Within expected range"),
    NEGATIVE_VALUE("Negative posting"),
    NEW_ITEM("New line item with insufficient history"),
    NOT_ENOUGH_DATA("Insufficient history"),
    HIGH_SPIKE("Unusually high compared to history"),
    LOW_SPIKE("Unusually low compared to history"),
    SPIKE_VS_CONSTANT("Deviation from a constant history"),
    PEER_HIGH_OUTLIER("High outlier vs peers"),
    PEER_LOW_OUTLIER("Low outlier vs peers");

    private static final Set<AnomalyStatus> CRITICAL =
            EnumSet.of(HIGH_SPIKE, LOW_SPIKE, NEGATIVE_VALUE);

    private final String description;

    AnomalyStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Statuses kept in the time-series log when only critical findings are reported.
     */
    public boolean isCritical() {
        return CRITICAL.contains(this);
    }
}

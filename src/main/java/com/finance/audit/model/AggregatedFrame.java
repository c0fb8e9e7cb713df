package com.finance.audit.model;

import lombok.Value;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only aggregated view shared by all scanners: one value per
 * (dimension key, period), groups sorted by key, periods sorted ascending.
 */
@Value
public class AggregatedFrame {

    List<String> dimensionColumns;
    List<DimensionGroup> groups;
    List<Period> periods;

    public AggregatedFrame(List<String> dimensionColumns, List<DimensionGroup> groups, List<Period> periods) {
        Set<Period> known = new HashSet<>(periods);
        for (DimensionGroup group : groups) {
            for (Observation obs : group.getObservations()) {
                if (!known.contains(obs.getPeriod())) {
                    throw new IllegalArgumentException("Observation of " + group.getKey()
                            + " at " + obs.getPeriod() + " is outside the frame's periods");
                }
            }
        }
        this.dimensionColumns = List.copyOf(dimensionColumns);
        this.groups = List.copyOf(groups);
        this.periods = List.copyOf(periods);
    }

    public static AggregatedFrame empty(List<String> dimensionColumns) {
        return new AggregatedFrame(dimensionColumns, List.of(), List.of());
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    public int observationCount() {
        int count = 0;
        for (DimensionGroup group : groups) {
            count += group.size();
        }
        return count;
    }

    /**
     * Dimension column name to value, in column order.
     */
    public Map<String, String> describe(DimensionKey key) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 0; i < dimensionColumns.size() && i < key.size(); i++) {
            fields.put(dimensionColumns.get(i), key.get(i));
        }
        return fields;
    }
}

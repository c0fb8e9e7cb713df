package com.finance.audit.model;

import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Sparse map of flagged cells, keyed by (row key, period). Normal cells are never stored.
 */
@EqualsAndHashCode
public final class AnomalyMap {

    private final Map<CellRef, ClassificationResult> cells;

    private AnomalyMap(Map<CellRef, ClassificationResult> cells) {
        this.cells = Collections.unmodifiableMap(cells);
    }

    public static AnomalyMap empty() {
        return new AnomalyMap(new LinkedHashMap<>());
    }

    public static Builder builder(Set<AnomalyStatus> excluded) {
        return new Builder(excluded);
    }

    public ClassificationResult get(DimensionKey rowKey, Period period) {
        return cells.get(new CellRef(rowKey, period));
    }

    public AnomalyStatus statusAt(DimensionKey rowKey, Period period) {
        ClassificationResult result = get(rowKey, period);
        return result == null ? AnomalyStatus.NORMAL : result.getStatus();
    }

    public Map<CellRef, ClassificationResult> asMap() {
        return cells;
    }

    public int size() {
        return cells.size();
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    public static final class Builder {

        private final Set<AnomalyStatus> excluded;
        private final Map<CellRef, ClassificationResult> cells = new LinkedHashMap<>();

        private Builder(Set<AnomalyStatus> excluded) {
            this.excluded = excluded.isEmpty() ? EnumSet.noneOf(AnomalyStatus.class) : EnumSet.copyOf(excluded);
            this.excluded.add(AnomalyStatus.NORMAL);
        }

        public Builder put(DimensionKey rowKey, Period period, ClassificationResult result) {
            if (!excluded.contains(result.getStatus())) {
                cells.put(new CellRef(rowKey, period), result);
            }
            return this;
        }

        public AnomalyMap build() {
            return new AnomalyMap(new LinkedHashMap<>(cells));
        }
    }
}

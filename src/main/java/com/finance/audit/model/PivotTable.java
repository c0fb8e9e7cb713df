package com.finance.audit.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Wide view of an aggregated frame: one row per dimension key, one column per
 * period. Absent (key, period) combinations hold 0.
 */
public final class PivotTable {

    private final List<String> dimensionColumns;
    private final List<DimensionKey> keys;
    private final List<Period> periods;
    private final double[][] values;

    private PivotTable(List<String> dimensionColumns, List<DimensionKey> keys,
                       List<Period> periods, double[][] values) {
        this.dimensionColumns = dimensionColumns;
        this.keys = keys;
        this.periods = periods;
        this.values = values;
    }

    public static PivotTable of(List<String> dimensionColumns, List<DimensionKey> keys,
                                List<Period> periods, double[][] values) {
        if (keys.size() != values.length) {
            throw new IllegalArgumentException("Expected " + keys.size() + " rows but got " + values.length);
        }
        for (int i = 1; i < periods.size(); i++) {
            if (periods.get(i - 1).compareTo(periods.get(i)) >= 0) {
                throw new IllegalArgumentException("Period columns must be unique and ascending");
            }
        }
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            if (values[i].length != periods.size()) {
                throw new IllegalArgumentException("Row " + keys.get(i) + " has " + values[i].length
                        + " cells, expected " + periods.size());
            }
            copy[i] = Arrays.copyOf(values[i], values[i].length);
        }
        return new PivotTable(List.copyOf(dimensionColumns), List.copyOf(keys), List.copyOf(periods), copy);
    }

    public static PivotTable from(AggregatedFrame frame) {
        List<Period> periods = frame.getPeriods();
        List<DimensionKey> keys = new ArrayList<>(frame.getGroups().size());
        double[][] values = new double[frame.getGroups().size()][periods.size()];

        int row = 0;
        for (DimensionGroup group : frame.getGroups()) {
            keys.add(group.getKey());
            // both sides are sorted, so a single merge pass places every observation
            int col = 0;
            for (Observation obs : group.getObservations()) {
                while (!periods.get(col).equals(obs.getPeriod())) {
                    col++;
                }
                values[row][col] = obs.getValue();
            }
            row++;
        }
        return new PivotTable(frame.getDimensionColumns(), List.copyOf(keys), periods, values);
    }

    public List<String> getDimensionColumns() {
        return dimensionColumns;
    }

    public List<DimensionKey> getKeys() {
        return keys;
    }

    public List<Period> getPeriods() {
        return periods;
    }

    public int rowCount() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty() || periods.isEmpty();
    }

    public double[] row(int row) {
        return Arrays.copyOf(values[row], values[row].length);
    }
}

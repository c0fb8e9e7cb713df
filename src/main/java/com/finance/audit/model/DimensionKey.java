package com.finance.audit.model;

import lombok.Value;

import java.util.List;

/**
 * Ordered tuple of dimension values identifying one logical series.
 * Ordered value by value; a shorter key sorts before a longer one sharing its prefix.
 * The pipe-joined form is for display only.
 */
@Value
public class DimensionKey implements Comparable<DimensionKey> {

    public static final String MISSING_VALUE = "N/A";

    List<String> values;

    public DimensionKey(List<String> values) {
        this.values = List.copyOf(values);
    }

    public static DimensionKey of(String... values) {
        return new DimensionKey(List.of(values));
    }

    public String joined() {
        return String.join("|", values);
    }

    public int size() {
        return values.size();
    }

    public String get(int index) {
        return values.get(index);
    }

    @Override
    public int compareTo(DimensionKey other) {
        int common = Math.min(values.size(), other.values.size());
        for (int i = 0; i < common; i++) {
            int cmp = values.get(i).compareTo(other.values.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(values.size(), other.values.size());
    }

    @Override
    public String toString() {
        return joined();
    }
}

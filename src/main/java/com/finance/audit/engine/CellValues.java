package com.finance.audit.engine;

import com.finance.audit.model.DimensionKey;
import com.finance.audit.model.Period;

import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Map;

/**
 * Coercion of raw table cells into the types the engine works with.
 */
public final class CellValues {

    private CellValues() {}

    /**
     * Numeric cell value. Numbers are taken as they are; strings must already be
     * plain decimal numbers (currency cleanup happens upstream).
     */
    public static double toDouble(Object raw, String column, int rowIndex) {
        double value;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else if (raw instanceof String text) {
            try {
                value = Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new InputShapeException(String.format(
                        "Row %d: column '%s' is not numeric: '%s'", rowIndex, column, text), e);
            }
        } else {
            throw new InputShapeException(String.format(
                    "Row %d: column '%s' is not numeric: %s", rowIndex, column, raw));
        }
        if (!Double.isFinite(value)) {
            throw new InputShapeException(String.format(
                    "Row %d: column '%s' is not a finite number: %s", rowIndex, column, raw));
        }
        return value;
    }

    public static Period toPeriod(Object raw, String column, int rowIndex) {
        try {
            return Period.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new InputShapeException(String.format(
                    "Row %d: column '%s' is not a period: %s", rowIndex, column, e.getMessage()), e);
        }
    }

    /**
     * Dimension value as a string; null becomes {@link DimensionKey#MISSING_VALUE}.
     *
     * @throws IllegalArgumentException for values with no scalar string form
     *                                  (collections, maps, arrays)
     */
    public static String toDimension(Object raw) {
        if (raw == null) {
            return DimensionKey.MISSING_VALUE;
        }
        if (raw instanceof CharSequence || raw instanceof Number || raw instanceof Boolean
                || raw instanceof Character || raw instanceof Enum<?> || raw instanceof TemporalAccessor) {
            return raw.toString();
        }
        throw new IllegalArgumentException("Not a scalar dimension value: " + raw.getClass().getSimpleName());
    }

    public static DimensionKey toKey(Map<String, Object> row, List<String> dimensionColumns) {
        String[] values = new String[dimensionColumns.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = toDimension(row.get(dimensionColumns.get(i)));
        }
        return DimensionKey.of(values);
    }
}

package com.finance.audit.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Row-oriented long-format input table, already cleaned by the upstream loader.
 * Rows are column-name to cell-value maps; cells may be null.
 */
public final class LedgerTable {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    private LedgerTable(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public static LedgerTable of(List<String> columns, List<? extends Map<String, ?>> rows) {
        List<Map<String, Object>> copies = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            copies.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        return new LedgerTable(List.copyOf(columns), Collections.unmodifiableList(copies));
    }

    /**
     * Builds a table whose columns are the union of the row keys, in first-seen order.
     */
    public static LedgerTable fromRows(List<? extends Map<String, ?>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, ?> row : rows) {
            columns.addAll(row.keySet());
        }
        return of(new ArrayList<>(columns), rows);
    }

    public static LedgerTable empty(List<String> columns) {
        return new LedgerTable(List.copyOf(columns), List.of());
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Required columns absent from this table, in the order requested.
     */
    public List<String> missingColumns(Collection<String> required) {
        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (column != null && !columns.contains(column) && !missing.contains(column)) {
                missing.add(column);
            }
        }
        return missing;
    }
}

package com.finance.audit.service;

import com.finance.audit.engine.CellValues;
import com.finance.audit.engine.InputShapeException;
import com.finance.audit.model.AggregatedFrame;
import com.finance.audit.model.DimensionGroup;
import com.finance.audit.model.DimensionKey;
import com.finance.audit.model.LedgerTable;
import com.finance.audit.model.Observation;
import com.finance.audit.model.Period;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Validates a long-format ledger and sums it to one value per
 * (dimension key, period). Values are summed, never averaged, so split postings
 * of the same line item in one month count as the month's net amount.
 */
@Service
public class ObservationAggregator {

    private static final Logger log = LoggerFactory.getLogger(ObservationAggregator.class);

    /**
     * Check that the table has every column in {@code required}.
     *
     * @throws InputShapeException naming every missing column
     */
    public void requireColumns(LedgerTable table, List<String> required) {
        List<String> missing = table.missingColumns(required);
        if (!missing.isEmpty()) {
            throw InputShapeException.missingColumns(missing);
        }
    }

    public AggregatedFrame aggregate(LedgerTable table, List<String> dimensionColumns,
                                     String periodColumn, String valueColumn) {
        if (dimensionColumns == null || dimensionColumns.isEmpty()) {
            throw new InputShapeException("At least one dimension column is required");
        }
        List<String> required = new ArrayList<>(dimensionColumns);
        required.add(periodColumn);
        required.add(valueColumn);
        requireColumns(table, required);

        if (table.isEmpty()) {
            log.info("Ledger is empty; nothing to aggregate");
            return AggregatedFrame.empty(dimensionColumns);
        }

        Map<DimensionKey, TreeMap<Period, Double>> sums = new TreeMap<>();
        TreeSet<Period> periods = new TreeSet<>();

        List<Map<String, Object>> rows = table.getRows();
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            DimensionKey key;
            try {
                key = CellValues.toKey(row, dimensionColumns);
            } catch (IllegalArgumentException e) {
                throw new InputShapeException(String.format("Row %d: %s", i, e.getMessage()), e);
            }
            Period period = CellValues.toPeriod(row.get(periodColumn), periodColumn, i);
            double value = CellValues.toDouble(row.get(valueColumn), valueColumn, i);

            sums.computeIfAbsent(key, k -> new TreeMap<>()).merge(period, value, Double::sum);
            periods.add(period);
        }

        List<DimensionGroup> groups = new ArrayList<>(sums.size());
        for (Map.Entry<DimensionKey, TreeMap<Period, Double>> entry : sums.entrySet()) {
            List<Observation> observations = new ArrayList<>(entry.getValue().size());
            for (Map.Entry<Period, Double> cell : entry.getValue().entrySet()) {
                observations.add(new Observation(entry.getKey(), cell.getKey(), cell.getValue()));
            }
            groups.add(new DimensionGroup(entry.getKey(), observations));
        }

        log.info("Aggregated {} rows into {} groups over {} periods ({} .. {})",
                rows.size(), groups.size(), periods.size(), periods.first(), periods.last());
        return new AggregatedFrame(dimensionColumns, groups, new ArrayList<>(periods));
    }
}

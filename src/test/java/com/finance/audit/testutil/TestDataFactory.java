package com.finance.audit.testutil;

import com.finance.audit.model.AggregatedFrame;
import com.finance.audit.model.DimensionGroup;
import com.finance.audit.model.DimensionKey;
import com.finance.audit.model.LedgerTable;
import com.finance.audit.model.Observation;
import com.finance.audit.model.Period;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final String GROUP = "GROUP";
    public static final String GL_CODE = "GL_CODE";
    public static final String COST_CENTER = "COST_CENTER";
    public static final String PERIOD = "PERIOD";
    public static final String VALUE = "VALUE";

    public static final List<String> LEDGER_COLUMNS = List.of(GROUP, GL_CODE, COST_CENTER, PERIOD, VALUE);

    private TestDataFactory() {}

    /**
     * A series with sequential periods 1..n.
     */
    public static DimensionGroup series(DimensionKey key, double... values) {
        List<Observation> observations = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            observations.add(new Observation(key, Period.sequential(i + 1), values[i]));
        }
        return new DimensionGroup(key, observations);
    }

    public static AggregatedFrame frame(List<String> dimensionColumns, DimensionGroup... groups) {
        TreeSet<Period> periods = new TreeSet<>();
        for (DimensionGroup group : groups) {
            group.getObservations().forEach(obs -> periods.add(obs.getPeriod()));
        }
        return new AggregatedFrame(dimensionColumns, Arrays.asList(groups), new ArrayList<>(periods));
    }

    public static Map<String, Object> posting(Object group, Object glCode, Object costCenter,
                                              Object period, Object value) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(GROUP, group);
        row.put(GL_CODE, glCode);
        row.put(COST_CENTER, costCenter);
        row.put(PERIOD, period);
        row.put(VALUE, value);
        return row;
    }

    /**
     * One period's peer batch: cost centres CC-1..CC-n of OPEX/5100, one posting each.
     */
    public static List<Map<String, Object>> peerBatch(String period, double... values) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            rows.add(posting("OPEX", "5100", "CC-" + (i + 1), period, values[i]));
        }
        return rows;
    }

    /**
     * Six months of OPEX/5100 over five cost centres at 100 each, with a -50
     * reversal at CC-3 in 2024-04 and a 1000 posting at CC-5 in 2024-06.
     */
    public static LedgerTable expenseLedger() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int month = 1; month <= 6; month++) {
            String period = String.format("2024-%02d", month);
            for (int cc = 1; cc <= 5; cc++) {
                double value = 100.0;
                if (month == 4 && cc == 3) value = -50.0;
                if (month == 6 && cc == 5) value = 1000.0;
                rows.add(posting("OPEX", "5100", "CC-" + cc, period, value));
            }
        }
        return LedgerTable.of(LEDGER_COLUMNS, rows);
    }
}

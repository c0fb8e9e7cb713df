package com.finance.audit.seeder;

import com.finance.audit.model.AnomalyStatus;
import com.finance.audit.model.AuditReport;
import com.finance.audit.model.AuditRequest;
import com.finance.audit.model.LedgerTable;
import com.finance.audit.model.PeerOutlierRecord;
import com.finance.audit.model.RollingAnomalyRecord;
import com.finance.audit.model.RowSummary;
import com.finance.audit.service.AuditService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Builds a synthetic expense ledger and audits it, so the scanners can be tried
 * without a real export. Only runs when the "sample" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=sample
 *
 * Ledger: 3 expense groups x 4 GL codes x 6 cost centres x 12 months, amounts
 * drifting around a per-line base. Injected in the last months:
 *   - spikes (x4) and drops (x0.2) on a handful of lines
 *   - negative postings (reversals larger than the month's spend)
 *   - one line item that only starts in the final two months
 */
@Component
@Profile("sample")
public class SampleLedgerSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(SampleLedgerSeeder.class);

    static final String GROUP = "EXPENSE_GROUP";
    static final String GL_CODE = "GL_CODE";
    static final String COST_CENTER = "COST_CENTER";
    static final String PERIOD = "PERIOD";
    static final String VALUE = "EXPENSE_VALUE";

    private static final String[] GROUPS = {"OPEX", "COGS", "SGA"};
    private static final int GL_CODES_PER_GROUP = 4;
    private static final int COST_CENTERS = 6;
    private static final int MONTHS = 12;
    private static final YearMonth FIRST_MONTH = YearMonth.of(2024, 1);

    private final AuditService auditService;
    private final Random random = new Random(42); // fixed seed for reproducibility

    public SampleLedgerSeeder(AuditService auditService) {
        this.auditService = auditService;
    }

    @Override
    public void run(String... args) {
        log.info("=== Building sample ledger ===");
        LedgerTable ledger = buildLedger();
        log.info("Sample ledger: {} postings", ledger.size());

        AuditRequest request = AuditRequest.builder()
                .periodColumn(PERIOD)
                .valueColumn(VALUE)
                .crosstabDimensions(List.of(GROUP, GL_CODE))
                .timeSeriesDimensions(List.of(GROUP, GL_CODE, COST_CENTER))
                .peerGroupDimensions(List.of(GROUP, GL_CODE))
                .peerItemColumn(COST_CENTER)
                .build();

        AuditReport report = auditService.run(ledger, request);
        logSummary(report);
        log.info("=== Sample audit complete ===");
    }

    LedgerTable buildLedger() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (String group : GROUPS) {
            for (int g = 1; g <= GL_CODES_PER_GROUP; g++) {
                String glCode = String.format("%s-%d%03d", group, 5, g * 10);
                for (int c = 1; c <= COST_CENTERS; c++) {
                    String costCenter = String.format("CC-%02d", c);
                    double base = 10_000 + random.nextInt(190_000);
                    for (int m = 0; m < MONTHS; m++) {
                        double amount = base * (1 + random.nextGaussian() * 0.04);
                        amount = inject(amount, base, group, g, c, m);
                        rows.add(posting(group, glCode, costCenter, FIRST_MONTH.plusMonths(m), amount));
                    }
                }
            }
        }

        // a line item that only appears at the end of the year
        for (int m = MONTHS - 2; m < MONTHS; m++) {
            rows.add(posting("OPEX", "OPEX-5990", "CC-99", FIRST_MONTH.plusMonths(m), 45_000));
        }
        return LedgerTable.of(List.of(GROUP, GL_CODE, COST_CENTER, PERIOD, VALUE), rows);
    }

    private double inject(double amount, double base, String group, int glIndex, int costCenter, int month) {
        boolean lastMonth = month == MONTHS - 1;
        if (lastMonth && glIndex == 1 && costCenter == 2) {
            return base * 4; // spike
        }
        if (lastMonth && glIndex == 3 && costCenter == 5) {
            return base * 0.2; // drop
        }
        if (month == MONTHS - 4 && "COGS".equals(group) && glIndex == 2 && costCenter == 1) {
            return -base * 0.5; // reversal larger than the month's spend
        }
        return Math.round(amount * 100) / 100.0;
    }

    private static Map<String, Object> posting(String group, String glCode, String costCenter,
                                               YearMonth month, double amount) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(GROUP, group);
        row.put(GL_CODE, glCode);
        row.put(COST_CENTER, costCenter);
        row.put(PERIOD, month.toString());
        row.put(VALUE, amount);
        return row;
    }

    private void logSummary(AuditReport report) {
        Map<AnomalyStatus, Integer> crosstab = new EnumMap<>(AnomalyStatus.class);
        for (RowSummary row : report.getCrosstab().getRowSummaries()) {
            crosstab.merge(row.getStatus(), 1, Integer::sum);
        }
        log.info("Crosstab ({} rows): {}", report.getCrosstab().getRowSummaries().size(), crosstab);

        log.info("Time-series anomalies: {}", report.getTimeSeriesAnomalies().size());
        for (RollingAnomalyRecord record : report.getTimeSeriesAnomalies()) {
            log.info("  {} {} {}: {} value={} ({})", record.getKey(), record.getPeriod(), record.getStatus(),
                    record.getStatus().getDescription(), String.format("%,.2f", record.getValue()),
                    record.getComparedWith());
        }

        log.info("Peer outliers: {}", report.getPeerOutliers().size());
        for (PeerOutlierRecord record : report.getPeerOutliers()) {
            log.info("  {} {} item={} {} ({})", record.getPeriod(), record.getPeerGroup(), record.getItemId(),
                    record.getStatus(), record.getComparedWith());
        }

        if (!report.isComplete()) {
            log.warn("Incomplete scans: {}", report.getIncompleteScans());
        }
    }
}

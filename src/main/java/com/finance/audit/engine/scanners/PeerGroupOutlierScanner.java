package com.finance.audit.engine.scanners;

import com.finance.audit.engine.CellValues;
import com.finance.audit.engine.DescriptiveStats;
import com.finance.audit.engine.InputShapeException;
import com.finance.audit.engine.PeerScanParams;
import com.finance.audit.engine.isolationforest.OutlierDetector;
import com.finance.audit.model.AnomalyStatus;
import com.finance.audit.model.DimensionKey;
import com.finance.audit.model.LedgerTable;
import com.finance.audit.model.Period;
import com.finance.audit.model.PeerOutlierRecord;
import com.finance.audit.model.PeerScanResult;
import com.finance.audit.model.SkippedPeerBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Cross-sectional outlier scan: within each period, line items are compared with
 * the other items of their peer group rather than with their own history.
 *
 * For every (period, peer group) batch of at least {@code minBatchSize} rows the
 * {@link OutlierDetector} votes on the value column, and each candidate must be
 * confirmed by a population z-score with |z| >= zScoreThreshold against the batch.
 * Confirmed items become PEER_HIGH_OUTLIER (z > 0) or PEER_LOW_OUTLIER.
 *
 * Rows are raw line items, not aggregates. Undersized batches, rows whose peer key
 * cannot be formed and batches the detector fails on are skipped and reported in
 * the result; the rest of the scan continues.
 */
@Component
public class PeerGroupOutlierScanner {

    private static final Logger log = LoggerFactory.getLogger(PeerGroupOutlierScanner.class);

    static final String ALL_PEERS = "ALL";

    private final OutlierDetector detector;
    private final Clock clock;

    @Autowired
    public PeerGroupOutlierScanner(OutlierDetector detector) {
        this(detector, Clock.systemUTC());
    }

    PeerGroupOutlierScanner(OutlierDetector detector, Clock clock) {
        this.detector = detector;
        this.clock = clock;
    }

    public PeerScanResult scan(LedgerTable table, String periodColumn, String valueColumn,
                               List<String> peerDimensions, PeerScanParams params) {
        return scan(table, periodColumn, valueColumn, peerDimensions, null, params, null);
    }

    /**
     * @param itemColumn optional line item column copied onto each record
     * @param deadline   optional; batches not started by then are skipped and the
     *                   result is marked incomplete, findings so far are kept
     */
    public PeerScanResult scan(LedgerTable table, String periodColumn, String valueColumn,
                               List<String> peerDimensions, String itemColumn,
                               PeerScanParams params, Instant deadline) {
        List<String> required = new ArrayList<>(peerDimensions);
        required.add(periodColumn);
        required.add(valueColumn);
        if (itemColumn != null) {
            required.add(itemColumn);
        }
        List<String> missing = table.missingColumns(required);
        if (!missing.isEmpty()) {
            throw InputShapeException.missingColumns(missing);
        }
        if (table.isEmpty()) {
            return PeerScanResult.empty();
        }

        List<Map<String, Object>> rows = table.getRows();
        double[] values = new double[rows.size()];
        Map<Period, PeriodBatches> byPeriod = new TreeMap<>();

        // structural checks for every row first, so a bad cell fails before any batch is scored
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            Period period = CellValues.toPeriod(row.get(periodColumn), periodColumn, i);
            values[i] = CellValues.toDouble(row.get(valueColumn), valueColumn, i);

            PeriodBatches batches = byPeriod.computeIfAbsent(period, p -> new PeriodBatches());
            try {
                batches.add(CellValues.toKey(row, peerDimensions), i);
            } catch (IllegalArgumentException e) {
                log.debug("Row {} has a malformed peer key: {}", i, e.getMessage());
                batches.malformed.add(i);
            }
        }

        List<PeerOutlierRecord> outliers = new ArrayList<>();
        List<SkippedPeerBatch> skipped = new ArrayList<>();
        boolean complete = true;

        for (Map.Entry<Period, PeriodBatches> periodEntry : byPeriod.entrySet()) {
            Period period = periodEntry.getKey();
            PeriodBatches batches = periodEntry.getValue();

            if (!batches.malformed.isEmpty()) {
                log.warn("Skipping {} row(s) in period {} whose peer key could not be formed",
                        batches.malformed.size(), period);
                skipped.add(new SkippedPeerBatch(period, null, SkippedPeerBatch.Reason.MALFORMED_KEY,
                        batches.malformed.size()));
            }

            for (Map.Entry<DimensionKey, List<Integer>> batch : batches.byKey.entrySet()) {
                String peerGroup = displayName(batch.getKey());
                List<Integer> members = batch.getValue();

                if (deadline != null && clock.instant().isAfter(deadline)) {
                    complete = false;
                    skipped.add(new SkippedPeerBatch(period, peerGroup, SkippedPeerBatch.Reason.DEADLINE,
                            members.size()));
                    continue;
                }
                if (members.size() < params.getMinBatchSize()) {
                    skipped.add(new SkippedPeerBatch(period, peerGroup, SkippedPeerBatch.Reason.UNDERSIZED,
                            members.size()));
                    continue;
                }

                try {
                    outliers.addAll(scoreBatch(rows, values, members, period, peerGroup, itemColumn, params));
                } catch (RuntimeException e) {
                    log.warn("Outlier detection failed for period {} group '{}', batch skipped: {}",
                            period, peerGroup, e.getMessage(), e);
                    skipped.add(new SkippedPeerBatch(period, peerGroup,
                            SkippedPeerBatch.Reason.DETECTOR_FAILURE, members.size()));
                }
            }
        }

        if (!complete) {
            log.warn("Peer scan stopped at deadline {}; {} outliers found before it", deadline, outliers.size());
        }
        log.info("Peer scan: {} periods, {} outliers, {} skipped batches",
                byPeriod.size(), outliers.size(), skipped.size());
        return new PeerScanResult(List.copyOf(outliers), List.copyOf(skipped), complete);
    }

    private List<PeerOutlierRecord> scoreBatch(List<Map<String, Object>> rows, double[] allValues,
                                               List<Integer> members, Period period, String peerGroup,
                                               String itemColumn, PeerScanParams params) {
        double[] batch = new double[members.size()];
        for (int j = 0; j < batch.length; j++) {
            batch[j] = allValues[members.get(j)];
        }

        boolean[] votes = detector.detect(batch, params.getContamination(), params.getSeed());
        double mean = DescriptiveStats.mean(batch);
        double std = DescriptiveStats.populationStd(batch, mean);

        List<PeerOutlierRecord> found = new ArrayList<>();
        for (int j = 0; j < batch.length; j++) {
            if (!votes[j]) {
                continue;
            }
            double z = std > 0 ? (batch[j] - mean) / std : 0.0;
            if (Math.abs(z) < params.getZScoreThreshold() - PeerScanParams.Z_SCORE_TOLERANCE) {
                continue;
            }
            Map<String, Object> row = rows.get(members.get(j));
            found.add(PeerOutlierRecord.builder()
                    .fields(row)
                    .period(period)
                    .peerGroup(peerGroup)
                    .itemId(itemColumn == null ? null : Objects.toString(row.get(itemColumn), DimensionKey.MISSING_VALUE))
                    .value(batch[j])
                    .zScore(z)
                    .groupMean(mean)
                    .status(z > 0 ? AnomalyStatus.PEER_HIGH_OUTLIER : AnomalyStatus.PEER_LOW_OUTLIER)
                    .comparedWith(String.format(Locale.US, "Group Avg: %,.2f (Z=%.2f)", mean, z))
                    .build());
        }
        return found;
    }

    private static String displayName(DimensionKey key) {
        return key.size() == 0 ? ALL_PEERS : key.joined();
    }

    private static final class PeriodBatches {
        private final Map<DimensionKey, List<Integer>> byKey = new TreeMap<>();
        private final List<Integer> malformed = new ArrayList<>();

        void add(DimensionKey key, int rowIndex) {
            byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(rowIndex);
        }
    }
}

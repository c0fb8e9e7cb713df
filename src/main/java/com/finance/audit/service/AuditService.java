package com.finance.audit.service;

import com.finance.audit.config.AuditThresholdConfig;
import com.finance.audit.config.MetricsConfig;
import com.finance.audit.engine.ClassifierParams;
import com.finance.audit.engine.InputShapeException;
import com.finance.audit.engine.scanners.LatestPeriodReport;
import com.finance.audit.engine.scanners.PeerGroupOutlierScanner;
import com.finance.audit.engine.scanners.RollingTimeSeriesScanner;
import com.finance.audit.model.AggregatedFrame;
import com.finance.audit.model.AuditReport;
import com.finance.audit.model.AuditRequest;
import com.finance.audit.model.LatestPeriodReportResult;
import com.finance.audit.model.LedgerTable;
import com.finance.audit.model.PeerOutlierRecord;
import com.finance.audit.model.PeerScanResult;
import com.finance.audit.model.RollingAnomalyRecord;
import com.finance.audit.model.RowSummary;
import com.finance.audit.model.SkippedPeerBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs one audit over a ledger table.
 *
 * Flow:
 * 1. Validate every column the enabled scanners read
 * 2. Aggregate the ledger once per distinct dimension list (crosstab, time series)
 * 3. Run the enabled scanners concurrently on the audit executor
 * 4. Collect results until the scan timeout; late scanners are marked incomplete
 * 5. Keep only critical time-series findings when configured
 *
 * Input shape problems surface as {@link InputShapeException} before any scanner
 * starts. A scanner that fails or times out does not discard the others' results.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    static final String CROSSTAB = "crosstab";
    static final String TIME_SERIES = "time-series";
    static final String PEER_GROUP = "peer-group";

    private final ObservationAggregator aggregator;
    private final LatestPeriodReport latestPeriodReport;
    private final RollingTimeSeriesScanner rollingScanner;
    private final PeerGroupOutlierScanner peerScanner;
    private final AuditThresholdConfig config;
    private final MetricsConfig metricsConfig;
    private final Executor auditExecutor;

    public AuditService(ObservationAggregator aggregator,
                        LatestPeriodReport latestPeriodReport,
                        RollingTimeSeriesScanner rollingScanner,
                        PeerGroupOutlierScanner peerScanner,
                        AuditThresholdConfig config,
                        MetricsConfig metricsConfig,
                        @Qualifier("auditExecutor") Executor auditExecutor) {
        this.aggregator = aggregator;
        this.latestPeriodReport = latestPeriodReport;
        this.rollingScanner = rollingScanner;
        this.peerScanner = peerScanner;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.auditExecutor = auditExecutor;
    }

    public AuditReport run(LedgerTable table, AuditRequest request) {
        if (request.getPeriodColumn() == null || request.getValueColumn() == null) {
            throw new InputShapeException("Both a period column and a value column must be mapped");
        }
        aggregator.requireColumns(table, request.requiredColumns());

        ClassifierParams params = config.toClassifierParams();
        Instant deadline = Instant.now().plus(config.getScanTimeout());

        // Aggregation coerces every cell, so bad values fail here rather than inside a scanner.
        AggregatedFrame crosstabFrame = null;
        AggregatedFrame timeSeriesFrame = null;
        if (request.isRunCrosstabReport()) {
            crosstabFrame = aggregate(table, request, request.getCrosstabDimensions());
        }
        if (request.isRunTimeSeries()) {
            List<String> dims = request.effectiveTimeSeriesDimensions();
            timeSeriesFrame = crosstabFrame != null && crosstabFrame.getDimensionColumns().equals(dims)
                    ? crosstabFrame
                    : aggregate(table, request, dims);
        }

        CompletableFuture<LatestPeriodReportResult> crosstabFuture = null;
        CompletableFuture<List<RollingAnomalyRecord>> timeSeriesFuture = null;
        CompletableFuture<PeerScanResult> peerFuture = null;

        if (crosstabFrame != null) {
            AggregatedFrame frame = crosstabFrame;
            crosstabFuture = submit(CROSSTAB, () -> latestPeriodReport.build(frame, params));
        }
        if (timeSeriesFrame != null) {
            AggregatedFrame frame = timeSeriesFrame;
            timeSeriesFuture = submit(TIME_SERIES, () -> rollingScanner.scan(frame, config.getWindow(), params));
        }
        if (request.isRunPeerGroup()) {
            peerFuture = submit(PEER_GROUP, () -> peerScanner.scan(table, request.getPeriodColumn(),
                    request.getValueColumn(), request.effectivePeerGroupDimensions(),
                    request.getPeerItemColumn(), config.toPeerScanParams(), deadline));
        }

        List<String> incomplete = new ArrayList<>();

        LatestPeriodReportResult crosstab = await(CROSSTAB, crosstabFuture, deadline, incomplete);
        if (crosstab == null) {
            crosstab = LatestPeriodReportResult.empty(request.getCrosstabDimensions());
        } else {
            crosstab.getRowSummaries().stream()
                    .map(RowSummary::getStatus)
                    .forEach(status -> metricsConfig.recordStatus(CROSSTAB, status));
        }

        List<RollingAnomalyRecord> timeSeries = await(TIME_SERIES, timeSeriesFuture, deadline, incomplete);
        if (timeSeries == null) {
            timeSeries = List.of();
        } else if (config.getTimeSeries().isCriticalOnly()) {
            timeSeries = timeSeries.stream()
                    .filter(record -> record.getStatus().isCritical())
                    .toList();
        }
        timeSeries.forEach(record -> metricsConfig.recordStatus(TIME_SERIES, record.getStatus()));

        List<PeerOutlierRecord> peerOutliers = List.of();
        PeerScanResult peerResult = await(PEER_GROUP, peerFuture, deadline, incomplete);
        if (peerResult != null) {
            peerOutliers = peerResult.getOutliers();
            peerOutliers.forEach(record -> metricsConfig.recordStatus(PEER_GROUP, record.getStatus()));
            for (SkippedPeerBatch skipped : peerResult.getSkipped()) {
                metricsConfig.recordPeerBatchSkipped(skipped.getReason().name());
            }
            if (!peerResult.isComplete()) {
                log.warn("Peer-group scan reached the scan timeout; keeping {} outliers found so far",
                        peerOutliers.size());
                markIncomplete(PEER_GROUP, incomplete);
            }
        }

        AuditReport report = AuditReport.builder()
                .totalRows(table.size())
                .crosstab(crosstab)
                .timeSeriesAnomalies(timeSeries)
                .peerOutliers(peerOutliers)
                .incompleteScans(incomplete)
                .generatedAt(System.currentTimeMillis())
                .build();

        log.info("Audit finished: rows={}, crosstabRows={}, timeSeriesAnomalies={}, peerOutliers={}, incomplete={}",
                report.getTotalRows(), crosstab.getRowSummaries().size(), timeSeries.size(),
                peerOutliers.size(), incomplete);
        return report;
    }

    private AggregatedFrame aggregate(LedgerTable table, AuditRequest request, List<String> dimensions) {
        return aggregator.aggregate(table, dimensions, request.getPeriodColumn(), request.getValueColumn());
    }

    private <T> CompletableFuture<T> submit(String scanner, Supplier<T> task) {
        return CompletableFuture.supplyAsync(() -> {
            long start = System.nanoTime();
            T result = task.get();
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metricsConfig.recordScan(scanner, elapsed, countFindings(result));
            log.debug("Scanner {} finished in {} ms", scanner, elapsed.toMillis());
            return result;
        }, auditExecutor);
    }

    /**
     * Wait for a scanner until the shared deadline. Returns null when the scanner was
     * not started, timed out or failed; the latter two are added to {@code incomplete}.
     */
    private <T> T await(String scanner, CompletableFuture<T> future, Instant deadline, List<String> incomplete) {
        if (future == null) {
            return null;
        }
        long remainingMs = Math.max(0L, Duration.between(Instant.now(), deadline).toMillis());
        try {
            return future.get(remainingMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Scanner {} did not finish within {}; its results are dropped", scanner, config.getScanTimeout());
            markIncomplete(scanner, incomplete);
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Interrupted while waiting for scanner {}", scanner);
            markIncomplete(scanner, incomplete);
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InputShapeException shapeError) {
                throw shapeError;
            }
            log.error("Scanner {} failed: {}", scanner, cause.getMessage(), cause);
            markIncomplete(scanner, incomplete);
            return null;
        }
    }

    private void markIncomplete(String scanner, List<String> incomplete) {
        if (!incomplete.contains(scanner)) {
            incomplete.add(scanner);
            metricsConfig.recordScanIncomplete(scanner);
        }
    }

    private static int countFindings(Object result) {
        if (result instanceof LatestPeriodReportResult crosstab) {
            return crosstab.getCellAnomalies().size();
        }
        if (result instanceof PeerScanResult peer) {
            return peer.getOutliers().size();
        }
        if (result instanceof List<?> records) {
            return records.size();
        }
        return 0;
    }
}

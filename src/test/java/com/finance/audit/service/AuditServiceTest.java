package com.finance.audit.service;

import com.finance.audit.config.AuditThresholdConfig;
import com.finance.audit.config.MetricsConfig;
import com.finance.audit.engine.InputShapeException;
import com.finance.audit.engine.IqrStatusClassifier;
import com.finance.audit.engine.isolationforest.IsolationForestOutlierDetector;
import com.finance.audit.engine.scanners.LatestPeriodReport;
import com.finance.audit.engine.scanners.PeerGroupOutlierScanner;
import com.finance.audit.engine.scanners.RollingTimeSeriesScanner;
import com.finance.audit.model.AnomalyStatus;
import com.finance.audit.model.AuditReport;
import com.finance.audit.model.AuditRequest;
import com.finance.audit.model.LedgerTable;
import com.finance.audit.model.PeerOutlierRecord;
import com.finance.audit.model.Period;
import com.finance.audit.model.RollingAnomalyRecord;
import com.finance.audit.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.finance.audit.testutil.TestDataFactory.COST_CENTER;
import static com.finance.audit.testutil.TestDataFactory.GL_CODE;
import static com.finance.audit.testutil.TestDataFactory.GROUP;
import static com.finance.audit.testutil.TestDataFactory.PERIOD;
import static com.finance.audit.testutil.TestDataFactory.VALUE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AuditServiceTest {

    private AuditThresholdConfig config;
    private SimpleMeterRegistry registry;
    private ExecutorService executor;

    private ObservationAggregator aggregator;
    private LatestPeriodReport latestPeriodReport;
    private RollingTimeSeriesScanner rollingScanner;
    private PeerGroupOutlierScanner peerScanner;

    @BeforeEach
    void setUp() {
        config = new AuditThresholdConfig();
        registry = new SimpleMeterRegistry();
        executor = Executors.newFixedThreadPool(3);

        IqrStatusClassifier classifier = new IqrStatusClassifier();
        aggregator = new ObservationAggregator();
        latestPeriodReport = new LatestPeriodReport(classifier);
        rollingScanner = new RollingTimeSeriesScanner(classifier);
        peerScanner = new PeerGroupOutlierScanner(new IsolationForestOutlierDetector(config));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private AuditService service() {
        return new AuditService(aggregator, latestPeriodReport, rollingScanner, peerScanner,
                config, new MetricsConfig(registry), executor);
    }

    private static AuditRequest request() {
        return AuditRequest.builder()
                .periodColumn(PERIOD)
                .valueColumn(VALUE)
                .crosstabDimensions(List.of(GROUP, GL_CODE))
                .timeSeriesDimensions(List.of(GROUP, GL_CODE, COST_CENTER))
                .peerItemColumn(COST_CENTER)
                .build();
    }

    @Test
    void run_allScanners_combinesResults() {
        LedgerTable ledger = TestDataFactory.expenseLedger();

        AuditReport report = service().run(ledger, request());

        assertThat(report.getTotalRows()).isEqualTo(30);
        assertThat(report.isComplete()).isTrue();
        assertThat(report.getCrosstab().getRowSummaries()).singleElement()
                .satisfies(row -> assertThat(row.getStatus()).isEqualTo(AnomalyStatus.SPIKE_VS_CONSTANT));

        // critical only: the reversal is kept, NEW_ITEM and SPIKE_VS_CONSTANT are not
        assertThat(report.getTimeSeriesAnomalies()).singleElement().satisfies(record -> {
            assertThat(record.getStatus()).isEqualTo(AnomalyStatus.NEGATIVE_VALUE);
            assertThat(record.getPeriod()).isEqualTo(Period.ofMonth(2024, 4));
            assertThat(record.getDimensions()).containsEntry(COST_CENTER, "CC-3");
        });

        assertThat(report.getPeerOutliers())
                .extracting(PeerOutlierRecord::getItemId, PeerOutlierRecord::getStatus)
                .containsExactly(
                        tuple("CC-3", AnomalyStatus.PEER_LOW_OUTLIER),
                        tuple("CC-5", AnomalyStatus.PEER_HIGH_OUTLIER));
    }

    @Test
    void run_criticalOnlyDisabled_keepsEveryFinding() {
        config.getTimeSeries().setCriticalOnly(false);

        AuditReport report = service().run(TestDataFactory.expenseLedger(), request());

        assertThat(report.getTimeSeriesAnomalies()).hasSize(26);
        assertThat(report.getTimeSeriesAnomalies()).extracting(RollingAnomalyRecord::getStatus)
                .contains(AnomalyStatus.NEW_ITEM, AnomalyStatus.NEGATIVE_VALUE, AnomalyStatus.SPIKE_VS_CONSTANT);
    }

    @Test
    void run_missingColumn_failsBeforeAnyScanner() {
        RollingTimeSeriesScanner neverCalled = mock(RollingTimeSeriesScanner.class);
        rollingScanner = neverCalled;
        LedgerTable ledger = LedgerTable.of(List.of(GROUP, PERIOD, VALUE), List.of());

        assertThatThrownBy(() -> service().run(ledger, request()))
                .isInstanceOf(InputShapeException.class)
                .hasMessageContaining(GL_CODE)
                .hasMessageContaining(COST_CENTER);
        verifyNoInteractions(neverCalled);
    }

    @Test
    void run_unmappedValueColumn_isRejected() {
        AuditRequest request = request();
        request.setValueColumn(null);

        assertThatThrownBy(() -> service().run(TestDataFactory.expenseLedger(), request))
                .isInstanceOf(InputShapeException.class);
    }

    @Test
    void run_disabledScanners_areNotRun() {
        AuditRequest request = request();
        request.setRunTimeSeries(false);
        request.setRunPeerGroup(false);

        AuditReport report = service().run(TestDataFactory.expenseLedger(), request);

        assertThat(report.getTimeSeriesAnomalies()).isEmpty();
        assertThat(report.getPeerOutliers()).isEmpty();
        assertThat(report.getCrosstab().getRowSummaries()).hasSize(1);
        assertThat(report.isComplete()).isTrue();
    }

    @Test
    void run_emptyLedger_returnsEmptyReport() {
        LedgerTable empty = LedgerTable.empty(TestDataFactory.LEDGER_COLUMNS);

        AuditReport report = service().run(empty, request());

        assertThat(report.getTotalRows()).isZero();
        assertThat(report.getCrosstab().isEmpty()).isTrue();
        assertThat(report.getTimeSeriesAnomalies()).isEmpty();
        assertThat(report.getPeerOutliers()).isEmpty();
        assertThat(report.isComplete()).isTrue();
    }

    @Test
    void run_slowScanner_isMarkedIncompleteAndOthersAreKept() {
        config.setScanTimeout(Duration.ofSeconds(1));
        RollingTimeSeriesScanner slow = mock(RollingTimeSeriesScanner.class);
        when(slow.scan(any(), anyInt(), any())).thenAnswer(invocation -> {
            Thread.sleep(10_000);
            return List.of();
        });
        rollingScanner = slow;

        AuditReport report = service().run(TestDataFactory.expenseLedger(), request());

        assertThat(report.getIncompleteScans()).containsExactly(AuditService.TIME_SERIES);
        assertThat(report.getTimeSeriesAnomalies()).isEmpty();
        assertThat(report.getCrosstab().getRowSummaries()).hasSize(1);
        assertThat(report.getPeerOutliers()).hasSize(2);
        assertThat(registry.get("audit.scan.incomplete").tag("scanner", AuditService.TIME_SERIES)
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void run_failingScanner_isMarkedIncomplete() {
        RollingTimeSeriesScanner broken = mock(RollingTimeSeriesScanner.class);
        when(broken.scan(any(), anyInt(), any())).thenThrow(new IllegalStateException("window out of sync"));
        rollingScanner = broken;

        AuditReport report = service().run(TestDataFactory.expenseLedger(), request());

        assertThat(report.getIncompleteScans()).containsExactly(AuditService.TIME_SERIES);
        assertThat(report.getPeerOutliers()).hasSize(2);
    }

    @Test
    void run_recordsScanMetrics() {
        service().run(TestDataFactory.expenseLedger(), request());

        assertThat(registry.get("audit.scan.duration").tag("scanner", AuditService.PEER_GROUP).timer().count())
                .isEqualTo(1L);
        assertThat(registry.get("audit.status.count")
                .tag("scanner", AuditService.PEER_GROUP)
                .tag("status", AnomalyStatus.PEER_HIGH_OUTLIER.name())
                .counter().count()).isEqualTo(1.0);
    }
}

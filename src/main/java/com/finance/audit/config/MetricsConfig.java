package com.finance.audit.config;

import com.finance.audit.model.AnomalyStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordScan(String scanner, Duration elapsed, int anomalies) {
        Timer.builder("audit.scan.duration")
                .tag("scanner", scanner)
                .register(registry)
                .record(elapsed);

        Counter.builder("audit.scan.anomalies")
                .tag("scanner", scanner)
                .register(registry)
                .increment(anomalies);
    }

    public void recordStatus(String scanner, AnomalyStatus status) {
        Counter.builder("audit.status.count")
                .tag("scanner", scanner)
                .tag("status", status.name())
                .register(registry)
                .increment();
    }

    public void recordPeerBatchSkipped(String reason) {
        Counter.builder("audit.peer.batch.skipped")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordScanIncomplete(String scanner) {
        Counter.builder("audit.scan.incomplete")
                .tag("scanner", scanner)
                .register(registry)
                .increment();
    }
}

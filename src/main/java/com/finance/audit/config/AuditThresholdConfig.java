package com.finance.audit.config;

import com.finance.audit.engine.ClassifierParams;
import com.finance.audit.engine.PeerScanParams;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "audit")
public class AuditThresholdConfig {

    // Minimum positive history values before the latest-period report compares against a baseline.
    private int minHistory = 3;

    // Trailing window (periods) of the rolling time-series scan.
    private int window = 6;

    // IQR fence multiplier. 1.5 = strict, 2.0 = moderate, 3.0 = relaxed.
    private double k = 2.0;

    // Relative change below which a value is always normal.
    private double pctThreshold1 = 0.10;

    // Relative change below which a value is normal against a constant history.
    private double pctThreshold2 = 0.15;

    // Scanners still running after this long are abandoned; completed results are kept.
    private Duration scanTimeout = Duration.ofMinutes(10);

    private TimeSeries timeSeries = new TimeSeries();

    private Peer peer = new Peer();

    public ClassifierParams toClassifierParams() {
        return ClassifierParams.builder()
                .minHistory(minHistory)
                .k(k)
                .pctThreshold1(pctThreshold1)
                .pctThreshold2(pctThreshold2)
                .build();
    }

    public PeerScanParams toPeerScanParams() {
        return PeerScanParams.builder()
                .contamination(peer.getContamination())
                .zScoreThreshold(peer.getMinZScore())
                .minBatchSize(peer.getMinBatchSize())
                .seed(peer.getSeed())
                .build();
    }

    @Data
    public static class TimeSeries {
        // Keep only HIGH_SPIKE, LOW_SPIKE and NEGATIVE_VALUE in the time-series log.
        private boolean criticalOnly = true;
    }

    @Data
    public static class Peer {
        private double contamination = 0.05;
        // |z| at or above this confirms a detector candidate
        private double minZScore = 2.0;
        private int minBatchSize = 5;
        // Fixed so repeated runs flag the same rows.
        private long seed = 42L;
        // "isolation-forest" or "tukey"
        private String detector = "isolation-forest";
        private int numTrees = 100;
        private int sampleSize = 256;
    }
}

package com.finance.audit;

import com.finance.audit.config.AuditThresholdConfig;
import com.finance.audit.engine.isolationforest.OutlierDetector;
import com.finance.audit.engine.isolationforest.TukeyFenceOutlierDetector;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "audit.peer.detector=tukey",
        "audit.peer.min-z-score=2.5",
        "audit.pct-threshold1=0.05",
        "audit.time-series.critical-only=false"
})
class TukeyDetectorConfigurationTest {

    @Autowired private OutlierDetector outlierDetector;
    @Autowired private AuditThresholdConfig config;

    @Test
    void detectorProperty_selectsTukeyFences() {
        assertThat(outlierDetector).isInstanceOf(TukeyFenceOutlierDetector.class);
    }

    @Test
    void overriddenProperties_areBound() {
        assertThat(config.getPeer().getMinZScore()).isEqualTo(2.5);
        assertThat(config.getPctThreshold1()).isEqualTo(0.05);
        assertThat(config.getTimeSeries().isCriticalOnly()).isFalse();
        assertThat(config.toPeerScanParams().getZScoreThreshold()).isEqualTo(2.5);
    }
}

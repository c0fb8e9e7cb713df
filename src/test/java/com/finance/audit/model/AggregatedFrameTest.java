package com.finance.audit.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AggregatedFrameTest {

    private static final DimensionKey KEY = DimensionKey.of("OPEX", "5100");

    @Test
    void constructor_observationOutsidePeriods_isRejected() {
        DimensionGroup group = new DimensionGroup(KEY, List.of(
                new Observation(KEY, Period.ofMonth(2024, 1), 10.0),
                new Observation(KEY, Period.ofMonth(2024, 2), 20.0)));

        assertThatThrownBy(() -> new AggregatedFrame(List.of("GROUP", "GL"), List.of(group),
                List.of(Period.ofMonth(2024, 1))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("OPEX|5100");
    }

    @Test
    void constructor_periodsCoveringObservations_isAccepted() {
        DimensionGroup group = new DimensionGroup(KEY, List.of(
                new Observation(KEY, Period.ofMonth(2024, 2), 20.0)));

        AggregatedFrame frame = new AggregatedFrame(List.of("GROUP", "GL"), List.of(group),
                List.of(Period.ofMonth(2024, 1), Period.ofMonth(2024, 2)));

        assertThat(frame.observationCount()).isEqualTo(1);
        assertThat(frame.describe(KEY)).containsEntry("GL", "5100");
    }
}

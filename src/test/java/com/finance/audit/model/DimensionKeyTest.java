package com.finance.audit.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DimensionKeyTest {

    @Test
    void compareTo_ordersValueByValue() {
        DimensionKey left = DimensionKey.of("A|B", "C");
        DimensionKey right = DimensionKey.of("A", "B|C");

        assertThat(left.joined()).isEqualTo(right.joined());
        assertThat(left).isNotEqualTo(right);
        assertThat(left.compareTo(right)).isPositive();
        assertThat(right.compareTo(left)).isNegative();
    }

    @Test
    void compareTo_shorterPrefixSortsFirst() {
        assertThat(DimensionKey.of("OPEX").compareTo(DimensionKey.of("OPEX", "5100"))).isNegative();
        assertThat(DimensionKey.of("OPEX", "5100").compareTo(DimensionKey.of("OPEX", "5100"))).isZero();
    }
}

package com.finance.audit.model;

import lombok.Value;

/**
 * Address of one cell in a pivoted report.
 */
@Value
public class CellRef {
    DimensionKey rowKey;
    Period period;
}

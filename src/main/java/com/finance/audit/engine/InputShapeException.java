package com.finance.audit.engine;

import java.util.List;

/**
 * The input table does not have the shape a scan requires: a required column is
 * missing or a cell cannot be read as the expected type. Raised once, before any
 * per-group work starts.
 */
public class InputShapeException extends IllegalArgumentException {

    private final List<String> missingColumns;

    public InputShapeException(String message) {
        super(message);
        this.missingColumns = List.of();
    }

    public InputShapeException(String message, Throwable cause) {
        super(message, cause);
        this.missingColumns = List.of();
    }

    private InputShapeException(String message, List<String> missingColumns) {
        super(message);
        this.missingColumns = List.copyOf(missingColumns);
    }

    public static InputShapeException missingColumns(List<String> missing) {
        return new InputShapeException("Missing required column(s): " + String.join(", ", missing), missing);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}

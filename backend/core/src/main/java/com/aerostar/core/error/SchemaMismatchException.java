package com.aerostar.core.error;

import java.util.List;

/**
 * The input table lacks a column the transform cannot do without. Aborts the whole run.
 */
public class SchemaMismatchException extends RuntimeException {
    private final List<String> missingColumns;

    public SchemaMismatchException(String message, List<String> missingColumns) {
        super(message + ": " + String.join(", ", missingColumns));
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> missingColumns() {
        return missingColumns;
    }
}

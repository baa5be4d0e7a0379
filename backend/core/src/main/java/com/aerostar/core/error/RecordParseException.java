package com.aerostar.core.error;

/**
 * A single row could not be parsed. The row is excluded; the run continues.
 */
public class RecordParseException extends RuntimeException {
    private final int rowNumber;

    public RecordParseException(int rowNumber, String message) {
        super("Row " + rowNumber + ": " + message);
        this.rowNumber = rowNumber;
    }

    public RecordParseException(int rowNumber, String message, Throwable cause) {
        super("Row " + rowNumber + ": " + message, cause);
        this.rowNumber = rowNumber;
    }

    public int rowNumber() {
        return rowNumber;
    }
}

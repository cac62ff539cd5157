package com.spreadsheet.drilldown.exceptions;

/**
 * Thrown when the workbook itself cannot be read (corrupt file, I/O failure).
 * Fatal for the session: it is marked unusable afterwards.
 */
public class WorkbookUnreadableException extends RuntimeException {
    public WorkbookUnreadableException(String message) {
        super(message);
    }

    public WorkbookUnreadableException(String message, Throwable cause) {
        super(message, cause);
    }
}

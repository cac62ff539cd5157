package com.spreadsheet.drilldown.exceptions;

/**
 * Thrown when a session ID is unknown, either never created
 * or already cleaned up.
 */
public class SessionNotFoundException extends RuntimeException {
    public SessionNotFoundException(String message) {
        super(message);
    }
}

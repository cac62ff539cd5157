package com.spreadsheet.drilldown.exceptions;

/**
 * Thrown when a sheet name given by the caller
 * doesn't exist in the session's workbook.
 */
public class SheetNotFoundException extends RuntimeException {
    public SheetNotFoundException(String message) {
        super(message);
    }
}

package com.spreadsheet.drilldown.exceptions;

/**
 * Thrown when a cell address isn't a valid grid address,
 * for example "1A" or "ZZZZ1".
 */
public class InvalidCellAddressException extends RuntimeException {
    public InvalidCellAddressException(String message) {
        super(message);
    }
}

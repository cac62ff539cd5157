package com.spreadsheet.drilldown.exceptions;

/**
 * Thrown when a naming configuration is rejected, for example a label
 * column outside the sheet's used area. No state is changed.
 */
public class InvalidConfigurationException extends RuntimeException {
    public InvalidConfigurationException(String message) {
        super(message);
    }
}

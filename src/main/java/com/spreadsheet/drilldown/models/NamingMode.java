package com.spreadsheet.drilldown.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * COMPONENT composes names from context text and row/column labels;
 * GENERATED prefers externally suggested names.
 */
public enum NamingMode {
    COMPONENT,
    GENERATED;

    /**
     * Allows case-insensitive input, e.g. "generated" -> GENERATED.
     */
    @JsonCreator
    public static NamingMode fromValue(String value) {
        return NamingMode.valueOf(value.trim().toUpperCase());
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }
}

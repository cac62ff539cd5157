package com.spreadsheet.drilldown.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Advisory structural complexity of a formula, used as a UI hint.
 * Declared in increasing order of complexity.
 */
public enum Complexity {
    SIMPLE,
    MODERATE,
    COMPLEX;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }
}

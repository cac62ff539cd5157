package com.spreadsheet.drilldown.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a resolved display name came from. Each naming mode evaluates
 * a fixed, ordered subset of these tiers top-down.
 */
public enum NameSource {
    MANUAL("manual"),
    MANUAL_EDIT("manual-edit"),
    AI("ai"),
    COMPONENT("component"),
    COMPONENT_FALLBACK("component-fallback"),
    FALLBACK("fallback");

    private final String label;

    NameSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}

package com.spreadsheet.drilldown.models;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of naming one cell: the display text, the tier it came from,
 * the AI confidence when the AI tier won, and the raw components.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResolvedName {
    private final String name;
    private final NameSource source;
    private final Double confidence;
    private final NameComponents components;

    public ResolvedName(String name, NameSource source, Double confidence, NameComponents components) {
        this.name = name;
        this.source = source;
        this.confidence = confidence;
        this.components = components;
    }

    public String getName() {
        return name;
    }

    public NameSource getSource() {
        return source;
    }

    public Double getConfidence() {
        return confidence;
    }

    public NameComponents getComponents() {
        return components;
    }
}

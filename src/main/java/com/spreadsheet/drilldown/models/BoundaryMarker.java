package com.spreadsheet.drilldown.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a node cannot be expanded even though it may carry a formula.
 * None of these are errors; they let the UI render the stop inline.
 */
public enum BoundaryMarker {
    NONE,
    // Cell already appears among this node's ancestors
    CYCLE,
    // Points into another workbook
    EXTERNAL,
    // Range too large to enumerate; collapsed into one summary node
    RANGE_LIMIT,
    // Node sits at the configured maximum depth
    DEPTH_LIMIT,
    // Referenced sheet does not exist in the workbook
    NOT_FOUND;

    @JsonValue
    public String toValue() {
        return name().toLowerCase().replace('_', '-');
    }
}

package com.spreadsheet.drilldown.models;

/**
 * Expansion state of one dependency node.
 * COLLAPSED -> EXPANDING -> EXPANDED, EXPANDING -> COLLAPSED on failure,
 * EXPANDED -> COLLAPSED keeps the fetched children.
 */
public enum NodeState {
    COLLAPSED,
    EXPANDING,
    EXPANDED
}

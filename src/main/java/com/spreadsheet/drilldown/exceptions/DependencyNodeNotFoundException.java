package com.spreadsheet.drilldown.exceptions;

/**
 * Thrown when expand/collapse names a pathId that isn't part of the
 * session's current tree (e.g. the tree was rebuilt in the meantime).
 */
public class DependencyNodeNotFoundException extends RuntimeException {
    public DependencyNodeNotFoundException(String message) {
        super(message);
    }
}

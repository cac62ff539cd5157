package com.spreadsheet.drilldown.models;

/**
 * One non-empty cell of a row, offered as a candidate label column.
 */
public class RowValue {
    private final String column;
    private final String value;

    public RowValue(String column, String value) {
        this.column = column;
        this.value = value;
    }

    public String getColumn() {
        return column;
    }

    public String getValue() {
        return value;
    }
}

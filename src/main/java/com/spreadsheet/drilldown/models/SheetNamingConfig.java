package com.spreadsheet.drilldown.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Per-sheet naming configuration of one session:
 * - labelColumn: column whose value in a cell's row labels that row
 * - labelRow: row whose value in a cell's column labels that column
 * The version increases on every change so cached per-cell labels can tell they are stale.
 */
public class SheetNamingConfig {
    private String labelColumn;
    private Integer labelRow;
    private long version;

    public String getLabelColumn() {
        return labelColumn;
    }

    public void setLabelColumn(String labelColumn) {
        this.labelColumn = labelColumn;
        version++;
    }

    public Integer getLabelRow() {
        return labelRow;
    }

    public void setLabelRow(Integer labelRow) {
        this.labelRow = labelRow;
        version++;
    }

    @JsonIgnore
    public long getVersion() {
        return version;
    }
}

package com.spreadsheet.drilldown.workbook;

/**
 * Used area of a sheet: last row and last column (1-based) holding any cell.
 * An empty sheet has both set to 0.
 */
public class SheetBounds {
    private final int maxRow;
    private final int maxColumn;

    public SheetBounds(int maxRow, int maxColumn) {
        this.maxRow = maxRow;
        this.maxColumn = maxColumn;
    }

    public int getMaxRow() {
        return maxRow;
    }

    public int getMaxColumn() {
        return maxColumn;
    }

    public boolean containsRow(int row) {
        return row >= 1 && row <= maxRow;
    }

    public boolean containsColumn(int column) {
        return column >= 1 && column <= maxColumn;
    }
}

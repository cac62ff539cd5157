package com.spreadsheet.drilldown.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A rectangular block of cells on one sheet, e.g. Sheet1!A1:C10.
 * Corners are normalized so that start is always the top-left cell.
 * Cells are never enumerated until someone asks for them.
 */
public final class CellRange {

    private final CellAddress start;
    private final CellAddress end;

    public CellRange(CellAddress first, CellAddress second) {
        int top = Math.min(first.getRow(), second.getRow());
        int bottom = Math.max(first.getRow(), second.getRow());
        int left = Math.min(first.getColumnIndex(), second.getColumnIndex());
        int right = Math.max(first.getColumnIndex(), second.getColumnIndex());
        this.start = new CellAddress(first.getSheet(), CellAddress.columnLetters(left), top);
        this.end = new CellAddress(first.getSheet(), CellAddress.columnLetters(right), bottom);
    }

    public CellAddress getStart() {
        return start;
    }

    public CellAddress getEnd() {
        return end;
    }

    public String getSheet() {
        return start.getSheet();
    }

    public long getCellCount() {
        long rows = (long) end.getRow() - start.getRow() + 1;
        long columns = (long) end.getColumnIndex() - start.getColumnIndex() + 1;
        return rows * columns;
    }

    /**
     * Row-major list of every cell in the range. Callers bound the size first.
     */
    public List<CellAddress> cells() {
        List<CellAddress> result = new ArrayList<>();
        for (int row = start.getRow(); row <= end.getRow(); row++) {
            for (int col = start.getColumnIndex(); col <= end.getColumnIndex(); col++) {
                result.add(new CellAddress(getSheet(), CellAddress.columnLetters(col), row));
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange other = (CellRange) o;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start + ":" + end.getAddress();
    }
}

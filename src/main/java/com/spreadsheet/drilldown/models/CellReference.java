package com.spreadsheet.drilldown.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * A single cell or a range as written in a formula, resolved to its sheet.
 * External references keep the bracketed workbook name and are never resolved further.
 */
public final class CellReference {

    private final CellAddress address;
    private final CellRange range;
    private final String externalWorkbook;
    private final boolean crossSheet;

    private CellReference(CellAddress address, CellRange range, String externalWorkbook, boolean crossSheet) {
        this.address = address;
        this.range = range;
        this.externalWorkbook = externalWorkbook;
        this.crossSheet = crossSheet;
    }

    public static CellReference cell(CellAddress address, boolean crossSheet) {
        return new CellReference(address, null, null, crossSheet);
    }

    public static CellReference range(CellRange range, boolean crossSheet) {
        return new CellReference(null, range, null, crossSheet);
    }

    public static CellReference external(String workbook, CellAddress address, CellRange range) {
        return new CellReference(address, range, workbook, true);
    }

    public boolean isRange() {
        return range != null;
    }

    public boolean isExternal() {
        return externalWorkbook != null;
    }

    public boolean isCrossSheet() {
        return crossSheet;
    }

    /**
     * The referenced cell; for a range, its top-left corner.
     */
    public CellAddress getAddress() {
        return range != null ? range.getStart() : address;
    }

    public CellRange getRange() {
        return range;
    }

    public String getSheet() {
        return getAddress().getSheet();
    }

    public String getExternalWorkbook() {
        return externalWorkbook;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellReference)) {
            return false;
        }
        CellReference other = (CellReference) o;
        return Objects.equals(address, other.address)
                && Objects.equals(range, other.range)
                && Objects.equals(externalWorkbook, other.externalWorkbook);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, range, externalWorkbook);
    }

    @JsonValue
    @Override
    public String toString() {
        String target = range != null ? range.toString() : address.toString();
        if (externalWorkbook == null) {
            return target;
        }
        return "[" + externalWorkbook + "]" + target;
    }
}

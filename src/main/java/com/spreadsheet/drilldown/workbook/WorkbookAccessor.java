package com.spreadsheet.drilldown.workbook;

import java.util.List;

/**
 * Read-only view of one open workbook.
 * Absent cells and unknown sheets are ordinary: reads return null and lookups return false.
 * Implementations throw WorkbookUnreadableException only for real I/O or format failures.
 * Implementations may be stateful; callers serialize access per session.
 */
public interface WorkbookAccessor extends AutoCloseable {

    /**
     * Cell value: Double for numbers, String for text, Boolean for booleans, null when blank.
     * Formula cells return their cached result; nothing is recalculated.
     */
    Object getValue(String sheet, String address);

    /**
     * Display text of the cell value, e.g. "2024" rather than "2024.0"; null when blank.
     */
    String getText(String sheet, String address);

    /**
     * Formula with its leading "=", or null when the cell holds no formula.
     */
    String getFormula(String sheet, String address);

    List<String> listSheets();

    boolean hasSheet(String sheet);

    boolean cellExists(String sheet, String address);

    /**
     * Used area of the sheet, or null when the sheet does not exist.
     */
    SheetBounds getSheetBounds(String sheet);

    @Override
    void close();
}

package com.spreadsheet.drilldown.workbook;

import com.spreadsheet.drilldown.exceptions.WorkbookUnreadableException;
import com.spreadsheet.drilldown.models.CellAddress;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * WorkbookAccessor backed by plain maps, for tests that need formulas POI can't evaluate
 * (external links, missing sheets) or injected read failures.
 */
public class InMemoryWorkbookAccessor implements WorkbookAccessor {

    private final Map<String, Map<CellAddress, Object>> values = new LinkedHashMap<>();
    private final Map<CellAddress, String> formulas = new LinkedHashMap<>();
    private final Set<CellAddress> failing = new HashSet<>();
    private final AtomicInteger formulaReads = new AtomicInteger();
    private boolean closed;

    public InMemoryWorkbookAccessor addSheet(String sheet) {
        values.computeIfAbsent(sheet, s -> new LinkedHashMap<>());
        return this;
    }

    public InMemoryWorkbookAccessor value(String sheet, String address, Object value) {
        addSheet(sheet);
        values.get(sheet).put(CellAddress.parse(sheet, address), value);
        return this;
    }

    /**
     * Formula cell; value is the cached result returned by getValue.
     */
    public InMemoryWorkbookAccessor formula(String sheet, String address, String formula, Object value) {
        value(sheet, address, value);
        formulas.put(CellAddress.parse(sheet, address), formula);
        return this;
    }

    /**
     * Every later read of this cell throws WorkbookUnreadableException.
     */
    public void failOn(String sheet, String address) {
        failing.add(CellAddress.parse(sheet, address));
    }

    public void heal() {
        failing.clear();
    }

    public int getFormulaReads() {
        return formulaReads.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public Object getValue(String sheet, String address) {
        CellAddress cell = check(sheet, address);
        Map<CellAddress, Object> sheetValues = values.get(sheet);
        return sheetValues == null || cell == null ? null : sheetValues.get(cell);
    }

    @Override
    public String getText(String sheet, String address) {
        Object value = getValue(sheet, address);
        if (value == null) {
            return null;
        }
        if (value instanceof Double) {
            return PoiWorkbookAccessor.formatNumber((Double) value);
        }
        return value.toString();
    }

    @Override
    public String getFormula(String sheet, String address) {
        CellAddress cell = check(sheet, address);
        formulaReads.incrementAndGet();
        return cell == null ? null : formulas.get(cell);
    }

    @Override
    public List<String> listSheets() {
        return new ArrayList<>(values.keySet());
    }

    @Override
    public boolean hasSheet(String sheet) {
        return values.containsKey(sheet);
    }

    @Override
    public boolean cellExists(String sheet, String address) {
        return getValue(sheet, address) != null || getFormula(sheet, address) != null;
    }

    @Override
    public SheetBounds getSheetBounds(String sheet) {
        Map<CellAddress, Object> sheetValues = values.get(sheet);
        if (sheetValues == null) {
            return null;
        }
        int maxRow = 0;
        int maxColumn = 0;
        for (CellAddress cell : sheetValues.keySet()) {
            maxRow = Math.max(maxRow, cell.getRow());
            maxColumn = Math.max(maxColumn, cell.getColumnIndex());
        }
        return new SheetBounds(maxRow, maxColumn);
    }

    @Override
    public void close() {
        closed = true;
    }

    private CellAddress check(String sheet, String address) {
        CellAddress cell = CellAddress.tryParse(sheet, address);
        if (cell != null && failing.contains(cell)) {
            throw new WorkbookUnreadableException("Simulated read failure at " + cell);
        }
        return cell;
    }
}

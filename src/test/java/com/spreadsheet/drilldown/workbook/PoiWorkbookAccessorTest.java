package com.spreadsheet.drilldown.workbook;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PoiWorkbookAccessor over a workbook built in memory.
 */
class PoiWorkbookAccessorTest {

    private PoiWorkbookAccessor accessor;

    @BeforeEach
    void setUp() {
        XSSFWorkbook workbook = new XSSFWorkbook();
        Sheet sheet = workbook.createSheet("Sheet1");
        Row first = sheet.createRow(0);
        first.createCell(0).setCellValue(10);
        first.createCell(1).setCellValue("Revenue");
        first.createCell(2).setCellValue(2.5);
        first.createCell(3).setCellValue(true);
        Row second = sheet.createRow(1);
        second.createCell(0).setCellFormula("A1*2");
        workbook.createSheet("Sheet A");
        workbook.getCreationHelper().createFormulaEvaluator().evaluateAll();
        accessor = new PoiWorkbookAccessor(workbook);
    }

    @AfterEach
    void tearDown() {
        accessor.close();
    }

    @Test
    void testValues() {
        assertEquals(10.0, accessor.getValue("Sheet1", "A1"));
        assertEquals("Revenue", accessor.getValue("Sheet1", "B1"));
        assertEquals(Boolean.TRUE, accessor.getValue("Sheet1", "D1"));
        assertNull(accessor.getValue("Sheet1", "Z9"));
        assertNull(accessor.getValue("Missing", "A1"));
    }

    /**
     * Formula cells expose their cached result and their formula with a leading "=".
     */
    @Test
    void testFormulaCell() {
        assertEquals("=A1*2", accessor.getFormula("Sheet1", "A2"));
        assertEquals(20.0, accessor.getValue("Sheet1", "A2"));
        assertNull(accessor.getFormula("Sheet1", "A1"));
    }

    @Test
    void testDisplayText() {
        assertEquals("10", accessor.getText("Sheet1", "A1"));
        assertEquals("2.5", accessor.getText("Sheet1", "C1"));
        assertEquals("TRUE", accessor.getText("Sheet1", "D1"));
        assertNull(accessor.getText("Sheet1", "E1"));
    }

    @Test
    void testSheetsAndBounds() {
        assertEquals(List.of("Sheet1", "Sheet A"), accessor.listSheets());
        assertTrue(accessor.hasSheet("Sheet A"));
        assertFalse(accessor.hasSheet("Nope"));
        assertTrue(accessor.cellExists("Sheet1", "B1"));
        assertFalse(accessor.cellExists("Sheet1", "B2"));

        SheetBounds bounds = accessor.getSheetBounds("Sheet1");
        assertEquals(2, bounds.getMaxRow());
        assertEquals(4, bounds.getMaxColumn());
        assertEquals(0, accessor.getSheetBounds("Sheet A").getMaxRow());
        assertNull(accessor.getSheetBounds("Nope"));
    }

    @Test
    void testFormatNumber() {
        assertEquals("2024", PoiWorkbookAccessor.formatNumber(2024.0));
        assertEquals("-3", PoiWorkbookAccessor.formatNumber(-3.0));
        assertEquals("0.1", PoiWorkbookAccessor.formatNumber(0.1));
    }
}

package com.spreadsheet.drilldown.workbook;

import com.spreadsheet.drilldown.exceptions.WorkbookUnreadableException;
import com.spreadsheet.drilldown.models.CellAddress;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * WorkbookAccessor over an Apache POI workbook (.xlsx or .xls) held open for the whole session.
 * POI workbooks are not thread-safe; the owning session serializes every call.
 */
public class PoiWorkbookAccessor implements WorkbookAccessor {

    private static final Logger logger = LoggerFactory.getLogger(PoiWorkbookAccessor.class);

    private final Workbook workbook;

    public PoiWorkbookAccessor(Workbook workbook) {
        this.workbook = workbook;
    }

    /**
     * Opens a workbook from a stream. The stream is fully consumed but not closed.
     */
    public static PoiWorkbookAccessor open(InputStream in) {
        try {
            return new PoiWorkbookAccessor(WorkbookFactory.create(in));
        } catch (IOException | EncryptedDocumentException e) {
            throw new WorkbookUnreadableException("Workbook could not be opened: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // POI reports non-spreadsheet input with unchecked exceptions (e.g. NotOfficeXmlFileException)
            throw new WorkbookUnreadableException("Workbook could not be opened: " + e.getMessage(), e);
        }
    }

    @Override
    public Object getValue(String sheet, String address) {
        return read(() -> {
            Cell cell = findCell(sheet, address);
            if (cell == null) {
                return null;
            }
            CellType type = cell.getCellType();
            if (type == CellType.FORMULA) {
                type = cell.getCachedFormulaResultType();
            }
            switch (type) {
                case NUMERIC:
                    return cell.getNumericCellValue();
                case STRING:
                    String text = cell.getStringCellValue();
                    return text == null || text.isEmpty() ? null : text;
                case BOOLEAN:
                    return cell.getBooleanCellValue();
                default:
                    // BLANK, ERROR and _NONE carry no usable value
                    return null;
            }
        });
    }

    @Override
    public String getText(String sheet, String address) {
        Object value = getValue(sheet, address);
        if (value == null) {
            return null;
        }
        if (value instanceof Double) {
            return formatNumber((Double) value);
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "TRUE" : "FALSE";
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    @Override
    public String getFormula(String sheet, String address) {
        return read(() -> {
            Cell cell = findCell(sheet, address);
            if (cell == null || cell.getCellType() != CellType.FORMULA) {
                return null;
            }
            return "=" + cell.getCellFormula();
        });
    }

    @Override
    public List<String> listSheets() {
        return read(() -> {
            List<String> names = new ArrayList<>();
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                names.add(workbook.getSheetName(i));
            }
            return names;
        });
    }

    @Override
    public boolean hasSheet(String sheet) {
        return sheet != null && read(() -> workbook.getSheet(sheet) != null);
    }

    @Override
    public boolean cellExists(String sheet, String address) {
        return read(() -> {
            Cell cell = findCell(sheet, address);
            return cell != null && cell.getCellType() != CellType.BLANK;
        });
    }

    @Override
    public SheetBounds getSheetBounds(String sheet) {
        return read(() -> {
            Sheet poiSheet = workbook.getSheet(sheet);
            if (poiSheet == null) {
                return null;
            }
            if (poiSheet.getPhysicalNumberOfRows() == 0) {
                return new SheetBounds(0, 0);
            }
            int maxColumn = 0;
            for (Row row : poiSheet) {
                // getLastCellNum is already one past the last index, i.e. the 1-based last column
                maxColumn = Math.max(maxColumn, row.getLastCellNum());
            }
            return new SheetBounds(poiSheet.getLastRowNum() + 1, maxColumn);
        });
    }

    @Override
    public void close() {
        try {
            workbook.close();
        } catch (IOException e) {
            logger.warn("Failed to close workbook cleanly: {}", e.getMessage());
        }
    }

    private Cell findCell(String sheet, String address) {
        Sheet poiSheet = workbook.getSheet(sheet);
        CellAddress parsed = CellAddress.tryParse(sheet, address);
        if (poiSheet == null || parsed == null) {
            return null;
        }
        Row row = poiSheet.getRow(parsed.getRow() - 1);
        if (row == null) {
            return null;
        }
        return row.getCell(parsed.getColumnIndex() - 1);
    }

    private <T> T read(Supplier<T> action) {
        try {
            return action.get();
        } catch (WorkbookUnreadableException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Workbook read failed", e);
            throw new WorkbookUnreadableException("Workbook is unreadable: " + e.getMessage(), e);
        }
    }

    static String formatNumber(double number) {
        if (number == Math.rint(number) && !Double.isInfinite(number) && Math.abs(number) < 1e15) {
            return Long.toString((long) number);
        }
        return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
    }
}

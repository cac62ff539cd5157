package com.spreadsheet.drilldown.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.spreadsheet.drilldown.exceptions.InvalidCellAddressException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical key of a single spreadsheet cell: (sheet name, column letters, row number).
 * Equality is structural. Absolute markers ("$") never take part in identity.
 */
public final class CellAddress {

    // Last column and row of the xlsx grid (XFD1048576)
    public static final int MAX_COLUMN = 16384;
    public static final int MAX_ROW = 1048576;

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^\\$?([A-Za-z]{1,3})\\$?(\\d{1,7})$");
    private static final Pattern PLAIN_SHEET_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.]*$");

    private final String sheet;
    private final String column;
    private final int row;

    public CellAddress(String sheet, String column, int row) {
        this.sheet = sheet;
        this.column = column.toUpperCase();
        this.row = row;
    }

    /**
     * Parses an address like "B5" or "$B$5" on the given sheet.
     * Throws InvalidCellAddressException when the text is not a valid grid address.
     */
    public static CellAddress parse(String sheet, String address) {
        CellAddress parsed = tryParse(sheet, address);
        if (parsed == null) {
            throw new InvalidCellAddressException(
                    "Invalid cell address '" + address + "'. Use a format like A1, B5 or AC123");
        }
        return parsed;
    }

    /**
     * Same as parse, but returns null instead of throwing.
     */
    public static CellAddress tryParse(String sheet, String address) {
        if (address == null) {
            return null;
        }
        Matcher matcher = ADDRESS_PATTERN.matcher(address.trim());
        if (!matcher.matches()) {
            return null;
        }
        String letters = matcher.group(1).toUpperCase();
        int row;
        try {
            row = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            return null;
        }
        if (row < 1 || row > MAX_ROW || columnIndex(letters) > MAX_COLUMN) {
            return null;
        }
        return new CellAddress(sheet, letters, row);
    }

    /**
     * Parses a qualified reference such as "Sheet1!A1" or "'Sheet A'!B2".
     */
    public static CellAddress parseQualified(String reference) {
        if (reference == null) {
            throw new InvalidCellAddressException("Cell reference is required");
        }
        int bang = reference.lastIndexOf('!');
        if (bang <= 0) {
            throw new InvalidCellAddressException(
                    "Cell reference '" + reference + "' must be sheet-qualified, e.g. Sheet1!A1");
        }
        return parse(unquoteSheetName(reference.substring(0, bang)), reference.substring(bang + 1));
    }

    /**
     * Strips the single quotes Excel puts around sheet names with spaces or reserved characters.
     * Doubled quotes inside the name collapse to one.
     */
    public static String unquoteSheetName(String name) {
        String trimmed = name.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("'") && trimmed.endsWith("'")) {
            return trimmed.substring(1, trimmed.length() - 1).replace("''", "'");
        }
        return trimmed;
    }

    public static String quoteSheetNameIfNeeded(String name) {
        if (PLAIN_SHEET_NAME.matcher(name).matches() && tryParse(name, name) == null) {
            return name;
        }
        return "'" + name.replace("'", "''") + "'";
    }

    /**
     * Column letters to 1-based index (A=1, Z=26, AA=27).
     */
    public static int columnIndex(String letters) {
        int result = 0;
        for (char ch : letters.toUpperCase().toCharArray()) {
            result = result * 26 + (ch - 'A' + 1);
        }
        return result;
    }

    /**
     * 1-based column index to letters (1=A, 27=AA).
     */
    public static String columnLetters(int index) {
        StringBuilder result = new StringBuilder();
        int remaining = index;
        while (remaining > 0) {
            remaining--;
            result.insert(0, (char) ('A' + remaining % 26));
            remaining /= 26;
        }
        return result.toString();
    }

    public String getSheet() {
        return sheet;
    }

    public String getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    @JsonIgnore
    public int getColumnIndex() {
        return columnIndex(column);
    }

    /**
     * The unqualified address, e.g. "B5".
     */
    public String getAddress() {
        return column + row;
    }

    public CellAddress withSheet(String otherSheet) {
        return new CellAddress(otherSheet, column, row);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress other = (CellAddress) o;
        return row == other.row && column.equals(other.column) && Objects.equals(sheet, other.sheet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheet, column, row);
    }

    /**
     * Qualified form, quoting the sheet name when Excel would: "Sheet1!A1", "'Sheet A'!B2".
     */
    @Override
    public String toString() {
        if (sheet == null) {
            return getAddress();
        }
        return quoteSheetNameIfNeeded(sheet) + "!" + getAddress();
    }
}

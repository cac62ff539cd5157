package com.spreadsheet.drilldown.services;

import com.spreadsheet.drilldown.models.CellAddress;
import com.spreadsheet.drilldown.models.CellRange;
import com.spreadsheet.drilldown.models.CellReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the cell and range references inside a formula string.
 * Extraction is best-effort: fragments that don't form a valid reference are skipped,
 * and nothing here ever throws for an odd formula.
 */
@Service
public class ReferenceExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceExtractor.class);

    private static final String CELL = "\\$?[A-Za-z]{1,3}\\$?\\d+";

    // 'Quoted Sheet'!  |  Sheet1!  |  [Book2.xlsx]Sheet1!
    private static final String SHEET_PREFIX =
            "(?:(?<quoted>'(?:[^']|'')+')|(?<plain>(?:\\[[^\\]]+\\])?[\\p{L}_][\\p{L}\\p{N}_.]*))!";

    // The boundaries keep function names (LOG10), numbers (1E5) and longer names out
    private static final Pattern REFERENCE_PATTERN = Pattern.compile(
            "(?<![\\p{L}\\p{N}_.$'!\\]])"
                    + "(?:" + SHEET_PREFIX + ")?"
                    + "(?<start>" + CELL + ")"
                    + "(?::(?<end>" + CELL + "))?"
                    + "(?![\\p{L}\\p{N}_(!.])");

    // Optional path, bracketed workbook, then the sheet: C:\dir\[Book2.xlsx]Sheet1
    private static final Pattern EXTERNAL_SHEET = Pattern.compile("^(?:.*[\\\\/])?\\[(?<book>[^\\]]+)\\](?<sheet>.*)$");

    /**
     * Ordered, de-duplicated references of a formula living on currentSheet.
     * Returns an empty list for null, empty, or non-formula text (no leading "=").
     */
    public List<CellReference> extract(String formula, String currentSheet) {
        if (formula == null || !formula.trim().startsWith("=")) {
            return Collections.emptyList();
        }

        String body = maskStringLiterals(formula.trim().substring(1));
        Set<CellReference> references = new LinkedHashSet<>();

        Matcher matcher = REFERENCE_PATTERN.matcher(body);
        while (matcher.find()) {
            CellReference reference = toReference(matcher, currentSheet);
            if (reference == null) {
                logger.debug("Skipping unparseable reference '{}' in formula {}", matcher.group(), formula);
                continue;
            }
            references.add(reference);
        }
        return new ArrayList<>(references);
    }

    /**
     * True when the formula reads from another workbook anywhere.
     */
    public boolean hasExternalReferences(String formula, String currentSheet) {
        for (CellReference reference : extract(formula, currentSheet)) {
            if (reference.isExternal()) {
                return true;
            }
        }
        return false;
    }

    private CellReference toReference(Matcher matcher, String currentSheet) {
        String quoted = matcher.group("quoted");
        String plain = matcher.group("plain");
        String prefix = quoted != null ? CellAddress.unquoteSheetName(quoted) : plain;

        String workbook = null;
        String sheet = currentSheet;
        if (prefix != null) {
            Matcher external = EXTERNAL_SHEET.matcher(prefix);
            if (external.matches()) {
                workbook = external.group("book");
                sheet = external.group("sheet");
            } else {
                sheet = prefix;
            }
        }

        CellAddress start = CellAddress.tryParse(sheet, matcher.group("start"));
        if (start == null) {
            return null;
        }
        CellRange range = null;
        if (matcher.group("end") != null) {
            CellAddress end = CellAddress.tryParse(sheet, matcher.group("end"));
            if (end == null) {
                return null;
            }
            range = new CellRange(start, end);
        }

        if (workbook != null) {
            return CellReference.external(workbook, range == null ? start : null, range);
        }
        boolean crossSheet = prefix != null && !sheet.equals(currentSheet);
        return range != null ? CellReference.range(range, crossSheet) : CellReference.cell(start, crossSheet);
    }

    /**
     * Blanks out "string literals" (quotes included) so their contents are never read
     * as references or function calls. Length and positions are preserved.
     */
    static String maskStringLiterals(String formula) {
        StringBuilder masked = new StringBuilder(formula.length());
        boolean inString = false;
        for (int i = 0; i < formula.length(); i++) {
            char ch = formula.charAt(i);
            if (ch == '"') {
                if (inString && i + 1 < formula.length() && formula.charAt(i + 1) == '"') {
                    // Escaped quote inside a literal
                    masked.append("  ");
                    i++;
                    continue;
                }
                inString = !inString;
                masked.append(' ');
            } else {
                masked.append(inString ? ' ' : ch);
            }
        }
        return masked.toString();
    }
}

package com.spreadsheet.drilldown.services;

import com.spreadsheet.drilldown.models.Complexity;
import com.spreadsheet.drilldown.models.FormulaProfile;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores how structurally complex a formula is.
 * Advisory only: the result never decides whether a node can be expanded.
 *
 * SIMPLE   : at most 1 distinct function and 3 references, however deeply parenthesized
 * MODERATE : at most 3 distinct functions, 10 references and 3 levels of parentheses
 * COMPLEX  : anything beyond
 * Lookup-style functions (SUMIF, SUMIFS, VLOOKUP, HLOOKUP, INDEX, MATCH) are never SIMPLE.
 */
@Service
public class ComplexityClassifier {

    private static final Pattern FUNCTION_PATTERN =
            Pattern.compile("(?<![\\p{L}\\p{N}_.$])([A-Za-z_][A-Za-z0-9_.]*)\\s*\\(");

    private static final Set<String> LOOKUP_FUNCTIONS =
            Set.of("SUMIF", "SUMIFS", "VLOOKUP", "HLOOKUP", "INDEX", "MATCH");

    public Complexity classify(String formula, int referenceCount) {
        return profile(formula, referenceCount).getComplexity();
    }

    /**
     * Measures the formula and classifies it. Non-formulas are SIMPLE with zero counts.
     */
    public FormulaProfile profile(String formula, int referenceCount) {
        if (formula == null || !formula.trim().startsWith("=")) {
            return new FormulaProfile(Complexity.SIMPLE, 0, referenceCount, 0, null);
        }
        String body = maskQuotedSheetNames(ReferenceExtractor.maskStringLiterals(formula.trim().substring(1)));

        Set<String> functions = new LinkedHashSet<>();
        String mainFunction = null;
        Matcher matcher = FUNCTION_PATTERN.matcher(body);
        while (matcher.find()) {
            String name = normalizeFunctionName(matcher.group(1));
            functions.add(name);
            if (mainFunction == null && depthAt(body, matcher.start()) == 0) {
                mainFunction = name;
            }
        }
        int nesting = maxNesting(body);

        Complexity complexity;
        if (functions.size() <= 1 && referenceCount <= 3) {
            complexity = Complexity.SIMPLE;
        } else if (functions.size() <= 3 && referenceCount <= 10 && nesting <= 3) {
            complexity = Complexity.MODERATE;
        } else {
            complexity = Complexity.COMPLEX;
        }
        if (complexity == Complexity.SIMPLE && functions.stream().anyMatch(LOOKUP_FUNCTIONS::contains)) {
            complexity = Complexity.MODERATE;
        }
        return new FormulaProfile(complexity, functions.size(), referenceCount, nesting, mainFunction);
    }

    // Newer Excel functions are stored with an "_xlfn." prefix
    private String normalizeFunctionName(String raw) {
        String name = raw.toUpperCase();
        return name.startsWith("_XLFN.") ? name.substring("_XLFN.".length()) : name;
    }

    // 'Budget (2024)'!A1 must not count as a nesting level
    private String maskQuotedSheetNames(String body) {
        StringBuilder masked = new StringBuilder(body.length());
        boolean inName = false;
        for (char ch : body.toCharArray()) {
            if (ch == '\'') {
                inName = !inName;
                masked.append(' ');
            } else {
                masked.append(inName ? ' ' : ch);
            }
        }
        return masked.toString();
    }

    private int maxNesting(String body) {
        int depth = 0;
        int max = 0;
        for (char ch : body.toCharArray()) {
            if (ch == '(') {
                depth++;
                max = Math.max(max, depth);
            } else if (ch == ')' && depth > 0) {
                depth--;
            }
        }
        return max;
    }

    private int depthAt(String body, int position) {
        int depth = 0;
        for (int i = 0; i < position; i++) {
            char ch = body.charAt(i);
            if (ch == '(') {
                depth++;
            } else if (ch == ')' && depth > 0) {
                depth--;
            }
        }
        return depth;
    }
}

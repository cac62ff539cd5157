package com.spreadsheet.drilldown.services;

import com.spreadsheet.drilldown.models.Complexity;
import com.spreadsheet.drilldown.models.FormulaProfile;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityClassifierTest {

    private final ComplexityClassifier classifier = new ComplexityClassifier();

    @Test
    void testArithmeticIsSimple() {
        assertEquals(Complexity.SIMPLE, classifier.classify("=A1+A2", 2));
        assertEquals(Complexity.SIMPLE, classifier.classify("=SUM(A1:A3)", 1));
    }

    /**
     * Extra parentheses around plain arithmetic don't make it harder to read.
     */
    @Test
    void testParenthesizedArithmeticIsSimple() {
        assertEquals(Complexity.SIMPLE, classifier.classify("=((A1+A2)*2)", 2));
        assertEquals(2, classifier.profile("=((A1+A2)*2)", 2).getNestingDepth());
    }

    @Test
    void testFewFunctionsAreModerate() {
        assertEquals(Complexity.MODERATE, classifier.classify("=IF(A1>0,SUM(B1:B3),0)", 2));
    }

    /**
     * Lookups bump an otherwise simple formula.
     */
    @Test
    void testLookupIsNeverSimple() {
        assertEquals(Complexity.MODERATE, classifier.classify("=VLOOKUP(A1,B1:C9,2)", 2));
        assertEquals(Complexity.MODERATE, classifier.classify("=_xlfn.SUMIFS(A1:A9,B1:B9,C1)", 3));
    }

    @Test
    void testDeepNestingIsComplex() {
        String formula = "=IF(A1>0,IF(B1>0,IF(C1>0,ROUND(D1,2),0),0),0)";
        assertEquals(Complexity.COMPLEX, classifier.classify(formula, 4));
    }

    @Test
    void testManyReferencesAreComplex() {
        assertEquals(Complexity.COMPLEX, classifier.classify("=A1+A2+A3+A4+A5+A6+A7+A8+A9+A10+A11", 11));
    }

    /**
     * Profile counts distinct functions and reports the outermost one.
     */
    @Test
    void testProfile() {
        FormulaProfile profile = classifier.profile("=ROUND(SUM(A1:A3)*'Budget (2024)'!B1,2)", 2);

        assertEquals(2, profile.getFunctionCount());
        assertEquals(2, profile.getNestingDepth());
        assertEquals("ROUND", profile.getMainFunction());
        assertEquals(Complexity.MODERATE, profile.getComplexity());
    }

    @Test
    void testNonFormulaIsSimple() {
        FormulaProfile profile = classifier.profile("42", 0);

        assertEquals(Complexity.SIMPLE, profile.getComplexity());
        assertNull(profile.getMainFunction());
        assertEquals(0, profile.getFunctionCount());
    }

    /**
     * Parentheses and function-like text inside string literals don't count.
     */
    @Test
    void testStringLiteralsIgnored() {
        FormulaProfile profile = classifier.profile("=A1&\"SUM(IF(x))\"", 1);

        assertEquals(0, profile.getFunctionCount());
        assertEquals(0, profile.getNestingDepth());
        assertEquals(Complexity.SIMPLE, profile.getComplexity());
    }
}

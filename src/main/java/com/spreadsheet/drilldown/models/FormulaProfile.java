package com.spreadsheet.drilldown.models;

/**
 * Structural measurements of a formula and the complexity derived from them.
 */
public class FormulaProfile {
    private final Complexity complexity;
    private final int functionCount;
    private final int referenceCount;
    private final int nestingDepth;
    private final String mainFunction;

    public FormulaProfile(Complexity complexity, int functionCount, int referenceCount,
                          int nestingDepth, String mainFunction) {
        this.complexity = complexity;
        this.functionCount = functionCount;
        this.referenceCount = referenceCount;
        this.nestingDepth = nestingDepth;
        this.mainFunction = mainFunction;
    }

    public Complexity getComplexity() {
        return complexity;
    }

    public int getFunctionCount() {
        return functionCount;
    }

    public int getReferenceCount() {
        return referenceCount;
    }

    public int getNestingDepth() {
        return nestingDepth;
    }

    // Outermost function, e.g. SUM for =SUM(A1:A3)*2
    public String getMainFunction() {
        return mainFunction;
    }
}

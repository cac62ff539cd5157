package com.spreadsheet.drilldown.models;

/**
 * Formula profile of a single cell, computed without building a tree.
 */
public class CellInfo {
    private String sheet;
    private String address;
    private Double value;
    private String text;
    private String formula;
    private boolean canDrillDown;
    private Complexity complexity = Complexity.SIMPLE;
    private int referenceCount;
    private String mainFunction;
    private boolean hasCrossSheetRefs;
    private boolean hasExternalRefs;

    public CellInfo(String sheet, String address) {
        this.sheet = sheet;
        this.address = address;
    }

    public String getSheet() {
        return sheet;
    }

    public String getAddress() {
        return address;
    }

    public Double getValue() {
        return value;
    }

    public void setValue(Double value) {
        this.value = value;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getFormula() {
        return formula;
    }

    public void setFormula(String formula) {
        this.formula = formula;
    }

    public boolean isCanDrillDown() {
        return canDrillDown;
    }

    public void setCanDrillDown(boolean canDrillDown) {
        this.canDrillDown = canDrillDown;
    }

    public Complexity getComplexity() {
        return complexity;
    }

    public void setComplexity(Complexity complexity) {
        this.complexity = complexity;
    }

    public int getReferenceCount() {
        return referenceCount;
    }

    public void setReferenceCount(int referenceCount) {
        this.referenceCount = referenceCount;
    }

    public String getMainFunction() {
        return mainFunction;
    }

    public void setMainFunction(String mainFunction) {
        this.mainFunction = mainFunction;
    }

    public boolean isHasCrossSheetRefs() {
        return hasCrossSheetRefs;
    }

    public void setHasCrossSheetRefs(boolean hasCrossSheetRefs) {
        this.hasCrossSheetRefs = hasCrossSheetRefs;
    }

    public boolean isHasExternalRefs() {
        return hasExternalRefs;
    }

    public void setHasExternalRefs(boolean hasExternalRefs) {
        this.hasExternalRefs = hasExternalRefs;
    }
}

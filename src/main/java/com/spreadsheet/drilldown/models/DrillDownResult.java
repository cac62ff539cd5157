package com.spreadsheet.drilldown.models;

import java.util.List;

/**
 * First-level drill-down of a user-chosen root cell.
 */
public class DrillDownResult {
    private final String sourceCell;
    private final Double sourceValue;
    private final String sourceFormula;
    private final String rootPathId;
    private final Complexity complexity;
    private final List<DependencyNode> dependencies;

    public DrillDownResult(String sourceCell, Double sourceValue, String sourceFormula, String rootPathId,
                           Complexity complexity, List<DependencyNode> dependencies) {
        this.sourceCell = sourceCell;
        this.sourceValue = sourceValue;
        this.sourceFormula = sourceFormula;
        this.rootPathId = rootPathId;
        this.complexity = complexity;
        this.dependencies = dependencies;
    }

    public String getSourceCell() {
        return sourceCell;
    }

    public Double getSourceValue() {
        return sourceValue;
    }

    public String getSourceFormula() {
        return sourceFormula;
    }

    public String getRootPathId() {
        return rootPathId;
    }

    public Complexity getComplexity() {
        return complexity;
    }

    public List<DependencyNode> getDependencies() {
        return dependencies;
    }

    public int getTotalDependencies() {
        return dependencies.size();
    }
}

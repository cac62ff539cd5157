package com.spreadsheet.drilldown.config;

import com.spreadsheet.drilldown.models.NamingMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Limits and defaults of the drill-down engine, bound from "drilldown.*".
 */
@ConfigurationProperties(prefix = "drilldown")
public class DrillDownProperties {

    // Nodes at this depth are never expandable
    private int maxDepth = 50;
    // Larger ranges collapse into a single summary node
    private int maxRangeCells = 50;
    private int maxRowValueColumns = 50;
    private NamingMode defaultNamingMode = NamingMode.COMPONENT;

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public int getMaxRangeCells() {
        return maxRangeCells;
    }

    public void setMaxRangeCells(int maxRangeCells) {
        this.maxRangeCells = maxRangeCells;
    }

    public int getMaxRowValueColumns() {
        return maxRowValueColumns;
    }

    public void setMaxRowValueColumns(int maxRowValueColumns) {
        this.maxRowValueColumns = maxRowValueColumns;
    }

    public NamingMode getDefaultNamingMode() {
        return defaultNamingMode;
    }

    public void setDefaultNamingMode(NamingMode defaultNamingMode) {
        this.defaultNamingMode = defaultNamingMode;
    }
}

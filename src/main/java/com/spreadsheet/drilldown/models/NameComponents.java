package com.spreadsheet.drilldown.models;

/**
 * The parts a component-mode name is built from, in their fixed join order.
 */
public class NameComponents {
    private final String contextText;
    private final String rowValueLabel;
    private final String columnValueLabel;

    public NameComponents(String contextText, String rowValueLabel, String columnValueLabel) {
        this.contextText = contextText;
        this.rowValueLabel = rowValueLabel;
        this.columnValueLabel = columnValueLabel;
    }

    public String getContextText() {
        return contextText;
    }

    public String getRowValueLabel() {
        return rowValueLabel;
    }

    public String getColumnValueLabel() {
        return columnValueLabel;
    }

    /**
     * Space-joins the non-empty parts; null when every part is empty.
     */
    public String join() {
        StringBuilder name = new StringBuilder();
        for (String part : new String[]{contextText, rowValueLabel, columnValueLabel}) {
            if (part != null && !part.isBlank()) {
                if (name.length() > 0) {
                    name.append(' ');
                }
                name.append(part.trim());
            }
        }
        return name.length() == 0 ? null : name.toString();
    }
}

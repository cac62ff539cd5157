package com.spreadsheet.drilldown.models;

/**
 * Everything the user or the AI collaborator has said about how one cell should be named.
 * Created lazily the first time a cell is configured or named; lives as long as its session.
 */
public class CellNameOverride {
    private String contextText;
    private String rowValueLabel;
    private String columnValueLabel;
    // Version of the sheet config the labels were derived from; -1 = never derived
    private long labelsVersion = -1;
    private String manualName;
    private String editedName;
    private boolean manuallyEdited;
    private AiSuggestion aiSuggestion;

    public String getContextText() {
        return contextText;
    }

    public void setContextText(String contextText) {
        this.contextText = contextText;
    }

    public String getRowValueLabel() {
        return rowValueLabel;
    }

    public String getColumnValueLabel() {
        return columnValueLabel;
    }

    public long getLabelsVersion() {
        return labelsVersion;
    }

    /**
     * Replaces both cached labels at once, tagging them with the config version they came from.
     */
    public void cacheLabels(String rowValueLabel, String columnValueLabel, long version) {
        this.rowValueLabel = rowValueLabel;
        this.columnValueLabel = columnValueLabel;
        this.labelsVersion = version;
    }

    public String getManualName() {
        return manualName;
    }

    public void setManualName(String manualName) {
        this.manualName = manualName;
    }

    public String getEditedName() {
        return editedName;
    }

    public boolean isManuallyEdited() {
        return manuallyEdited;
    }

    public void markManualEdit(String editedName) {
        this.editedName = editedName;
        this.manuallyEdited = editedName != null && !editedName.isBlank();
    }

    public AiSuggestion getAiSuggestion() {
        return aiSuggestion;
    }

    public void setAiSuggestion(AiSuggestion aiSuggestion) {
        this.aiSuggestion = aiSuggestion;
    }
}

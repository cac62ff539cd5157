package com.spreadsheet.drilldown.models;

/**
 * A name suggested by the external AI collaborator for one cell.
 * Failures are recorded with status FAILED instead of being thrown.
 */
public class AiSuggestion {
    private final String suggestedName;
    private final double confidence;
    private final AiStatus status;
    private final String errorMessage;

    public AiSuggestion(String suggestedName, double confidence, AiStatus status, String errorMessage) {
        this.suggestedName = suggestedName;
        this.confidence = confidence;
        this.status = status;
        this.errorMessage = errorMessage;
    }

    public String getSuggestedName() {
        return suggestedName;
    }

    public double getConfidence() {
        return confidence;
    }

    public AiStatus getStatus() {
        return status;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public boolean isUsable() {
        return status == AiStatus.SUCCESS && suggestedName != null && !suggestedName.isBlank();
    }
}

package com.spreadsheet.drilldown.models;

/**
 * Body of POST /api/sessions/{sessionId}/ai-suggestions.
 * Carries the result of the external AI naming call for one cell.
 */
public class AiSuggestionRequest {

    private String cellReference;
    private String suggestedName;
    private double confidence;
    private AiStatus status;
    private String errorMessage;

    public AiSuggestionRequest() {
    }

    public AiSuggestionRequest(String cellReference, String suggestedName, double confidence, AiStatus status) {
        this.cellReference = cellReference;
        this.suggestedName = suggestedName;
        this.confidence = confidence;
        this.status = status;
    }

    public String getCellReference() {
        return cellReference;
    }

    public void setCellReference(String cellReference) {
        this.cellReference = cellReference;
    }

    public String getSuggestedName() {
        return suggestedName;
    }

    public void setSuggestedName(String suggestedName) {
        this.suggestedName = suggestedName;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public AiStatus getStatus() {
        return status;
    }

    public void setStatus(AiStatus status) {
        this.status = status;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }
}

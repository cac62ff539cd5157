package com.spreadsheet.drilldown.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of POST /api/sessions/{sessionId}/names/resolve.
 * mode is optional; the session's current mode is used when absent.
 */
public class ResolveNamesRequest {

    private List<String> cellReferences = new ArrayList<>();
    private NamingMode mode;

    public List<String> getCellReferences() {
        return cellReferences;
    }

    public void setCellReferences(List<String> cellReferences) {
        this.cellReferences = cellReferences;
    }

    public NamingMode getMode() {
        return mode;
    }

    public void setMode(NamingMode mode) {
        this.mode = mode;
    }
}

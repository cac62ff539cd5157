package com.spreadsheet.drilldown.models;

import java.time.Instant;
import java.util.List;

public class SessionInfo {
    private final String sessionId;
    private final String filename;
    private final Instant uploadTime;
    private final List<String> sheets;

    public SessionInfo(String sessionId, String filename, Instant uploadTime, List<String> sheets) {
        this.sessionId = sessionId;
        this.filename = filename;
        this.uploadTime = uploadTime;
        this.sheets = sheets;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getFilename() {
        return filename;
    }

    public Instant getUploadTime() {
        return uploadTime;
    }

    public List<String> getSheets() {
        return sheets;
    }
}

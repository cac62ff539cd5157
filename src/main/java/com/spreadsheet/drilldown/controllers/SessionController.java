package com.spreadsheet.drilldown.controllers;

import com.spreadsheet.drilldown.exceptions.WorkbookUnreadableException;
import com.spreadsheet.drilldown.models.SessionInfo;
import com.spreadsheet.drilldown.services.SessionService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * REST endpoints for analysis sessions.
 * "/api/sessions" is the base path.
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    @Autowired
    private SessionService sessionService;

    /**
     * POST /api/sessions
     * Multipart form with a "file" part holding an .xlsx/.xls workbook.
     * Returns { sessionId, filename, uploadTime, sheets }.
     * A file that can't be parsed gives 422 and no session.
     */
    @PostMapping(consumes = "multipart/form-data")
    public ResponseEntity<SessionInfo> createSession(@RequestParam("file") MultipartFile file) {
        try (InputStream content = file.getInputStream()) {
            return ResponseEntity.ok(sessionService.createSession(file.getOriginalFilename(), content));
        } catch (IOException e) {
            throw new WorkbookUnreadableException("Could not read uploaded file: " + e.getMessage(), e);
        }
    }

    /**
     * GET /api/sessions/{sessionId}
     */
    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionInfo> getSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.getSessionInfo(sessionId));
    }

    /**
     * GET /api/sessions/{sessionId}/sheets
     * Sheet names in workbook order.
     */
    @GetMapping("/{sessionId}/sheets")
    public ResponseEntity<List<String>> listSheets(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.listSheets(sessionId));
    }

    /**
     * DELETE /api/sessions/{sessionId}
     * Closes the workbook and forgets the session. 404 if it's already gone.
     */
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> closeSession(@PathVariable String sessionId) {
        sessionService.closeSession(sessionId);
        return ResponseEntity.noContent().build();
    }
}

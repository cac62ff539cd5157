package com.spreadsheet.drilldown.controllers;

import com.spreadsheet.drilldown.exceptions.InvalidConfigurationException;
import com.spreadsheet.drilldown.models.AiSuggestionRequest;
import com.spreadsheet.drilldown.models.NamingMode;
import com.spreadsheet.drilldown.models.ResolveNamesRequest;
import com.spreadsheet.drilldown.models.ResolvedName;
import com.spreadsheet.drilldown.models.RowValue;
import com.spreadsheet.drilldown.models.SheetNamingConfig;
import com.spreadsheet.drilldown.services.NamingService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for display names: sheet label configuration,
 * per-cell overrides, AI suggestion ingestion and bulk resolution.
 */
@RestController
@RequestMapping("/api/sessions/{sessionId}")
public class NamingController {

    @Autowired
    private NamingService namingService;

    /**
     * PUT /api/sessions/{sessionId}/sheets/{sheet}/naming/label-column
     * Body: { "column": "B" }
     */
    @PutMapping("/sheets/{sheet}/naming/label-column")
    public ResponseEntity<SheetNamingConfig> configureLabelColumn(@PathVariable String sessionId,
                                                                  @PathVariable String sheet,
                                                                  @RequestBody Map<String, String> request) {
        return ResponseEntity.ok(namingService.configureSheetLabelColumn(sessionId, sheet, request.get("column")));
    }

    /**
     * PUT /api/sessions/{sessionId}/sheets/{sheet}/naming/label-row
     * Body: { "row": 1 }
     */
    @PutMapping("/sheets/{sheet}/naming/label-row")
    public ResponseEntity<SheetNamingConfig> configureLabelRow(@PathVariable String sessionId,
                                                               @PathVariable String sheet,
                                                               @RequestBody Map<String, Integer> request) {
        Integer row = request.get("row");
        if (row == null) {
            throw new InvalidConfigurationException("Missing 'row'");
        }
        return ResponseEntity.ok(namingService.configureSheetLabelRow(sessionId, sheet, row));
    }

    /**
     * GET /api/sessions/{sessionId}/naming-config
     * Returns { sheet: { labelColumn, labelRow } } for every configured sheet.
     */
    @GetMapping("/naming-config")
    public ResponseEntity<Map<String, SheetNamingConfig>> getNamingConfig(@PathVariable String sessionId) {
        return ResponseEntity.ok(namingService.getNamingConfig(sessionId));
    }

    /**
     * PUT /api/sessions/{sessionId}/naming-mode
     * Body: { "mode": "component" | "generated" }
     */
    @PutMapping("/naming-mode")
    public ResponseEntity<Void> setNamingMode(@PathVariable String sessionId,
                                              @RequestBody Map<String, NamingMode> request) {
        NamingMode mode = request.get("mode");
        if (mode == null) {
            throw new InvalidConfigurationException("Missing 'mode'");
        }
        namingService.setNamingMode(sessionId, mode);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /api/sessions/{sessionId}/sheets/{sheet}/rows/{row}
     * Non-empty cells of the row, to help pick a label column.
     */
    @GetMapping("/sheets/{sheet}/rows/{row}")
    public ResponseEntity<List<RowValue>> getRowValues(@PathVariable String sessionId,
                                                       @PathVariable String sheet,
                                                       @PathVariable int row) {
        return ResponseEntity.ok(namingService.getRowValues(sessionId, sheet, row));
    }

    /**
     * PUT /api/sessions/{sessionId}/sheets/{sheet}/cells/{address}/context-text
     * Body: { "text": "..." }. Blank text clears it.
     */
    @PutMapping("/sheets/{sheet}/cells/{address}/context-text")
    public ResponseEntity<ResolvedName> setContextText(@PathVariable String sessionId,
                                                       @PathVariable String sheet,
                                                       @PathVariable String address,
                                                       @RequestBody Map<String, String> request) {
        return ResponseEntity.ok(namingService.setContextText(sessionId, sheet, address, request.get("text")));
    }

    /**
     * PUT /api/sessions/{sessionId}/sheets/{sheet}/cells/{address}/manual-name
     * Body: { "name": "..." }. Wins over every other source in both modes.
     */
    @PutMapping("/sheets/{sheet}/cells/{address}/manual-name")
    public ResponseEntity<ResolvedName> setManualName(@PathVariable String sessionId,
                                                      @PathVariable String sheet,
                                                      @PathVariable String address,
                                                      @RequestBody Map<String, String> request) {
        return ResponseEntity.ok(namingService.setManualName(sessionId, sheet, address, request.get("name")));
    }

    /**
     * PUT /api/sessions/{sessionId}/sheets/{sheet}/cells/{address}/manual-edit
     * Body: { "name": "..." }. The user's correction of a generated name.
     */
    @PutMapping("/sheets/{sheet}/cells/{address}/manual-edit")
    public ResponseEntity<ResolvedName> markManualEdit(@PathVariable String sessionId,
                                                       @PathVariable String sheet,
                                                       @PathVariable String address,
                                                       @RequestBody Map<String, String> request) {
        return ResponseEntity.ok(namingService.markManualEdit(sessionId, sheet, address, request.get("name")));
    }

    /**
     * POST /api/sessions/{sessionId}/ai-suggestions
     * Body: { cellReference, suggestedName, confidence, status, errorMessage }
     */
    @PostMapping("/ai-suggestions")
    public ResponseEntity<ResolvedName> recordAiSuggestion(@PathVariable String sessionId,
                                                           @RequestBody AiSuggestionRequest request) {
        return ResponseEntity.ok(namingService.recordAiSuggestion(sessionId, request.getCellReference(),
                request.getSuggestedName(), request.getConfidence(), request.getStatus(),
                request.getErrorMessage()));
    }

    /**
     * POST /api/sessions/{sessionId}/names/resolve
     * Body: { "cellReferences": ["Sheet1!A1", ...], "mode": optional }
     * Returns { cellRef: { name, source, confidence, components } } in request order.
     */
    @PostMapping("/names/resolve")
    public ResponseEntity<Map<String, ResolvedName>> resolveNames(@PathVariable String sessionId,
                                                                  @RequestBody ResolveNamesRequest request) {
        return ResponseEntity.ok(namingService.resolveNames(sessionId, request.getCellReferences(),
                request.getMode()));
    }

    /**
     * GET /api/sessions/{sessionId}/sheets/{sheet}/processed-cells
     * Cells that already carry an AI result or a manual edit.
     */
    @GetMapping("/sheets/{sheet}/processed-cells")
    public ResponseEntity<List<String>> getProcessedCells(@PathVariable String sessionId,
                                                          @PathVariable String sheet) {
        return ResponseEntity.ok(namingService.getProcessedCells(sessionId, sheet));
    }

    /**
     * POST /api/sessions/{sessionId}/names/unprocessed
     * Body: ["Sheet1!A1", ...]. Returns the references still needing an AI suggestion.
     */
    @PostMapping("/names/unprocessed")
    public ResponseEntity<List<String>> filterUnprocessed(@PathVariable String sessionId,
                                                          @RequestBody List<String> cellReferences) {
        return ResponseEntity.ok(namingService.filterUnprocessed(sessionId, cellReferences));
    }
}

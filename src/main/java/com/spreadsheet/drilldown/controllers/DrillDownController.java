package com.spreadsheet.drilldown.controllers;

import com.spreadsheet.drilldown.models.CellInfo;
import com.spreadsheet.drilldown.models.DependencyNode;
import com.spreadsheet.drilldown.models.DrillDownResult;
import com.spreadsheet.drilldown.services.DrillDownService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST endpoints for exploring a cell's dependencies.
 * Everything lives under "/api/sessions/{sessionId}".
 */
@RestController
@RequestMapping("/api/sessions/{sessionId}")
public class DrillDownController {

    @Autowired
    private DrillDownService drillDownService;

    /**
     * GET /api/sessions/{sessionId}/sheets/{sheet}/cells/{address}
     * Value, formula and complexity profile of one cell. No tree is built.
     */
    @GetMapping("/sheets/{sheet}/cells/{address}")
    public ResponseEntity<CellInfo> analyzeCell(@PathVariable String sessionId,
                                                @PathVariable String sheet,
                                                @PathVariable String address) {
        return ResponseEntity.ok(drillDownService.analyzeCell(sessionId, sheet, address));
    }

    /**
     * POST /api/sessions/{sessionId}/sheets/{sheet}/cells/{address}/drill-down
     * Starts a new drill-down at the cell, replacing the session's previous tree.
     * Returns the root's value/formula and its first level of dependencies.
     */
    @PostMapping("/sheets/{sheet}/cells/{address}/drill-down")
    public ResponseEntity<DrillDownResult> drillDown(@PathVariable String sessionId,
                                                     @PathVariable String sheet,
                                                     @PathVariable String address) {
        return ResponseEntity.ok(drillDownService.drillDown(sessionId, sheet, address));
    }

    /**
     * POST /api/sessions/{sessionId}/sheets/{sheet}/cells/{address}/expand/{pathId}
     * Expands one visible occurrence of the cell. 404 if pathId isn't that occurrence.
     */
    @PostMapping("/sheets/{sheet}/cells/{address}/expand/{pathId}")
    public ResponseEntity<List<DependencyNode>> expandCell(@PathVariable String sessionId,
                                                           @PathVariable String sheet,
                                                           @PathVariable String address,
                                                           @PathVariable String pathId) {
        return ResponseEntity.ok(drillDownService.expand(sessionId, sheet, address, pathId));
    }

    /**
     * POST /api/sessions/{sessionId}/nodes/{pathId}/expand
     * Children of the node. Leaves and blocked nodes give an empty list.
     */
    @PostMapping("/nodes/{pathId}/expand")
    public ResponseEntity<List<DependencyNode>> expand(@PathVariable String sessionId,
                                                       @PathVariable String pathId) {
        return ResponseEntity.ok(drillDownService.expand(sessionId, pathId));
    }

    /**
     * POST /api/sessions/{sessionId}/nodes/{pathId}/collapse
     */
    @PostMapping("/nodes/{pathId}/collapse")
    public ResponseEntity<Void> collapse(@PathVariable String sessionId, @PathVariable String pathId) {
        drillDownService.collapse(sessionId, pathId);
        return ResponseEntity.ok().build();
    }
}

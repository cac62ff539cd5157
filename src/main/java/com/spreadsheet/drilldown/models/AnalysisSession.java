package com.spreadsheet.drilldown.models;

import com.spreadsheet.drilldown.workbook.WorkbookAccessor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * State of one analysis session:
 * - the open workbook handle
 * - per-sheet naming configuration
 * - per-cell naming overrides and AI results
 * - the drill-down tree currently being explored
 * - a lock serializing every read/expand against the workbook handle
 * Nothing here is shared between sessions.
 */
public class AnalysisSession {

    private final String id;
    private final String filename;
    private final Instant uploadTime;
    private final WorkbookAccessor workbook;

    private final Map<String, SheetNamingConfig> namingConfigs = new LinkedHashMap<>();
    private final Map<CellAddress, CellNameOverride> overrides = new LinkedHashMap<>();
    private DrillDownTree tree;
    private NamingMode namingMode;

    // One in-flight operation per session; fair so clicks are served in arrival order
    private final ReentrantLock lock = new ReentrantLock(true);
    private volatile String unusableReason;

    public AnalysisSession(String id, String filename, WorkbookAccessor workbook, NamingMode namingMode) {
        this.id = id;
        this.filename = filename;
        this.workbook = workbook;
        this.namingMode = namingMode;
        this.uploadTime = Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getFilename() {
        return filename;
    }

    public Instant getUploadTime() {
        return uploadTime;
    }

    public WorkbookAccessor getWorkbook() {
        return workbook;
    }

    public Map<String, SheetNamingConfig> getNamingConfigs() {
        return namingConfigs;
    }

    public SheetNamingConfig getNamingConfig(String sheet) {
        return namingConfigs.get(sheet);
    }

    public SheetNamingConfig namingConfigFor(String sheet) {
        return namingConfigs.computeIfAbsent(sheet, k -> new SheetNamingConfig());
    }

    public Map<CellAddress, CellNameOverride> getOverrides() {
        return overrides;
    }

    public CellNameOverride getOverride(CellAddress cell) {
        return overrides.get(cell);
    }

    public CellNameOverride overrideFor(CellAddress cell) {
        return overrides.computeIfAbsent(cell, k -> new CellNameOverride());
    }

    public DrillDownTree getTree() {
        return tree;
    }

    public void setTree(DrillDownTree tree) {
        this.tree = tree;
    }

    public NamingMode getNamingMode() {
        return namingMode;
    }

    public void setNamingMode(NamingMode namingMode) {
        this.namingMode = namingMode;
    }

    public ReentrantLock getLock() {
        return lock;
    }

    public boolean isUsable() {
        return unusableReason == null;
    }

    public String getUnusableReason() {
        return unusableReason;
    }

    public void markUnusable(String reason) {
        this.unusableReason = reason;
    }
}

package com.spreadsheet.drilldown.services;

import com.spreadsheet.drilldown.config.DrillDownProperties;
import com.spreadsheet.drilldown.exceptions.InvalidCellAddressException;
import com.spreadsheet.drilldown.exceptions.InvalidConfigurationException;
import com.spreadsheet.drilldown.models.AiStatus;
import com.spreadsheet.drilldown.models.AiSuggestion;
import com.spreadsheet.drilldown.models.AnalysisSession;
import com.spreadsheet.drilldown.models.CellAddress;
import com.spreadsheet.drilldown.models.CellNameOverride;
import com.spreadsheet.drilldown.models.DependencyNode;
import com.spreadsheet.drilldown.models.DrillDownTree;
import com.spreadsheet.drilldown.models.NameSource;
import com.spreadsheet.drilldown.models.NamingMode;
import com.spreadsheet.drilldown.models.ResolvedName;
import com.spreadsheet.drilldown.models.RowValue;
import com.spreadsheet.drilldown.models.SheetNamingConfig;
import com.spreadsheet.drilldown.workbook.SheetBounds;
import com.spreadsheet.drilldown.workbook.WorkbookAccessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Session-scoped naming: sheet label configuration, per-cell overrides,
 * AI suggestion ingestion, and resolution of display names.
 * Changing a sheet's label column/row re-resolves every materialized node of that sheet;
 * per-cell settings only touch nodes standing for that one cell.
 */
@Service
public class NamingService {

    private static final Logger logger = LoggerFactory.getLogger(NamingService.class);

    private final SessionService sessionService;
    private final NameResolver nameResolver;
    private final DrillDownProperties properties;

    public NamingService(SessionService sessionService, NameResolver nameResolver, DrillDownProperties properties) {
        this.sessionService = sessionService;
        this.nameResolver = nameResolver;
        this.properties = properties;
    }

    // ----------------------------------------------------------------
    // Sheet configuration
    // ----------------------------------------------------------------

    /**
     * Uses the given column's value in each row as that row's label.
     * Rejected (no state change) when the column is malformed or outside the sheet's used area.
     */
    public SheetNamingConfig configureSheetLabelColumn(String sessionId, String sheet, String column) {
        return sessionService.withSession(sessionId, session -> {
            sessionService.requireSheet(session, sheet);
            String letters = column == null ? "" : column.trim().toUpperCase();
            if (!letters.matches("[A-Z]{1,3}")) {
                throw new InvalidConfigurationException("Label column '" + column + "' is not a column letter");
            }
            SheetBounds bounds = session.getWorkbook().getSheetBounds(sheet);
            if (bounds == null || !bounds.containsColumn(CellAddress.columnIndex(letters))) {
                throw new InvalidConfigurationException("Label column " + letters
                        + " is outside the used area of sheet '" + sheet + "'");
            }

            SheetNamingConfig config = session.namingConfigFor(sheet);
            config.setLabelColumn(letters);
            logger.info("Session {}: sheet '{}' now labels rows from column {}", sessionId, sheet, letters);
            propagate(session, sheet);
            return config;
        });
    }

    /**
     * Uses the given row's value in each column as that column's label.
     */
    public SheetNamingConfig configureSheetLabelRow(String sessionId, String sheet, int row) {
        return sessionService.withSession(sessionId, session -> {
            sessionService.requireSheet(session, sheet);
            SheetBounds bounds = session.getWorkbook().getSheetBounds(sheet);
            if (bounds == null || !bounds.containsRow(row)) {
                throw new InvalidConfigurationException("Label row " + row
                        + " is outside the used area of sheet '" + sheet + "'");
            }

            SheetNamingConfig config = session.namingConfigFor(sheet);
            config.setLabelRow(row);
            logger.info("Session {}: sheet '{}' now labels columns from row {}", sessionId, sheet, row);
            propagate(session, sheet);
            return config;
        });
    }

    public Map<String, SheetNamingConfig> getNamingConfig(String sessionId) {
        return sessionService.withSession(sessionId, session -> new LinkedHashMap<>(session.getNamingConfigs()));
    }

    public void setNamingMode(String sessionId, NamingMode mode) {
        sessionService.withSession(sessionId, session -> {
            session.setNamingMode(mode);
            DrillDownTree tree = session.getTree();
            if (tree != null) {
                decorate(session, tree.nodes());
            }
            return null;
        });
    }

    // ----------------------------------------------------------------
    // Per-cell overrides
    // ----------------------------------------------------------------

    public ResolvedName setContextText(String sessionId, String sheet, String address, String text) {
        return updateCell(sessionId, sheet, address, override -> override.setContextText(blankToNull(text)));
    }

    public ResolvedName setManualName(String sessionId, String sheet, String address, String name) {
        return updateCell(sessionId, sheet, address, override -> override.setManualName(blankToNull(name)));
    }

    /**
     * Records a user edit of a generated name; it wins over AI suggestions in generated mode.
     */
    public ResolvedName markManualEdit(String sessionId, String sheet, String address, String name) {
        return updateCell(sessionId, sheet, address, override -> override.markManualEdit(blankToNull(name)));
    }

    /**
     * Stores the externally computed AI name of one cell. Failures arrive with status FAILED
     * and simply leave the AI tier empty.
     */
    public ResolvedName recordAiSuggestion(String sessionId, String cellReference, String suggestion,
                                           double confidence, AiStatus status, String errorMessage) {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new InvalidConfigurationException("Confidence must be between 0 and 1, got " + confidence);
        }
        CellAddress cell = CellAddress.parseQualified(cellReference);
        AiStatus effective = status == null ? AiStatus.FAILED : status;
        AiSuggestion result = new AiSuggestion(suggestion, confidence, effective, errorMessage);
        if (effective == AiStatus.FAILED) {
            logger.warn("AI naming failed for {}: {}", cell, errorMessage);
        }
        return updateCell(sessionId, cell.getSheet(), cell.getAddress(), override -> override.setAiSuggestion(result));
    }

    // ----------------------------------------------------------------
    // Resolution
    // ----------------------------------------------------------------

    /**
     * Bulk re-resolution, e.g. after a configuration change. Unparseable references
     * resolve to themselves with source FALLBACK; this never fails for a reference.
     * A null list resolves nothing.
     *
     * @param mode naming mode, or null for the session's current mode
     */
    public Map<String, ResolvedName> resolveNames(String sessionId, List<String> cellReferences, NamingMode mode) {
        return sessionService.withSession(sessionId, session -> {
            NamingMode effective = mode != null ? mode : session.getNamingMode();
            Map<String, ResolvedName> results = new LinkedHashMap<>();
            for (String reference : orEmpty(cellReferences)) {
                CellAddress cell;
                try {
                    cell = CellAddress.parseQualified(reference);
                } catch (InvalidCellAddressException ex) {
                    logger.debug("Resolving unparseable reference '{}' to itself", reference);
                    results.put(reference, nameResolver.resolve(reference, null, effective));
                    continue;
                }
                results.put(reference, resolve(session, cell, effective));
            }
            return results;
        });
    }

    /**
     * Names one cell, deriving its row/column labels first if the sheet config changed since.
     * Caller must hold the session lock.
     */
    public ResolvedName resolve(AnalysisSession session, CellAddress cell, NamingMode mode) {
        refreshLabels(session, cell);
        return nameResolver.resolve(cell.toString(), session.getOverride(cell), mode);
    }

    /**
     * Attaches display names to nodes in the session's current mode.
     * Caller must hold the session lock.
     */
    public void decorate(AnalysisSession session, Collection<DependencyNode> nodes) {
        for (DependencyNode node : nodes) {
            if (node.getCellReference().isExternal() || node.getCellReference().isRange()) {
                node.setName(new ResolvedName(node.getCellReference().toString(), NameSource.FALLBACK, null, null));
            } else {
                node.setName(resolve(session, node.getCell(), session.getNamingMode()));
            }
        }
    }

    // ----------------------------------------------------------------
    // Lookups feeding the UI and the external AI collaborator
    // ----------------------------------------------------------------

    /**
     * Non-empty cells of one row, candidates for a label column.
     */
    public List<RowValue> getRowValues(String sessionId, String sheet, int row) {
        return sessionService.withSession(sessionId, session -> {
            sessionService.requireSheet(session, sheet);
            WorkbookAccessor workbook = session.getWorkbook();
            SheetBounds bounds = workbook.getSheetBounds(sheet);
            List<RowValue> values = new ArrayList<>();
            if (row < 1 || bounds == null) {
                return values;
            }
            int lastColumn = Math.min(bounds.getMaxColumn(), properties.getMaxRowValueColumns());
            for (int col = 1; col <= lastColumn; col++) {
                String letters = CellAddress.columnLetters(col);
                String text = workbook.getText(sheet, letters + row);
                if (text != null) {
                    values.add(new RowValue(letters, text));
                }
            }
            return values;
        });
    }

    /**
     * Cells of a sheet that already have an AI result or a manual edit.
     */
    public List<String> getProcessedCells(String sessionId, String sheet) {
        return sessionService.withSession(sessionId, session -> {
            List<String> processed = new ArrayList<>();
            for (Map.Entry<CellAddress, CellNameOverride> entry : session.getOverrides().entrySet()) {
                if (entry.getKey().getSheet().equals(sheet) && isProcessed(entry.getValue())) {
                    processed.add(entry.getKey().toString());
                }
            }
            return processed;
        });
    }

    /**
     * The references that still need an AI suggestion, in the order given.
     */
    public List<String> filterUnprocessed(String sessionId, List<String> cellReferences) {
        return sessionService.withSession(sessionId, session -> {
            List<String> pending = new ArrayList<>();
            for (String reference : orEmpty(cellReferences)) {
                CellAddress cell = parseOrNull(reference);
                if (cell == null) {
                    logger.debug("Ignoring unparseable reference '{}'", reference);
                    continue;
                }
                CellNameOverride override = session.getOverride(cell);
                if (override == null || !isProcessed(override)) {
                    pending.add(reference);
                }
            }
            return pending;
        });
    }

    // ----------------------------------------------------------------
    // Internal helpers
    // ----------------------------------------------------------------

    private ResolvedName updateCell(String sessionId, String sheet, String address,
                                    Consumer<CellNameOverride> change) {
        return sessionService.withSession(sessionId, session -> {
            sessionService.requireSheet(session, sheet);
            CellAddress cell = CellAddress.parse(sheet, address);
            change.accept(session.overrideFor(cell));

            // Only the occurrences of this one cell change; siblings keep their names
            DrillDownTree tree = session.getTree();
            if (tree != null) {
                List<DependencyNode> occurrences = new ArrayList<>();
                for (DependencyNode node : tree.nodes()) {
                    if (!node.getCellReference().isExternal() && !node.getCellReference().isRange()
                            && node.getCell().equals(cell)) {
                        occurrences.add(node);
                    }
                }
                decorate(session, occurrences);
            }
            return resolve(session, cell, session.getNamingMode());
        });
    }

    /**
     * Recomputes cached labels for every visible node of the sheet, so the next
     * read of any of them reflects the new configuration without re-expanding.
     */
    private void propagate(AnalysisSession session, String sheet) {
        DrillDownTree tree = session.getTree();
        if (tree == null) {
            return;
        }
        List<DependencyNode> affected = tree.nodesOnSheet(sheet);
        decorate(session, affected);
        logger.debug("Re-resolved {} visible nodes on sheet '{}'", affected.size(), sheet);
    }

    private void refreshLabels(AnalysisSession session, CellAddress cell) {
        SheetNamingConfig config = session.getNamingConfig(cell.getSheet());
        if (config == null) {
            return;
        }
        CellNameOverride override = session.overrideFor(cell);
        if (override.getLabelsVersion() == config.getVersion()) {
            return;
        }
        WorkbookAccessor workbook = session.getWorkbook();
        String rowLabel = null;
        String columnLabel = null;
        if (config.getLabelColumn() != null) {
            rowLabel = workbook.getText(cell.getSheet(), config.getLabelColumn() + cell.getRow());
        }
        if (config.getLabelRow() != null) {
            columnLabel = workbook.getText(cell.getSheet(), cell.getColumn() + config.getLabelRow());
        }
        override.cacheLabels(rowLabel, columnLabel, config.getVersion());
    }

    private static boolean isProcessed(CellNameOverride override) {
        return override.getAiSuggestion() != null || override.isManuallyEdited();
    }

    private static CellAddress parseOrNull(String reference) {
        try {
            return CellAddress.parseQualified(reference);
        } catch (InvalidCellAddressException ex) {
            return null;
        }
    }

    private static List<String> orEmpty(List<String> references) {
        return references == null ? Collections.emptyList() : references;
    }

    private static String blankToNull(String text) {
        return text == null || text.isBlank() ? null : text.trim();
    }
}

package com.spreadsheet.drilldown.services;

import com.spreadsheet.drilldown.config.DrillDownProperties;
import com.spreadsheet.drilldown.models.AnalysisSession;
import com.spreadsheet.drilldown.models.BoundaryMarker;
import com.spreadsheet.drilldown.models.CellAddress;
import com.spreadsheet.drilldown.models.CellReference;
import com.spreadsheet.drilldown.models.DependencyNode;
import com.spreadsheet.drilldown.models.ExpansionPath;
import com.spreadsheet.drilldown.workbook.WorkbookAccessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds one level of a drill-down tree at a time.
 * Every node is an occurrence on a specific path, never a shared per-cell node.
 * The builder only creates new nodes; attaching them to a tree is the caller's job,
 * so a failed build leaves existing tree state untouched.
 */
@Service
public class DependencyTreeBuilder {

    private static final Logger logger = LoggerFactory.getLogger(DependencyTreeBuilder.class);

    private final ReferenceExtractor referenceExtractor;
    private final ComplexityClassifier complexityClassifier;
    private final DrillDownProperties properties;

    public DependencyTreeBuilder(ReferenceExtractor referenceExtractor,
                                 ComplexityClassifier complexityClassifier,
                                 DrillDownProperties properties) {
        this.referenceExtractor = referenceExtractor;
        this.complexityClassifier = complexityClassifier;
        this.properties = properties;
    }

    /**
     * Node for the cell the user chose to drill into (depth 0).
     */
    public DependencyNode createRoot(AnalysisSession session, CellAddress cell) {
        String pathId = pathId("", cell, 0);
        DependencyNode root = new DependencyNode(pathId, null, CellReference.cell(cell, false),
                0, Collections.singletonList(cell));
        readCell(session.getWorkbook(), root, cell);
        if (root.getFormula() != null) {
            root.setLeaf(false);
            root.setCanExpand(true);
        }
        return root;
    }

    /**
     * Immediate dependencies of a cell reached through parentPath, in reference order.
     * Returns an empty list when the cell has no formula.
     */
    public List<DependencyNode> buildLevel(AnalysisSession session, CellAddress cell, ExpansionPath parentPath) {
        WorkbookAccessor workbook = session.getWorkbook();
        String formula = workbook.getFormula(cell.getSheet(), cell.getAddress());
        if (formula == null) {
            return Collections.emptyList();
        }

        List<CellReference> references = referenceExtractor.extract(formula, cell.getSheet());
        int depth = parentPath.childDepth();
        List<DependencyNode> level = new ArrayList<>();

        for (CellReference reference : references) {
            if (reference.isExternal()) {
                DependencyNode node = newNode(parentPath, reference, reference.getAddress(), level.size(), depth);
                node.block(BoundaryMarker.EXTERNAL);
                level.add(node);
            } else if (!workbook.hasSheet(reference.getSheet())) {
                logger.warn("Formula in {} references missing sheet '{}'", cell, reference.getSheet());
                DependencyNode node = newNode(parentPath, reference, reference.getAddress(), level.size(), depth);
                node.block(BoundaryMarker.NOT_FOUND);
                level.add(node);
            } else if (reference.isRange()) {
                addRange(workbook, parentPath, reference, depth, level);
            } else {
                level.add(cellNode(workbook, parentPath, reference, reference.getAddress(), level.size(), depth));
            }
        }

        logger.debug("Built {} dependencies for {} at depth {}", level.size(), cell, depth);
        return level;
    }

    /**
     * Ranges within the enumeration bound become one sibling per cell (row-major);
     * larger ranges collapse into a single non-expandable summary node.
     */
    private void addRange(WorkbookAccessor workbook, ExpansionPath parentPath, CellReference reference,
                          int depth, List<DependencyNode> level) {
        long cellCount = reference.getRange().getCellCount();
        if (cellCount > properties.getMaxRangeCells()) {
            logger.info("Range {} has {} cells, summarizing instead of enumerating", reference, cellCount);
            DependencyNode summary = newNode(parentPath, reference, reference.getAddress(), level.size(), depth);
            summary.setRangeCellCount(cellCount);
            summary.block(BoundaryMarker.RANGE_LIMIT);
            level.add(summary);
            return;
        }
        for (CellAddress member : reference.getRange().cells()) {
            CellReference memberReference = CellReference.cell(member, reference.isCrossSheet());
            level.add(cellNode(workbook, parentPath, memberReference, member, level.size(), depth));
        }
    }

    private DependencyNode cellNode(WorkbookAccessor workbook, ExpansionPath parentPath, CellReference reference,
                                    CellAddress cell, int siblingIndex, int depth) {
        DependencyNode node = newNode(parentPath, reference, cell, siblingIndex, depth);
        readCell(workbook, node, cell);

        if (parentPath.contains(cell)) {
            logger.debug("Cycle at {} on path {}", cell, parentPath.getPathId());
            node.block(BoundaryMarker.CYCLE);
        } else if (node.getFormula() != null) {
            node.setLeaf(false);
            if (depth >= properties.getMaxDepth()) {
                node.block(BoundaryMarker.DEPTH_LIMIT);
            } else {
                node.setCanExpand(true);
            }
        }
        return node;
    }

    private void readCell(WorkbookAccessor workbook, DependencyNode node, CellAddress cell) {
        Object value = workbook.getValue(cell.getSheet(), cell.getAddress());
        if (value instanceof Number) {
            node.setValue(((Number) value).doubleValue());
        }
        node.setText(workbook.getText(cell.getSheet(), cell.getAddress()));

        String formula = workbook.getFormula(cell.getSheet(), cell.getAddress());
        if (formula != null) {
            node.setFormula(formula);
            int referenceCount = referenceExtractor.extract(formula, cell.getSheet()).size();
            node.setComplexity(complexityClassifier.classify(formula, referenceCount));
        }
    }

    private DependencyNode newNode(ExpansionPath parentPath, CellReference reference, CellAddress cell,
                                   int siblingIndex, int depth) {
        String pathId = pathId(parentPath.getPathId(), cell, siblingIndex);
        return new DependencyNode(pathId, parentPath.getPathId(), reference, depth, parentPath.extendedWith(cell));
    }

    /**
     * hash(parentPathId, sheet, address, siblingIndex): 128 bits of SHA-256, hex encoded.
     */
    static String pathId(String parentPathId, CellAddress cell, int siblingIndex) {
        String key = parentPathId + "|" + cell.getSheet() + "|" + cell.getAddress() + "|" + siblingIndex;
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(32);
            for (int i = 0; i < 16; i++) {
                hex.append(String.format("%02x", digest[i]));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

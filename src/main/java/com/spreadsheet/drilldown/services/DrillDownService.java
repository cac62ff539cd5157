package com.spreadsheet.drilldown.services;

import com.spreadsheet.drilldown.exceptions.DependencyNodeNotFoundException;
import com.spreadsheet.drilldown.models.AnalysisSession;
import com.spreadsheet.drilldown.models.CellAddress;
import com.spreadsheet.drilldown.models.CellInfo;
import com.spreadsheet.drilldown.models.CellReference;
import com.spreadsheet.drilldown.models.DependencyNode;
import com.spreadsheet.drilldown.models.DrillDownResult;
import com.spreadsheet.drilldown.models.DrillDownTree;
import com.spreadsheet.drilldown.models.FormulaProfile;
import com.spreadsheet.drilldown.models.NodeState;
import com.spreadsheet.drilldown.workbook.WorkbookAccessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Progressive drill-down over a session's workbook:
 * 1) drillDown builds a fresh tree with the root's first level
 * 2) expand materializes one visible node's children (or re-shows cached ones)
 * 3) collapse hides children without discarding them
 * All three run under the session lock, so reads against one workbook never interleave.
 * Nodes handed back are snapshots; the live tree stays inside the session.
 */
@Service
public class DrillDownService {

    private static final Logger logger = LoggerFactory.getLogger(DrillDownService.class);

    private final SessionService sessionService;
    private final DependencyTreeBuilder treeBuilder;
    private final NamingService namingService;
    private final ReferenceExtractor referenceExtractor;
    private final ComplexityClassifier complexityClassifier;

    public DrillDownService(SessionService sessionService, DependencyTreeBuilder treeBuilder,
                            NamingService namingService, ReferenceExtractor referenceExtractor,
                            ComplexityClassifier complexityClassifier) {
        this.sessionService = sessionService;
        this.treeBuilder = treeBuilder;
        this.namingService = namingService;
        this.referenceExtractor = referenceExtractor;
        this.complexityClassifier = complexityClassifier;
    }

    /**
     * First-level expansion of a user-chosen root. Replaces the session's current tree.
     * A root without a formula yields no dependencies.
     */
    public DrillDownResult drillDown(String sessionId, String sheet, String address) {
        return sessionService.withSession(sessionId, session -> {
            sessionService.requireSheet(session, sheet);
            CellAddress cell = CellAddress.parse(sheet, address);
            logger.info("Session {}: drill-down into {}", sessionId, cell);

            DependencyNode root = treeBuilder.createRoot(session, cell);
            List<DependencyNode> dependencies = treeBuilder.buildLevel(session, cell, root.getPath());

            DrillDownTree tree = new DrillDownTree(root);
            tree.attach(root, dependencies);
            root.setState(NodeState.EXPANDED);
            namingService.decorate(session, tree.nodes());
            // Published last: a failed read or naming step keeps the previous tree
            session.setTree(tree);

            return new DrillDownResult(cell.toString(), root.getValue(), root.getFormula(), root.getPathId(),
                    root.getComplexity(), DependencyNode.snapshotAll(dependencies));
        });
    }

    /**
     * Expands one node of the current tree. Already fetched children are re-shown
     * without touching the workbook; a leaf yields an empty list.
     * On failure the node is left exactly as it was and the error propagates.
     */
    public List<DependencyNode> expand(String sessionId, String pathId) {
        return sessionService.withSession(sessionId, session -> {
            DependencyNode node = findNode(session, pathId);

            if (node.isChildrenFetched()) {
                node.setState(NodeState.EXPANDED);
                return DependencyNode.snapshotAll(node.fetchedChildren());
            }
            if (!node.canExpand()) {
                return List.of();
            }

            node.setState(NodeState.EXPANDING);
            try {
                List<DependencyNode> children = treeBuilder.buildLevel(session, node.getCell(), node.getPath());
                namingService.decorate(session, children);
                // Nothing touches the tree until the children are fully built and named
                session.getTree().attach(node, children);
                node.setState(NodeState.EXPANDED);
                logger.debug("Session {}: expanded {} ({} children)", sessionId, node.getCell(), children.size());
                return DependencyNode.snapshotAll(children);
            } catch (RuntimeException ex) {
                node.setState(NodeState.COLLAPSED);
                throw ex;
            }
        });
    }

    /**
     * Same as expand, but also checks the pathId really stands for (sheet, address).
     */
    public List<DependencyNode> expand(String sessionId, String sheet, String address, String pathId) {
        CellAddress expected = CellAddress.parse(sheet, address);
        return sessionService.withSession(sessionId, session -> {
            DependencyNode node = findNode(session, pathId);
            if (!node.getCell().equals(expected)) {
                throw new DependencyNodeNotFoundException("Node " + pathId + " is not an occurrence of " + expected);
            }
            return expand(sessionId, pathId);
        });
    }

    /**
     * Hides a node's children. They stay in memory for instant re-expansion.
     */
    public void collapse(String sessionId, String pathId) {
        sessionService.withSession(sessionId, session -> {
            DependencyNode node = findNode(session, pathId);
            if (node.getState() == NodeState.EXPANDED) {
                node.setState(NodeState.COLLAPSED);
            }
            return null;
        });
    }

    /**
     * Formula profile of a single cell, without building any tree.
     */
    public CellInfo analyzeCell(String sessionId, String sheet, String address) {
        return sessionService.withSession(sessionId, session -> {
            sessionService.requireSheet(session, sheet);
            CellAddress cell = CellAddress.parse(sheet, address);
            WorkbookAccessor workbook = session.getWorkbook();

            CellInfo info = new CellInfo(sheet, cell.getAddress());
            Object value = workbook.getValue(sheet, cell.getAddress());
            if (value instanceof Number) {
                info.setValue(((Number) value).doubleValue());
            }
            info.setText(workbook.getText(sheet, cell.getAddress()));

            String formula = workbook.getFormula(sheet, cell.getAddress());
            if (formula == null) {
                return info;
            }
            List<CellReference> references = referenceExtractor.extract(formula, sheet);
            FormulaProfile profile = complexityClassifier.profile(formula, references.size());
            boolean external = references.stream().anyMatch(CellReference::isExternal);

            info.setFormula(formula);
            info.setComplexity(profile.getComplexity());
            info.setReferenceCount(references.size());
            info.setMainFunction(profile.getMainFunction());
            info.setHasCrossSheetRefs(references.stream().anyMatch(CellReference::isCrossSheet));
            info.setHasExternalRefs(external);
            info.setCanDrillDown(!references.isEmpty() && !external);
            return info;
        });
    }

    private DependencyNode findNode(AnalysisSession session, String pathId) {
        DrillDownTree tree = session.getTree();
        DependencyNode node = tree == null ? null : tree.find(pathId);
        if (node == null) {
            throw new DependencyNodeNotFoundException("No node " + pathId + " in the current drill-down of session "
                    + session.getId());
        }
        return node;
    }
}

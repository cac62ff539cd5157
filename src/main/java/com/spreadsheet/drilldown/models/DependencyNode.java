package com.spreadsheet.drilldown.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One occurrence of a cell inside a specific expansion path.
 * The same physical cell reached through two parents yields two nodes with
 * different pathIds and independent expand/collapse state.
 * A node exclusively owns its children.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DependencyNode {

    private final String pathId;
    private final String parentPathId;
    private final CellReference cellReference;
    private final int depth;
    // Cells from the drill-down root down to this node, inclusive
    private final List<CellAddress> ancestry;

    private Double value;
    private String text;
    private String formula;
    private Complexity complexity;
    private boolean leaf = true;
    private boolean canExpand;
    private BoundaryMarker marker = BoundaryMarker.NONE;
    private Long rangeCellCount;
    private ResolvedName name;

    private NodeState state = NodeState.COLLAPSED;
    private final List<DependencyNode> children = new ArrayList<>();
    private boolean childrenFetched;

    public DependencyNode(String pathId, String parentPathId, CellReference cellReference,
                          int depth, List<CellAddress> ancestry) {
        this.pathId = pathId;
        this.parentPathId = parentPathId;
        this.cellReference = cellReference;
        this.depth = depth;
        this.ancestry = Collections.unmodifiableList(new ArrayList<>(ancestry));
    }

    public String getPathId() {
        return pathId;
    }

    public String getParentPathId() {
        return parentPathId;
    }

    public CellReference getCellReference() {
        return cellReference;
    }

    public int getDepth() {
        return depth;
    }

    @JsonIgnore
    public List<CellAddress> getAncestry() {
        return ancestry;
    }

    @JsonIgnore
    public ExpansionPath getPath() {
        return new ExpansionPath(pathId, ancestry);
    }

    public Double getValue() {
        return value;
    }

    public void setValue(Double value) {
        this.value = value;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getFormula() {
        return formula;
    }

    public void setFormula(String formula) {
        this.formula = formula;
    }

    public Complexity getComplexity() {
        return complexity;
    }

    public void setComplexity(Complexity complexity) {
        this.complexity = complexity;
    }

    @JsonProperty("isLeaf")
    public boolean isLeaf() {
        return leaf;
    }

    public void setLeaf(boolean leaf) {
        this.leaf = leaf;
    }

    @JsonProperty("canExpand")
    public boolean canExpand() {
        return canExpand;
    }

    public void setCanExpand(boolean canExpand) {
        this.canExpand = canExpand;
    }

    public BoundaryMarker getMarker() {
        return marker;
    }

    /**
     * Marks the node as a deliberate stop: it becomes a non-expandable leaf.
     */
    public void block(BoundaryMarker reason) {
        this.marker = reason;
        this.leaf = true;
        this.canExpand = false;
    }

    public Long getRangeCellCount() {
        return rangeCellCount;
    }

    public void setRangeCellCount(Long rangeCellCount) {
        this.rangeCellCount = rangeCellCount;
    }

    public ResolvedName getName() {
        return name;
    }

    public void setName(ResolvedName name) {
        this.name = name;
    }

    @JsonIgnore
    public NodeState getState() {
        return state;
    }

    public void setState(NodeState state) {
        this.state = state;
    }

    @JsonProperty("expanded")
    public boolean isExpanded() {
        return state == NodeState.EXPANDED;
    }

    /**
     * Children rendered to callers: empty unless the node is expanded.
     */
    @JsonProperty("children")
    public List<DependencyNode> getVisibleChildren() {
        return isExpanded() ? Collections.unmodifiableList(children) : Collections.emptyList();
    }

    /**
     * Every fetched child, including those of a collapsed node.
     */
    public List<DependencyNode> fetchedChildren() {
        return Collections.unmodifiableList(children);
    }

    @JsonIgnore
    public boolean isChildrenFetched() {
        return childrenFetched;
    }

    public void attachChildren(List<DependencyNode> fetched) {
        children.clear();
        children.addAll(fetched);
        childrenFetched = true;
    }

    /**
     * Detached copy of this node and every fetched descendant, safe to serialize
     * after the session lock is released.
     */
    public DependencyNode snapshot() {
        DependencyNode copy = new DependencyNode(pathId, parentPathId, cellReference, depth, ancestry);
        copy.value = value;
        copy.text = text;
        copy.formula = formula;
        copy.complexity = complexity;
        copy.leaf = leaf;
        copy.canExpand = canExpand;
        copy.marker = marker;
        copy.rangeCellCount = rangeCellCount;
        copy.name = name;
        copy.state = state;
        if (childrenFetched) {
            List<DependencyNode> copies = new ArrayList<>(children.size());
            for (DependencyNode child : children) {
                copies.add(child.snapshot());
            }
            copy.attachChildren(copies);
        }
        return copy;
    }

    public static List<DependencyNode> snapshotAll(List<DependencyNode> nodes) {
        List<DependencyNode> copies = new ArrayList<>(nodes.size());
        for (DependencyNode node : nodes) {
            copies.add(node.snapshot());
        }
        return copies;
    }

    /**
     * The cell this node stands for; for a range summary, the range's top-left cell.
     */
    @JsonIgnore
    public CellAddress getCell() {
        return cellReference.getAddress();
    }
}

package com.spreadsheet.drilldown.models;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The tree a user is currently exploring in one session.
 * Nodes are owned by their parents; the flat pathId index only makes
 * lookups for expand/collapse O(1).
 */
public class DrillDownTree {

    private final DependencyNode root;
    private final Map<String, DependencyNode> index = new LinkedHashMap<>();

    public DrillDownTree(DependencyNode root) {
        this.root = root;
        index.put(root.getPathId(), root);
    }

    public DependencyNode getRoot() {
        return root;
    }

    public DependencyNode find(String pathId) {
        return index.get(pathId);
    }

    /**
     * Attaches freshly built children to their parent and indexes them.
     * A pathId that is already taken is rejected so two occurrences can never share state.
     */
    public void attach(DependencyNode parent, List<DependencyNode> children) {
        for (DependencyNode child : children) {
            if (index.containsKey(child.getPathId())) {
                throw new IllegalStateException("Duplicate pathId " + child.getPathId());
            }
        }
        parent.attachChildren(children);
        for (DependencyNode child : children) {
            index.put(child.getPathId(), child);
        }
    }

    public Collection<DependencyNode> nodes() {
        return index.values();
    }

    /**
     * Every materialized node whose cell lives on the given sheet, root included.
     */
    public List<DependencyNode> nodesOnSheet(String sheet) {
        List<DependencyNode> result = new ArrayList<>();
        for (DependencyNode node : index.values()) {
            if (!node.getCellReference().isExternal() && sheet.equals(node.getCell().getSheet())) {
                result.add(node);
            }
        }
        return result;
    }

    public int size() {
        return index.size();
    }
}

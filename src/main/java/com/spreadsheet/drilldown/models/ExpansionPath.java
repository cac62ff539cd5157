package com.spreadsheet.drilldown.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Identity of one position in a drill-down tree: the node's pathId plus the
 * chain of cells from the root down to it. Children of this position sit at depth ancestry.size().
 */
public final class ExpansionPath {

    private final String pathId;
    private final List<CellAddress> ancestry;

    public ExpansionPath(String pathId, List<CellAddress> ancestry) {
        this.pathId = pathId;
        this.ancestry = Collections.unmodifiableList(new ArrayList<>(ancestry));
    }

    public String getPathId() {
        return pathId;
    }

    public List<CellAddress> getAncestry() {
        return ancestry;
    }

    public boolean contains(CellAddress cell) {
        return ancestry.contains(cell);
    }

    public int childDepth() {
        return ancestry.size();
    }

    public List<CellAddress> extendedWith(CellAddress cell) {
        List<CellAddress> extended = new ArrayList<>(ancestry);
        extended.add(cell);
        return extended;
    }
}

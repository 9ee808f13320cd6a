package io.scanflow.core.tree;

import java.util.Set;

/// Outcome of {@link ProcessingTree#checkConsistency()}.
///
/// Lists the nodes whose declared input rank does not fit what their parent produces,
/// together with every descendant of such a node. The report is advisory: execution is not
/// blocked by it.
///
/// @param inconsistentNodeIds ids of flagged nodes, not null
public record ConsistencyReport(Set<Integer> inconsistentNodeIds) {

    public ConsistencyReport {
        inconsistentNodeIds = Set.copyOf(inconsistentNodeIds);
    }

    public boolean isConsistent() {
        return inconsistentNodeIds.isEmpty();
    }

    public boolean isConsistent(int nodeId) {
        return !inconsistentNodeIds.contains(nodeId);
    }
}

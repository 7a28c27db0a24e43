package io.weft.core.analysis;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/// Nodes guarded by one branching node, split by outcome.
///
/// Sets keep discovery order. Nodes shared between outcomes or between several
/// branching nodes have already been removed.
///
/// @param node branching instance id, not null
/// @param successNodes nodes that run only when the node succeeds, never null
/// @param failureNodes nodes that run only when the node fails, never null
public record BranchRegion(String node, Set<String> successNodes, Set<String> failureNodes) {

    public BranchRegion {
        successNodes = Collections.unmodifiableSet(new LinkedHashSet<>(successNodes));
        failureNodes = Collections.unmodifiableSet(new LinkedHashSet<>(failureNodes));
    }

    /// @param direction outcome, not null
    /// @return nodes on that side, never null
    public Set<String> side(BranchDirection direction) {
        return direction == BranchDirection.SUCCESS ? successNodes : failureNodes;
    }

    public boolean contains(String nodeId) {
        return successNodes.contains(nodeId) || failureNodes.contains(nodeId);
    }

    /// @return `true` when neither side guards any node
    public boolean isEmpty() {
        return successNodes.isEmpty() && failureNodes.isEmpty();
    }
}

package io.weft.core.analysis;

import java.io.Serial;
import java.util.List;

/// Thrown when the control-flow graph of a workflow cannot be ordered.
///
/// The analyzer expects a validated workflow. A cycle reaching it means the
/// caller skipped validation or ignored its errors.
public class CircularDependencyException extends IllegalStateException {

    @Serial private static final long serialVersionUID = 4127730968251853604L;

    private final List<String> stuckNodes;

    /// Creates exception naming the nodes that never became ready.
    ///
    /// @param stuckNodes instance ids left with unresolved predecessors, not null
    public CircularDependencyException(List<String> stuckNodes) {
        super(
                "Circular dependency detected in workflow. Nodes in cycle: "
                        + String.join(", ", stuckNodes));
        this.stuckNodes = List.copyOf(stuckNodes);
    }

    /// @return ids of the nodes on or behind the cycle, never null
    public List<String> getStuckNodes() {
        return stuckNodes;
    }
}

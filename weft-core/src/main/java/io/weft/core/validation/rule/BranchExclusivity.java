package io.weft.core.validation.rule;

import io.weft.core.workflow.ReservedNames;
import io.weft.core.workflow.WorkflowIndex;
import io.weft.core.workflow.connection.Connection;
import io.weft.core.workflow.node.NodeType;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/// Decides whether several writers of one port can never run in the same execution.
///
/// From each writer the connections are walked backwards breadth-first until the
/// first `onSuccess`/`onFailure` edge whose source type has both branch ports.
/// The writers are exclusive when every writer finds such an ancestor, all share
/// the same ancestor, and they sit on different branches of it.
///
/// @implNote The proof is deliberately shallow. Exclusivity that needs more than one
/// shared ancestor (nested or three-way branching) is not recognised and the
/// caller keeps its warning.
final class BranchExclusivity {

    private BranchExclusivity() {}

    /// @param writers source node ids of the competing connections, not null
    /// @param index lookup tables of the workflow, not null
    /// @return `true` if the writers are provably on distinct branches of one node
    static boolean areMutuallyExclusive(List<String> writers, WorkflowIndex index) {
        if (writers.size() < 2) {
            return false;
        }
        String ancestor = null;
        Set<String> branches = new HashSet<>();
        for (String writer : writers) {
            Optional<BranchPoint> point = findBranchAncestor(writer, index);
            if (point.isEmpty()) {
                return false;
            }
            if (ancestor == null) {
                ancestor = point.get().node();
            } else if (!ancestor.equals(point.get().node())) {
                return false;
            }
            branches.add(point.get().port());
        }
        return branches.size() > 1;
    }

    private static Optional<BranchPoint> findBranchAncestor(String start, WorkflowIndex index) {
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            for (Connection edge : index.incoming(current)) {
                String source = edge.from().node();
                if (ReservedNames.isBranchPort(edge.from().port())
                        && index.typeOf(source).map(BranchExclusivity::canBranch).orElse(false)) {
                    return Optional.of(new BranchPoint(source, edge.from().port()));
                }
                queue.add(source);
            }
        }
        return Optional.empty();
    }

    private static boolean canBranch(NodeType type) {
        return type.isHasSuccessPort() && type.isHasFailurePort();
    }

    private record BranchPoint(String node, String port) {}
}

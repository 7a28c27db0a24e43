package io.weft.core.analysis;

import io.weft.core.workflow.ReservedNames;
import io.weft.core.workflow.WorkflowIndex;
import io.weft.core.workflow.connection.Connection;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/// Groups nodes of an ordered list that may run concurrently.
///
/// Two nodes may run together when the list members they depend on are the same
/// set. A dependency counts whether it is direct or passes through nodes outside
/// the list, such as the branch body of a guarding node. A group sits at the
/// position of its first member, so for a topologically ordered input every
/// dependency still runs before its dependents.
public final class ParallelGroups {

    private ParallelGroups() {}

    /// Splits an ordered node list into parallel groups.
    ///
    /// Only unscoped connections are considered.
    ///
    /// @param nodes node ids in execution order, not null
    /// @param index workflow index, not null
    /// @return groups in list order, each non-empty, never null
    public static List<List<String>> detect(List<String> nodes, WorkflowIndex index) {
        if (nodes.size() <= 1) {
            return nodes.stream().map(List::of).toList();
        }

        Set<String> members = new HashSet<>(nodes);
        Map<Set<String>, List<String>> groups = new LinkedHashMap<>();
        for (String node : nodes) {
            groups.computeIfAbsent(memberDependencies(node, members, index), k -> new ArrayList<>())
                    .add(node);
        }

        List<List<String>> result = new ArrayList<>();
        groups.values().forEach(group -> result.add(List.copyOf(group)));
        return result;
    }

    /// Walks backwards from a node and stops at list members and virtual nodes.
    private static Set<String> memberDependencies(
            String node, Set<String> members, WorkflowIndex index) {
        Set<String> dependencies = new TreeSet<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(node);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (Connection conn : index.incoming(current)) {
                String source = conn.from().node();
                if (conn.isScoped()
                        || source.equals(node)
                        || ReservedNames.isVirtualNode(source)
                        || !visited.add(source)) {
                    continue;
                }
                if (members.contains(source)) {
                    dependencies.add(source);
                } else {
                    queue.add(source);
                }
            }
        }
        return dependencies;
    }
}

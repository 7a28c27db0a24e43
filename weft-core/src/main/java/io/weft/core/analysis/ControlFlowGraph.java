package io.weft.core.analysis;

import io.weft.core.workflow.ReservedNames;
import io.weft.core.workflow.WorkflowIndex;
import io.weft.core.workflow.connection.Connection;
import io.weft.core.workflow.node.NodeInstance;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/// Directed graph of execution dependencies between the top-level nodes of a
/// workflow.
///
/// ### Construction rules
/// - Nodes are `Start`, `Exit` and every instance that is not a per-port scoped
///   child. Scoped children run inside their parent's scope callback.
/// - Every unscoped connection between two graph nodes becomes an edge. Data and
///   control connections both count, parallel connections collapse into one edge,
///   self-loops are dropped.
/// - Instances without predecessors hang off `Start`; instances without
///   successors feed `Exit`.
///
/// @implNote Immutable after construction. Successor lists keep first-seen order.
public final class ControlFlowGraph {

    private final Map<String, List<String>> successors;
    private final Map<String, Integer> inDegree;
    private final Map<String, Integer> declarationIndex;

    private ControlFlowGraph(
            Map<String, List<String>> successors,
            Map<String, Integer> inDegree,
            Map<String, Integer> declarationIndex) {
        this.successors = successors;
        this.inDegree = inDegree;
        this.declarationIndex = declarationIndex;
    }

    /// Builds the graph for an indexed workflow.
    ///
    /// @param index workflow index, not null
    /// @return new graph, never null
    public static ControlFlowGraph build(WorkflowIndex index) {
        Map<String, List<String>> successors = new LinkedHashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, Integer> declarationIndex = new HashMap<>();

        successors.put(ReservedNames.START, new ArrayList<>());
        inDegree.put(ReservedNames.START, 0);
        declarationIndex.put(ReservedNames.START, -1);

        List<String> instanceIds = new ArrayList<>();
        for (NodeInstance instance : index.workflow().getInstances()) {
            if (index.isPerPortScopedChild(instance.id()) || successors.containsKey(instance.id())) {
                continue;
            }
            instanceIds.add(instance.id());
            successors.put(instance.id(), new ArrayList<>());
            inDegree.put(instance.id(), 0);
            declarationIndex.put(instance.id(), declarationIndex.size() - 1);
        }

        successors.put(ReservedNames.EXIT, new ArrayList<>());
        inDegree.put(ReservedNames.EXIT, 0);
        declarationIndex.put(ReservedNames.EXIT, Integer.MAX_VALUE);

        for (Connection conn : index.workflow().getConnections()) {
            String from = conn.from().node();
            String to = conn.to().node();
            if (conn.isScoped() || conn.isSelfLoop()) {
                continue;
            }
            if (!successors.containsKey(from) || !successors.containsKey(to)) {
                continue;
            }
            List<String> next = successors.get(from);
            if (!next.contains(to)) {
                next.add(to);
                inDegree.merge(to, 1, Integer::sum);
            }
        }

        for (String id : instanceIds) {
            if (inDegree.get(id) == 0) {
                successors.get(ReservedNames.START).add(id);
                inDegree.put(id, 1);
            }
        }
        for (String id : instanceIds) {
            List<String> next = successors.get(id);
            if (next.isEmpty()) {
                next.add(ReservedNames.EXIT);
                inDegree.merge(ReservedNames.EXIT, 1, Integer::sum);
            }
        }

        Map<String, List<String>> frozen = new LinkedHashMap<>();
        successors.forEach((node, next) -> frozen.put(node, List.copyOf(next)));
        return new ControlFlowGraph(
                Collections.unmodifiableMap(frozen),
                Collections.unmodifiableMap(inDegree),
                Collections.unmodifiableMap(declarationIndex));
    }

    /// @return graph node ids: `Start`, instances in declaration order, `Exit`
    public Set<String> nodes() {
        return successors.keySet();
    }

    public boolean contains(String node) {
        return successors.containsKey(node);
    }

    /// @param node graph node id, not null
    /// @return direct successors in first-seen order, empty for unknown nodes
    public List<String> successors(String node) {
        return successors.getOrDefault(node, List.of());
    }

    /// @param node graph node id, not null
    /// @return number of distinct predecessors, 0 for unknown nodes
    public int inDegree(String node) {
        return inDegree.getOrDefault(node, 0);
    }

    /// Orders the graph with Kahn's algorithm.
    ///
    /// Among nodes that are ready at the same time the one declared first runs
    /// first, so the order is stable across runs.
    ///
    /// @return instance ids in execution order, without `Start` and `Exit`
    /// @throws CircularDependencyException if some nodes never become ready
    public List<String> topologicalOrder() {
        Map<String, Integer> remaining = new HashMap<>(inDegree);
        PriorityQueue<String> ready =
                new PriorityQueue<>(Comparator.comparingInt(declarationIndex::get));
        for (String node : successors.keySet()) {
            if (remaining.get(node) == 0) {
                ready.add(node);
            }
        }

        List<String> order = new ArrayList<>();
        int visited = 0;
        while (!ready.isEmpty()) {
            String node = ready.poll();
            visited++;
            if (!ReservedNames.isVirtualNode(node)) {
                order.add(node);
            }
            for (String next : successors.get(node)) {
                int degree = remaining.merge(next, -1, Integer::sum);
                if (degree == 0) {
                    ready.add(next);
                }
            }
        }

        if (visited != successors.size()) {
            List<String> stuck = new ArrayList<>();
            for (String node : successors.keySet()) {
                if (remaining.get(node) > 0 && !ReservedNames.isVirtualNode(node)) {
                    stuck.add(node);
                }
            }
            throw new CircularDependencyException(stuck);
        }
        return order;
    }
}

package io.weft.core.validation.rule;

import io.weft.core.validation.Diagnostic;
import io.weft.core.validation.DiagnosticCode;
import io.weft.core.validation.Diagnostics;
import io.weft.core.validation.ValidationContext;
import io.weft.core.validation.ValidationRule;
import io.weft.core.workflow.WorkflowIndex;
import io.weft.core.workflow.connection.Connection;
import io.weft.core.workflow.node.NodeInstance;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Detects loops in the connection graph, one scope layer at a time.
///
/// Instances are grouped by their parent container: top-level instances form
/// one layer, the children of each container another. Only connections whose
/// two ends lie in the same layer are followed, so a scope's internal wiring is
/// invisible to the outer layer.
///
/// ### Contracts
/// - A self-loop (`a -> a`) is never reported, and a node carrying one is not
///   treated as the entry point of a longer loop
/// - Each distinct loop is reported once: rotations of the same node set share a
///   key built from the sorted node ids
public final class CycleRule implements ValidationRule {

    @Override
    public Diagnostics check(ValidationContext context) {
        Diagnostics diagnostics = Diagnostics.empty();
        WorkflowIndex index = context.index();

        // null is the top-level layer
        Map<String, List<NodeInstance>> layers = new LinkedHashMap<>();
        layers.put(null, new ArrayList<>());
        for (NodeInstance instance : context.workflow().getInstances()) {
            layers.computeIfAbsent(parentOf(instance), k -> new ArrayList<>()).add(instance);
        }

        Map<String, List<Connection>> layerConnections = new LinkedHashMap<>();
        for (Connection conn : context.workflow().getConnections()) {
            Optional<NodeInstance> source = index.findInstance(conn.from().node());
            Optional<NodeInstance> target = index.findInstance(conn.to().node());
            if (source.isEmpty() || target.isEmpty()) {
                continue;
            }
            String sourceParent = parentOf(source.get());
            if (Objects.equals(sourceParent, parentOf(target.get()))) {
                layerConnections.computeIfAbsent(sourceParent, k -> new ArrayList<>()).add(conn);
            }
        }

        for (Map.Entry<String, List<NodeInstance>> layer : layers.entrySet()) {
            new LayerSearch(
                            layer.getKey(),
                            layer.getValue(),
                            layerConnections.getOrDefault(layer.getKey(), List.of()),
                            diagnostics)
                    .run();
        }
        return diagnostics;
    }

    private static String parentOf(NodeInstance instance) {
        return instance.hasParent() ? instance.parent().id() : null;
    }

    /// Depth-first search state for a single layer.
    private static final class LayerSearch {
        private final String parentId;
        private final Map<String, NodeInstance> instances = new LinkedHashMap<>();
        private final Map<String, List<String>> successors = new LinkedHashMap<>();
        private final Set<String> selfLoopNodes = new HashSet<>();
        private final Set<String> visited = new HashSet<>();
        private final Set<String> recursionStack = new HashSet<>();
        private final Set<String> reported = new HashSet<>();
        private final Diagnostics diagnostics;

        LayerSearch(
                String parentId,
                List<NodeInstance> members,
                List<Connection> connections,
                Diagnostics diagnostics) {
            this.parentId = parentId;
            this.diagnostics = diagnostics;
            for (NodeInstance member : members) {
                instances.putIfAbsent(member.id(), member);
            }
            for (Connection conn : connections) {
                if (conn.isSelfLoop()) {
                    selfLoopNodes.add(conn.from().node());
                } else {
                    successors
                            .computeIfAbsent(conn.from().node(), k -> new ArrayList<>())
                            .add(conn.to().node());
                }
            }
        }

        void run() {
            for (String id : instances.keySet()) {
                if (!visited.contains(id)) {
                    visit(id, new ArrayList<>());
                }
            }
        }

        private boolean visit(String node, List<String> path) {
            if (recursionStack.contains(node)) {
                if (selfLoopNodes.contains(node)) {
                    return false;
                }
                report(node, path);
                return true;
            }
            if (visited.contains(node)) {
                return false;
            }
            if (!instances.containsKey(node)) {
                return false;
            }
            recursionStack.add(node);
            List<String> extended = new ArrayList<>(path);
            extended.add(node);

            boolean foundCycle = false;
            for (String next : successors.getOrDefault(node, List.of())) {
                if (visit(next, extended)) {
                    foundCycle = true;
                }
            }
            recursionStack.remove(node);
            // a node on a loop may be re-entered from another root
            if (!foundCycle) {
                visited.add(node);
            }
            return foundCycle;
        }

        private void report(String node, List<String> path) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(node), path.size()));
            List<String> key = new ArrayList<>(cycle);
            key.sort(null);
            if (!reported.add(String.join(",", key))) {
                return;
            }
            cycle.add(node);
            String scope = parentId != null ? " in scope \"" + parentId + "\"" : "";
            NodeInstance instance = instances.get(node);
            diagnostics.add(
                    Diagnostic.error(
                                    DiagnosticCode.CYCLE_DETECTED,
                                    "Loop detected" + scope + ": " + String.join(" -> ", cycle))
                            .withNode(node)
                            .withLocation(instance != null ? instance.sourceLocation() : null));
        }
    }
}

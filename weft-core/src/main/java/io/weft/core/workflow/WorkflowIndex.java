package io.weft.core.workflow;

import io.weft.core.workflow.connection.Connection;
import io.weft.core.workflow.node.NodeInstance;
import io.weft.core.workflow.node.NodeType;
import io.weft.core.workflow.port.PortDefinition;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Read-only lookup tables over one {@link Workflow}, built once per pass.
///
/// ### Contracts
/// - **Dual-key resolution**: a node type is found by `name` or by `functionName`.
///   When two types share a key the first declared wins.
/// - **Instances**: the first instance declared with a given id wins; duplicates are
///   the validator's concern.
/// - **Per-port scoped children**: an instance whose parent's node type declares a
///   port tagged with the instance's scope. Such children run inside the parent's
///   scope callback and are invisible to the outer control flow.
///
/// @implNote Immutable after construction. Holds ids and references only, never
/// back-pointers into the model.
public final class WorkflowIndex {

    private final Workflow workflow;
    private final Map<String, NodeType> typesByKey;
    private final Map<String, NodeInstance> instancesById;
    private final Map<String, List<Connection>> incoming;
    private final Map<String, List<Connection>> outgoing;

    private WorkflowIndex(Workflow workflow) {
        this.workflow = workflow;
        this.typesByKey = new HashMap<>();
        for (NodeType type : workflow.getNodeTypes()) {
            typesByKey.putIfAbsent(type.getFunctionName(), type);
            typesByKey.putIfAbsent(type.getName(), type);
        }
        this.instancesById = new LinkedHashMap<>();
        for (NodeInstance instance : workflow.getInstances()) {
            instancesById.putIfAbsent(instance.id(), instance);
        }
        this.incoming = new HashMap<>();
        this.outgoing = new HashMap<>();
        for (Connection conn : workflow.getConnections()) {
            incoming.computeIfAbsent(conn.to().node(), k -> new ArrayList<>()).add(conn);
            outgoing.computeIfAbsent(conn.from().node(), k -> new ArrayList<>()).add(conn);
        }
    }

    /// Builds the index for a workflow.
    ///
    /// @param workflow workflow to index, not null
    /// @return new index, never null
    public static WorkflowIndex of(Workflow workflow) {
        return new WorkflowIndex(workflow);
    }

    public Workflow workflow() {
        return workflow;
    }

    /// Resolves a node type reference by name or function name.
    ///
    /// @param reference node type reference, may be null
    /// @return the node type, or empty if nothing matches
    public Optional<NodeType> findType(String reference) {
        return Optional.ofNullable(reference).map(typesByKey::get);
    }

    /// @return `true` if the reference resolves to a declared node type
    public boolean hasType(String reference) {
        return reference != null && typesByKey.containsKey(reference);
    }

    /// @param id instance id, may be null
    /// @return the instance, or empty if no instance has the id
    public Optional<NodeInstance> findInstance(String id) {
        return Optional.ofNullable(id).map(instancesById::get);
    }

    public boolean hasInstance(String id) {
        return id != null && instancesById.containsKey(id);
    }

    /// Resolves the node type of an instance.
    ///
    /// @param instanceId instance id, may be null
    /// @return the resolved node type, or empty for unknown instances or types
    public Optional<NodeType> typeOf(String instanceId) {
        return findInstance(instanceId).flatMap(instance -> findType(instance.nodeType()));
    }

    /// Returns instance ids whose node type resolves, in declaration order.
    ///
    /// @return list of resolved instance ids, never null
    public List<String> resolvedInstanceIds() {
        List<String> ids = new ArrayList<>();
        for (NodeInstance instance : instancesById.values()) {
            if (hasType(instance.nodeType())) {
                ids.add(instance.id());
            }
        }
        return ids;
    }

    /// @param node node id including `Start`/`Exit`, not null
    /// @return connections targeting the node in declaration order, never null
    public List<Connection> incoming(String node) {
        return incoming.getOrDefault(node, List.of());
    }

    /// @param node node id including `Start`/`Exit`, not null
    /// @return connections leaving the node in declaration order, never null
    public List<Connection> outgoing(String node) {
        return outgoing.getOrDefault(node, List.of());
    }

    /// Returns the unscoped connections feeding one input port.
    ///
    /// @param node target node id, not null
    /// @param port target port name, not null
    /// @return matching connections in declaration order, never null
    public List<Connection> unscopedInto(String node, String port) {
        List<Connection> result = new ArrayList<>();
        for (Connection conn : incoming(node)) {
            if (conn.to().port().equals(port) && !conn.isScoped()) {
                result.add(conn);
            }
        }
        return result;
    }

    /// Returns whether any connection, scoped or not, feeds the input port.
    public boolean isConnected(String node, String port) {
        return incoming(node).stream().anyMatch(conn -> conn.to().port().equals(port));
    }

    /// Returns whether the instance runs inside a scope callback of its parent.
    ///
    /// @param instanceId instance id, not null
    /// @return `true` for per-port scoped children, `false` for top-level instances,
    ///     unknown ids and children of unknown or unscoped parents
    public boolean isPerPortScopedChild(String instanceId) {
        NodeInstance instance = instancesById.get(instanceId);
        if (instance == null || instance.parent() == null) {
            return false;
        }
        String scope = instance.parent().scope();
        return typeOf(instance.parent().id())
                .map(parentType -> declaresScope(parentType, scope))
                .orElse(false);
    }

    /// Returns the children placed in one scope of a container, in declaration order.
    ///
    /// @param parentId container id, not null
    /// @param scope scope name, not null
    /// @return child instances, never null
    public List<NodeInstance> childrenOf(String parentId, String scope) {
        List<NodeInstance> children = new ArrayList<>();
        for (NodeInstance instance : instancesById.values()) {
            if (instance.parent() != null
                    && instance.parent().id().equals(parentId)
                    && instance.parent().scope().equals(scope)) {
                children.add(instance);
            }
        }
        return children;
    }

    private static boolean declaresScope(NodeType type, String scope) {
        for (PortDefinition port : type.getOutputs().values()) {
            if (scope.equals(port.getScope())) return true;
        }
        for (PortDefinition port : type.getInputs().values()) {
            if (scope.equals(port.getScope())) return true;
        }
        return false;
    }
}

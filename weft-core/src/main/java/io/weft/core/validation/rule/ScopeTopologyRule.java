package io.weft.core.validation.rule;

import io.weft.core.validation.Diagnostic;
import io.weft.core.validation.DiagnosticCode;
import io.weft.core.validation.Diagnostics;
import io.weft.core.validation.ValidationContext;
import io.weft.core.validation.ValidationRule;
import io.weft.core.validation.types.StructuralTypes;
import io.weft.core.workflow.SourceLocation;
import io.weft.core.workflow.Workflow;
import io.weft.core.workflow.WorkflowIndex;
import io.weft.core.workflow.connection.Connection;
import io.weft.core.workflow.node.NodeInstance;
import io.weft.core.workflow.node.NodeType;
import io.weft.core.workflow.port.DataType;
import io.weft.core.workflow.port.PortDefinition;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Checks the inner graph of every container that declares scoped ports.
///
/// A scope is the region between a container's scoped outputs (values handed to
/// the callback) and its scoped inputs (values handed back). Children are the
/// instances whose parent names the container and scope.
///
/// ### Checks per scope
/// - scope qualifiers on connections name a scope the container defines
/// - the scope has at least one child
/// - scoped connections use ports tagged with that scope and stay between the
///   container and its children
/// - data types agree across the boundary (`ANY` and STEP excluded)
/// - every child's required inputs are fed
/// - every scoped input receives a value from inside
/// - every child is wired to the container
///
/// Before the per-container checks, the workflow's `scopes` table is checked for
/// children listed under two scope keys.
public final class ScopeTopologyRule implements ValidationRule {

    @Override
    public Diagnostics check(ValidationContext context) {
        Diagnostics diagnostics = Diagnostics.empty();
        checkScopeTable(context.workflow(), context.index(), diagnostics);

        for (String instanceId : context.index().resolvedInstanceIds()) {
            NodeType type = context.index().typeOf(instanceId).orElseThrow();
            Set<String> scopeNames = type.scopeNames();
            if (scopeNames.isEmpty()) {
                continue;
            }
            new ContainerCheck(context, instanceId, type, scopeNames, diagnostics).run();
        }
        return diagnostics;
    }

    private static void checkScopeTable(
            Workflow workflow, WorkflowIndex index, Diagnostics diagnostics) {
        Map<String, String> scopeOfChild = new HashMap<>();
        for (Map.Entry<String, List<String>> scope : workflow.getScopes().entrySet()) {
            for (String childId : scope.getValue()) {
                String existing = scopeOfChild.get(childId);
                if (existing != null && !existing.equals(scope.getKey())) {
                    diagnostics.add(
                            Diagnostic.error(
                                            DiagnosticCode.SCOPE_INCONSISTENT,
                                            "Instance \"" + childId
                                                    + "\" appears in multiple scopes: \"" + existing
                                                    + "\" and \"" + scope.getKey()
                                                    + "\". A node can only belong to one scope.")
                                    .withNode(childId)
                                    .withLocation(locationOf(index, childId)));
                }
                scopeOfChild.put(childId, scope.getKey());
            }
        }
    }

    private static SourceLocation locationOf(WorkflowIndex index, String id) {
        return index.findInstance(id).map(NodeInstance::sourceLocation).orElse(null);
    }

    /// Checks of one container instance.
    private static final class ContainerCheck {
        private final Workflow workflow;
        private final WorkflowIndex index;
        private final String parentId;
        private final NodeType parentType;
        private final Set<String> scopeNames;
        private final Diagnostics diagnostics;

        ContainerCheck(
                ValidationContext context,
                String parentId,
                NodeType parentType,
                Set<String> scopeNames,
                Diagnostics diagnostics) {
            this.workflow = context.workflow();
            this.index = context.index();
            this.parentId = parentId;
            this.parentType = parentType;
            this.scopeNames = scopeNames;
            this.diagnostics = diagnostics;
        }

        void run() {
            checkQualifiers();
            for (String scope : scopeNames) {
                List<String> children =
                        index.childrenOf(parentId, scope).stream().map(NodeInstance::id).toList();
                if (children.isEmpty()) {
                    diagnostics.add(
                            Diagnostic.warning(
                                            DiagnosticCode.SCOPE_EMPTY,
                                            "Scope \"" + scope + "\" on node \"" + parentId
                                                    + "\" has no child nodes.")
                                    .withNode(parentId)
                                    .withLocation(locationOf(index, parentId)));
                    continue;
                }
                List<Connection> scoped = scopedConnections(scope, children);
                checkPorts(scope, scoped);
                checkBoundary(scope, children, scoped);
                checkTypes(scope, scoped);
                checkChildInputs(scope, children);
                checkScopedInputs(scope, scoped);
                checkOrphans(scope, children, scoped);
            }
        }

        private void checkQualifiers() {
            String available = String.join(", ", scopeNames);
            for (Connection conn : workflow.getConnections()) {
                String fromScope = conn.from().scope();
                if (fromScope != null
                        && conn.from().node().equals(parentId)
                        && !scopeNames.contains(fromScope)) {
                    diagnostics.add(
                            Diagnostic.error(
                                            DiagnosticCode.SCOPE_WRONG_SCOPE_NAME,
                                            "Connection from \"" + parentId + "." + conn.from().port()
                                                    + "\" uses scope qualifier \":" + fromScope
                                                    + "\" but node \"" + parentId
                                                    + "\" does not define scope \"" + fromScope
                                                    + "\". Available scopes: " + available + ".")
                                    .withConnection(conn));
                }
                String toScope = conn.to().scope();
                if (toScope != null
                        && conn.to().node().equals(parentId)
                        && !scopeNames.contains(toScope)) {
                    diagnostics.add(
                            Diagnostic.error(
                                            DiagnosticCode.SCOPE_WRONG_SCOPE_NAME,
                                            "Connection to \"" + parentId + "." + conn.to().port()
                                                    + "\" uses scope qualifier \":" + toScope
                                                    + "\" but node \"" + parentId
                                                    + "\" does not define scope \"" + toScope
                                                    + "\". Available scopes: " + available + ".")
                                    .withConnection(conn));
                }
            }
        }

        private List<Connection> scopedConnections(String scope, List<String> children) {
            return workflow.getConnections().stream()
                    .filter(
                            conn ->
                                    (scope.equals(conn.from().scope())
                                                    && (conn.from().node().equals(parentId)
                                                            || children.contains(conn.from().node())))
                                            || (scope.equals(conn.to().scope())
                                                    && (conn.to().node().equals(parentId)
                                                            || children.contains(conn.to().node()))))
                    .toList();
        }

        private void checkPorts(String scope, List<Connection> scoped) {
            for (Connection conn : scoped) {
                if (conn.from().node().equals(parentId) && scope.equals(conn.from().scope())) {
                    checkPort(conn, scope, conn.from().port(), parentType.getOutputs(), "output");
                }
                if (conn.to().node().equals(parentId) && scope.equals(conn.to().scope())) {
                    checkPort(conn, scope, conn.to().port(), parentType.getInputs(), "input");
                }
            }
        }

        private void checkPort(
                Connection conn,
                String scope,
                String portName,
                Map<String, PortDefinition> ports,
                String direction) {
            PortDefinition port = ports.get(portName);
            if (port == null) {
                List<String> available =
                        ports.entrySet().stream()
                                .filter(e -> scope.equals(e.getValue().getScope()))
                                .map(Map.Entry::getKey)
                                .toList();
                diagnostics.add(
                        Diagnostic.error(
                                        DiagnosticCode.SCOPE_UNKNOWN_PORT,
                                        "Scoped connection references non-existent " + direction
                                                + " port \"" + portName + "\" on \"" + parentId
                                                + "\" in scope \"" + scope + "\". Available scoped "
                                                + direction + "s: "
                                                + (available.isEmpty()
                                                        ? "none"
                                                        : String.join(", ", available))
                                                + ".")
                                .withConnection(conn));
            } else if (!scope.equals(port.getScope())) {
                String actual =
                        port.getScope() != null
                                ? " (it belongs to scope \"" + port.getScope() + "\")"
                                : " (it is an unscoped port)";
                String label = direction.equals("output") ? "Output" : "Input";
                diagnostics.add(
                        Diagnostic.error(
                                        DiagnosticCode.SCOPE_UNKNOWN_PORT,
                                        label + " port \"" + portName + "\" on \"" + parentId
                                                + "\" is not a scoped port of scope \"" + scope
                                                + "\"" + actual + ".")
                                .withConnection(conn));
            }
        }

        private void checkBoundary(String scope, List<String> children, List<Connection> scoped) {
            for (Connection conn : scoped) {
                String from = conn.from().node();
                String to = conn.to().node();
                if (scope.equals(conn.from().scope())
                        && children.contains(from)
                        && !to.equals(parentId)
                        && !children.contains(to)) {
                    diagnostics.add(
                            Diagnostic.error(
                                            DiagnosticCode.SCOPE_CONNECTION_OUTSIDE,
                                            "Scoped connection from \"" + from + "."
                                                    + conn.from().port() + "\" targets \"" + to
                                                    + "\" which is not inside scope \"" + scope
                                                    + "\" of \"" + parentId + "\".")
                                    .withConnection(conn));
                }
                if (scope.equals(conn.to().scope())
                        && children.contains(to)
                        && !from.equals(parentId)
                        && !children.contains(from)) {
                    diagnostics.add(
                            Diagnostic.error(
                                            DiagnosticCode.SCOPE_CONNECTION_OUTSIDE,
                                            "Scoped connection to \"" + to + "." + conn.to().port()
                                                    + "\" sources from \"" + from
                                                    + "\" which is not inside scope \"" + scope
                                                    + "\" of \"" + parentId + "\".")
                                    .withConnection(conn));
                }
            }
        }

        private void checkTypes(String scope, List<Connection> scoped) {
            for (Connection conn : scoped) {
                if (conn.from().node().equals(parentId) && scope.equals(conn.from().scope())) {
                    PortDefinition parentPort = parentType.getOutputs().get(conn.from().port());
                    PortDefinition childPort =
                            index.typeOf(conn.to().node())
                                    .map(t -> t.getInputs().get(conn.to().port()))
                                    .orElse(null);
                    if (mismatched(parentPort, childPort)) {
                        reportMismatch(
                                conn,
                                scope,
                                parentId + "." + conn.from().port(),
                                parentPort,
                                conn.to().node() + "." + conn.to().port(),
                                childPort);
                    }
                }
                if (conn.to().node().equals(parentId) && scope.equals(conn.to().scope())) {
                    PortDefinition parentPort = parentType.getInputs().get(conn.to().port());
                    PortDefinition childPort =
                            index.typeOf(conn.from().node())
                                    .map(t -> t.getOutputs().get(conn.from().port()))
                                    .orElse(null);
                    if (mismatched(parentPort, childPort)) {
                        reportMismatch(
                                conn,
                                scope,
                                conn.from().node() + "." + conn.from().port(),
                                childPort,
                                parentId + "." + conn.to().port(),
                                parentPort);
                    }
                }
            }
        }

        private static boolean mismatched(PortDefinition a, PortDefinition b) {
            if (a == null || b == null) {
                return false;
            }
            DataType x = a.getDataType();
            DataType y = b.getDataType();
            if (x == DataType.STEP || y == DataType.STEP) {
                return false;
            }
            return x != y && x != DataType.ANY && y != DataType.ANY;
        }

        private void reportMismatch(
                Connection conn,
                String scope,
                String sourceLabel,
                PortDefinition source,
                String targetLabel,
                PortDefinition target) {
            diagnostics.add(
                    Diagnostic.warning(
                                    DiagnosticCode.SCOPE_PORT_TYPE_MISMATCH,
                                    "Type mismatch in scope \"" + scope + "\": \"" + sourceLabel
                                            + "\" outputs "
                                            + StructuralTypes.format(
                                                    source.getDataType(), source.getTsType())
                                            + " but \"" + targetLabel + "\" expects "
                                            + StructuralTypes.format(
                                                    target.getDataType(), target.getTsType())
                                            + ".")
                            .withConnection(conn));
        }

        private void checkChildInputs(String scope, List<String> children) {
            for (String childId : children) {
                NodeType childType = index.typeOf(childId).orElse(null);
                NodeInstance child = index.findInstance(childId).orElse(null);
                if (childType == null || child == null) {
                    continue;
                }
                for (Map.Entry<String, PortDefinition> entry : childType.getInputs().entrySet()) {
                    String portName = entry.getKey();
                    if (RequiredInputRule.isRequired(portName, entry.getValue(), child)
                            && !index.isConnected(childId, portName)) {
                        diagnostics.add(
                                Diagnostic.error(
                                                DiagnosticCode.SCOPE_MISSING_REQUIRED_INPUT,
                                                "Scoped child \"" + childId
                                                        + "\" has unconnected required input \""
                                                        + portName + "\" within scope \"" + scope
                                                        + "\" of \"" + parentId + "\".")
                                        .withNode(childId)
                                        .withLocation(child.sourceLocation()));
                    }
                }
            }
        }

        private void checkScopedInputs(String scope, List<Connection> scoped) {
            for (Map.Entry<String, PortDefinition> entry : parentType.getInputs().entrySet()) {
                if (!scope.equals(entry.getValue().getScope())) {
                    continue;
                }
                boolean fed =
                        scoped.stream()
                                .anyMatch(
                                        conn ->
                                                conn.to().node().equals(parentId)
                                                        && conn.to().port().equals(entry.getKey())
                                                        && scope.equals(conn.to().scope()));
                if (!fed) {
                    diagnostics.add(
                            Diagnostic.warning(
                                            DiagnosticCode.SCOPE_UNUSED_INPUT,
                                            "Scoped input port \"" + entry.getKey() + "\" of \""
                                                    + parentId + "\" (scope \"" + scope
                                                    + "\") has no connection from inner nodes."
                                                    + " Data will not flow back from the scope.")
                                    .withNode(parentId)
                                    .withLocation(locationOf(index, parentId)));
                }
            }
        }

        private void checkOrphans(String scope, List<String> children, List<Connection> scoped) {
            for (String childId : children) {
                boolean wired =
                        scoped.stream()
                                .anyMatch(
                                        conn ->
                                                (conn.from().node().equals(parentId)
                                                                && scope.equals(conn.from().scope())
                                                                && conn.to().node().equals(childId))
                                                        || (conn.to().node().equals(parentId)
                                                                && scope.equals(conn.to().scope())
                                                                && conn.from().node().equals(childId)));
                if (!wired) {
                    diagnostics.add(
                            Diagnostic.warning(
                                            DiagnosticCode.SCOPE_ORPHANED_CHILD,
                                            "Child node \"" + childId
                                                    + "\" is declared inside scope \"" + scope
                                                    + "\" of \"" + parentId
                                                    + "\" but has no scoped connections to or from"
                                                    + " the parent. It is disconnected from the"
                                                    + " scope's data flow.")
                                    .withNode(childId)
                                    .withLocation(locationOf(index, childId)));
                }
            }
        }
    }
}

package io.weft.core.validation.rule;

import io.weft.core.util.StringDistance;
import io.weft.core.validation.Diagnostic;
import io.weft.core.validation.DiagnosticCode;
import io.weft.core.validation.Diagnostics;
import io.weft.core.validation.ValidationContext;
import io.weft.core.validation.ValidationRule;
import io.weft.core.workflow.ReservedNames;
import io.weft.core.workflow.Workflow;
import io.weft.core.workflow.WorkflowIndex;
import io.weft.core.workflow.connection.Connection;
import io.weft.core.workflow.node.NodeType;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/// Checks that every connection endpoint names an existing node and port.
///
/// A node counts as known only when it is an instance whose type resolves. The
/// virtual `Start` node exposes `execute` plus the workflow's start ports; `Exit`
/// accepts `onSuccess`, `onFailure` plus the workflow's exit ports.
public final class ConnectionReferenceRule implements ValidationRule {

    @Override
    public Diagnostics check(ValidationContext context) {
        Workflow workflow = context.workflow();
        WorkflowIndex index = context.index();
        List<String> knownNodes = index.resolvedInstanceIds();
        Diagnostics diagnostics = Diagnostics.empty();

        for (Connection conn : workflow.getConnections()) {
            String fromNode = conn.from().node();
            String toNode = conn.to().node();
            if (!ReservedNames.isStart(fromNode) && !knownNodes.contains(fromNode)) {
                diagnostics.add(
                        Diagnostic.error(
                                        DiagnosticCode.UNKNOWN_SOURCE_NODE,
                                        "Connection references unknown source node: \""
                                                + fromNode
                                                + "\""
                                                + StringDistance.didYouMean(fromNode, knownNodes))
                                .withConnection(conn));
            }
            if (!ReservedNames.isExit(toNode) && !knownNodes.contains(toNode)) {
                diagnostics.add(
                        Diagnostic.error(
                                        DiagnosticCode.UNKNOWN_TARGET_NODE,
                                        "Connection references unknown target node: \""
                                                + toNode
                                                + "\""
                                                + StringDistance.didYouMean(toNode, knownNodes))
                                .withConnection(conn));
            }
            checkSourcePort(conn, workflow, index, diagnostics);
            checkTargetPort(conn, workflow, index, diagnostics);
        }

        Set<String> seen = new HashSet<>();
        for (Connection conn : workflow.getConnections()) {
            if (!seen.add(conn.key())) {
                diagnostics.add(
                        Diagnostic.error(
                                        DiagnosticCode.DUPLICATE_CONNECTION,
                                        "Duplicate connection: " + conn.key())
                                .withConnection(conn));
            }
        }

        Set<String> referenced = new LinkedHashSet<>();
        for (Connection conn : workflow.getConnections()) {
            referenced.add(conn.from().node());
            referenced.add(conn.to().node());
        }
        for (String node : referenced) {
            if (!ReservedNames.isVirtualNode(node) && !knownNodes.contains(node)) {
                diagnostics.add(
                        Diagnostic.error(
                                        DiagnosticCode.UNDEFINED_NODE,
                                        "Workflow references undefined node: \"" + node + "\"")
                                .withNode(node));
            }
        }
        return diagnostics;
    }

    private static void checkSourcePort(
            Connection conn, Workflow workflow, WorkflowIndex index, Diagnostics diagnostics) {
        String node = conn.from().node();
        String port = conn.from().port();
        if (ReservedNames.isStart(node)) {
            List<String> valid = new ArrayList<>();
            valid.add(ReservedNames.EXECUTE);
            valid.addAll(workflow.getStartPorts().keySet());
            if (!valid.contains(port)) {
                String hint = StringDistance.didYouMean(port, valid);
                if (hint.isEmpty()) {
                    hint = " Declare \"" + port + "\" as a workflow start port to pass it in.";
                }
                diagnostics.add(
                        Diagnostic.error(
                                        DiagnosticCode.UNKNOWN_SOURCE_PORT,
                                        "Start node does not have output port \""
                                                + port
                                                + "\"."
                                                + hint)
                                .withNode(node)
                                .withConnection(conn));
            }
            return;
        }
        Optional<NodeType> type = index.typeOf(node);
        if (type.isPresent() && !type.get().getOutputs().containsKey(port)) {
            diagnostics.add(
                    Diagnostic.error(
                                    DiagnosticCode.UNKNOWN_SOURCE_PORT,
                                    "Node \""
                                            + node
                                            + "\" does not have output port \""
                                            + port
                                            + "\""
                                            + StringDistance.didYouMean(
                                                    port, type.get().getOutputs().keySet()))
                            .withNode(node)
                            .withConnection(conn));
        }
    }

    private static void checkTargetPort(
            Connection conn, Workflow workflow, WorkflowIndex index, Diagnostics diagnostics) {
        String node = conn.to().node();
        String port = conn.to().port();
        if (ReservedNames.isExit(node)) {
            List<String> valid = new ArrayList<>();
            valid.add(ReservedNames.ON_SUCCESS);
            valid.add(ReservedNames.ON_FAILURE);
            for (String exitPort : workflow.getExitPorts().keySet()) {
                if (!valid.contains(exitPort)) {
                    valid.add(exitPort);
                }
            }
            if (!valid.contains(port)) {
                diagnostics.add(
                        Diagnostic.error(
                                        DiagnosticCode.UNKNOWN_TARGET_PORT,
                                        "Exit node does not have input port \""
                                                + port
                                                + "\""
                                                + StringDistance.didYouMean(port, valid))
                                .withNode(node)
                                .withConnection(conn));
            }
            return;
        }
        Optional<NodeType> type = index.typeOf(node);
        if (type.isPresent() && !type.get().getInputs().containsKey(port)) {
            diagnostics.add(
                    Diagnostic.error(
                                    DiagnosticCode.UNKNOWN_TARGET_PORT,
                                    "Node \""
                                            + node
                                            + "\" does not have input port \""
                                            + port
                                            + "\""
                                            + StringDistance.didYouMean(
                                                    port, type.get().getInputs().keySet()))
                            .withNode(node)
                            .withConnection(conn));
        }
    }
}

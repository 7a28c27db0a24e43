package io.weft.core.validation.rule;

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
import io.weft.core.workflow.port.PortDefinition;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/// Follows data to the workflow's exit: outputs nobody reads, exit ports nobody
/// writes, and exit ports written by several non-exclusive sources.
///
/// All findings are advisory.
public final class DataFlowRule implements ValidationRule {

    @Override
    public Diagnostics check(ValidationContext context) {
        Workflow workflow = context.workflow();
        WorkflowIndex index = context.index();
        Diagnostics diagnostics = Diagnostics.empty();

        Set<String> connectedOutputs = new HashSet<>();
        for (Connection conn : workflow.getConnections()) {
            connectedOutputs.add(conn.from().node() + "." + conn.from().port());
        }
        for (String instanceId : index.resolvedInstanceIds()) {
            NodeType type = index.typeOf(instanceId).orElseThrow();
            for (Map.Entry<String, PortDefinition> entry : type.getOutputs().entrySet()) {
                PortDefinition port = entry.getValue();
                if (port.isControlFlow() || port.isFailure() || port.isScoped()) {
                    continue;
                }
                if (!connectedOutputs.contains(instanceId + "." + entry.getKey())) {
                    diagnostics.add(
                            Diagnostic.warning(
                                            DiagnosticCode.UNUSED_OUTPUT_PORT,
                                            "Output port \""
                                                    + entry.getKey()
                                                    + "\" of node \""
                                                    + instanceId
                                                    + "\" is never connected. Data will be"
                                                    + " discarded.")
                                    .withNode(instanceId)
                                    .withLocation(
                                            index.findInstance(instanceId)
                                                    .map(i -> i.sourceLocation())
                                                    .orElse(null)));
                }
            }
        }

        Map<String, List<Connection>> exitWriters = new LinkedHashMap<>();
        for (Connection conn : index.incoming(ReservedNames.EXIT)) {
            exitWriters.computeIfAbsent(conn.to().port(), k -> new ArrayList<>()).add(conn);
        }
        for (Map.Entry<String, PortDefinition> entry : workflow.getExitPorts().entrySet()) {
            if (entry.getValue().isControlFlow()) {
                continue;
            }
            if (!exitWriters.containsKey(entry.getKey())) {
                diagnostics.add(
                        Diagnostic.warning(
                                DiagnosticCode.UNREACHABLE_EXIT_PORT,
                                "Exit port \""
                                        + entry.getKey()
                                        + "\" has no incoming connection. Return value will be"
                                        + " undefined."));
            }
        }
        for (Map.Entry<String, List<Connection>> entry : exitWriters.entrySet()) {
            List<Connection> writers = entry.getValue();
            if (writers.size() < 2) {
                continue;
            }
            List<String> sources = writers.stream().map(c -> c.from().node()).toList();
            if (BranchExclusivity.areMutuallyExclusive(sources, index)) {
                continue;
            }
            diagnostics.add(
                    Diagnostic.warning(
                            DiagnosticCode.MULTIPLE_EXIT_CONNECTIONS,
                            "Exit port \""
                                    + entry.getKey()
                                    + "\" has "
                                    + writers.size()
                                    + " incoming connections ("
                                    + describeSources(writers)
                                    + "). Only one value will be used - consider using separate"
                                    + " Exit ports."));
        }
        return diagnostics;
    }

    static String describeSources(List<Connection> writers) {
        return writers.stream()
                .map(c -> c.from().node() + "." + c.from().port())
                .collect(Collectors.joining(", "));
    }
}

package io.weft.core.validation.rule;

import io.weft.core.validation.Diagnostic;
import io.weft.core.validation.DiagnosticCode;
import io.weft.core.validation.Diagnostics;
import io.weft.core.validation.ValidationContext;
import io.weft.core.validation.ValidationRule;
import io.weft.core.workflow.ReservedNames;
import io.weft.core.workflow.Workflow;
import io.weft.core.workflow.connection.Connection;
import io.weft.core.workflow.port.DataType;
import io.weft.core.workflow.port.PortDefinition;
import java.util.HashSet;
import java.util.Set;

/// Flags instances no connection touches and a workflow interface that is never
/// wired.
public final class UsageRule implements ValidationRule {

    @Override
    public Diagnostics check(ValidationContext context) {
        Workflow workflow = context.workflow();
        Diagnostics diagnostics = Diagnostics.empty();

        Set<String> used = new HashSet<>();
        for (Connection conn : workflow.getConnections()) {
            used.add(conn.from().node());
            used.add(conn.to().node());
        }
        for (String instanceId : context.index().resolvedInstanceIds()) {
            if (!used.contains(instanceId)) {
                diagnostics.add(
                        Diagnostic.warning(
                                        DiagnosticCode.UNUSED_NODE,
                                        "Node \"" + instanceId + "\" is defined but never used in workflow")
                                .withNode(instanceId)
                                .withLocation(
                                        context.index()
                                                .findInstance(instanceId)
                                                .map(i -> i.sourceLocation())
                                                .orElse(null)));
            }
        }

        boolean fromStart =
                workflow.getConnections().stream().anyMatch(c -> ReservedNames.isStart(c.from().node()));
        if (!fromStart) {
            diagnostics.add(
                    Diagnostic.warning(
                            DiagnosticCode.NO_START_CONNECTIONS,
                            "Workflow has no connections from Start node"));
        }
        boolean toExit =
                workflow.getConnections().stream().anyMatch(c -> ReservedNames.isExit(c.to().node()));
        if (!toExit) {
            diagnostics.add(
                    Diagnostic.warning(
                            DiagnosticCode.NO_EXIT_CONNECTIONS,
                            "Workflow has no connections to Exit node (no return value)"));
        }

        checkExitControlPort(workflow, ReservedNames.ON_SUCCESS, diagnostics);
        checkExitControlPort(workflow, ReservedNames.ON_FAILURE, diagnostics);
        return diagnostics;
    }

    private static void checkExitControlPort(
            Workflow workflow, String portName, Diagnostics diagnostics) {
        PortDefinition port = workflow.getExitPorts().get(portName);
        if (port != null && port.getDataType() != DataType.STEP) {
            diagnostics.add(
                    Diagnostic.error(
                            DiagnosticCode.INVALID_EXIT_PORT_TYPE,
                            "Exit port '"
                                    + portName
                                    + "' must be of type STEP (control flow), found: "
                                    + port.getDataType()));
        }
    }
}

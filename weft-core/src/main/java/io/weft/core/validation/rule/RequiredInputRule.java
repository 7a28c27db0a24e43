package io.weft.core.validation.rule;

import io.weft.core.validation.Diagnostic;
import io.weft.core.validation.DiagnosticCode;
import io.weft.core.validation.Diagnostics;
import io.weft.core.validation.ValidationContext;
import io.weft.core.validation.ValidationRule;
import io.weft.core.workflow.ReservedNames;
import io.weft.core.workflow.WorkflowIndex;
import io.weft.core.workflow.node.NodeInstance;
import io.weft.core.workflow.node.NodeType;
import io.weft.core.workflow.port.PortDefinition;
import java.util.Map;

/// Checks that every required input of every resolved instance has a source.
///
/// An input is required unless it is optional, has a default, carries a
/// type-level expression or an instance-level expression override. The
/// `execute` port and scoped ports are exempt.
public final class RequiredInputRule implements ValidationRule {

    @Override
    public Diagnostics check(ValidationContext context) {
        Diagnostics diagnostics = Diagnostics.empty();
        WorkflowIndex index = context.index();

        for (String instanceId : index.resolvedInstanceIds()) {
            NodeInstance instance = index.findInstance(instanceId).orElseThrow();
            NodeType type = index.findType(instance.nodeType()).orElseThrow();
            for (Map.Entry<String, PortDefinition> entry : type.getInputs().entrySet()) {
                String portName = entry.getKey();
                if (!isRequired(portName, entry.getValue(), instance)) {
                    continue;
                }
                if (!index.isConnected(instanceId, portName)) {
                    diagnostics.add(
                            Diagnostic.error(
                                            DiagnosticCode.MISSING_REQUIRED_INPUT,
                                            "Node \""
                                                    + instanceId
                                                    + "\" has unconnected required input port \""
                                                    + portName
                                                    + "\". Connect a value to it, or mark it"
                                                    + " optional.")
                                    .withNode(instanceId)
                                    .withLocation(instance.sourceLocation()));
                }
            }
        }
        return diagnostics;
    }

    /// Shared with the scope rule, which checks children against the same notion.
    static boolean isRequired(String portName, PortDefinition port, NodeInstance instance) {
        if (ReservedNames.EXECUTE.equals(portName) || port.isScoped()) {
            return false;
        }
        return !port.isSelfSatisfied() && instance.inputExpression(portName).isEmpty();
    }
}

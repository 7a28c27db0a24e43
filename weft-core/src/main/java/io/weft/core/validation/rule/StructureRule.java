package io.weft.core.validation.rule;

import io.weft.core.validation.Diagnostic;
import io.weft.core.validation.DiagnosticCode;
import io.weft.core.validation.Diagnostics;
import io.weft.core.validation.ValidationContext;
import io.weft.core.validation.ValidationRule;
import io.weft.core.workflow.ReservedNames;
import io.weft.core.workflow.Workflow;
import io.weft.core.workflow.node.NodeInstance;
import io.weft.core.workflow.node.NodeType;
import java.util.HashSet;
import java.util.Set;

/// Checks workflow identifiers, duplicate declarations and reserved names.
///
/// Every finding of this rule is fatal.
public final class StructureRule implements ValidationRule {

    private static final String RESERVED_LIST = String.join(", ", ReservedNames.NODE_NAMES);

    @Override
    public Diagnostics check(ValidationContext context) {
        Workflow workflow = context.workflow();
        Diagnostics diagnostics = Diagnostics.empty();

        if (isBlank(workflow.getName())) {
            diagnostics.add(
                    Diagnostic.error(DiagnosticCode.MISSING_WORKFLOW_NAME, "Workflow must have a name"));
        }
        if (isBlank(workflow.getFunctionName())) {
            diagnostics.add(
                    Diagnostic.error(
                            DiagnosticCode.MISSING_FUNCTION_NAME,
                            "Workflow must have a functionName"));
        }

        Set<String> typeNames = new HashSet<>();
        for (NodeType type : workflow.getNodeTypes()) {
            if (!typeNames.add(type.getFunctionName())) {
                diagnostics.add(
                        Diagnostic.error(
                                        DiagnosticCode.DUPLICATE_NODE_NAME,
                                        "Duplicate node type name: \"" + type.getFunctionName() + "\"")
                                .withNode(type.getFunctionName())
                                .withLocation(type.getSourceLocation()));
            }
        }

        Set<String> instanceIds = new HashSet<>();
        for (NodeInstance instance : workflow.getInstances()) {
            if (!instanceIds.add(instance.id())) {
                diagnostics.add(
                        Diagnostic.error(
                                        DiagnosticCode.DUPLICATE_INSTANCE_ID,
                                        "Duplicate instance ID \""
                                                + instance.id()
                                                + "\" in workflow. Each node instance must have a"
                                                + " unique ID.")
                                .withNode(instance.id())
                                .withLocation(instance.sourceLocation()));
            }
        }

        for (NodeType type : workflow.getNodeTypes()) {
            checkReservedTypeName(type.getFunctionName(), type, diagnostics);
            if (!type.getName().equals(type.getFunctionName())) {
                checkReservedTypeName(type.getName(), type, diagnostics);
            }
        }
        for (NodeInstance instance : workflow.getInstances()) {
            if (ReservedNames.isVirtualNode(instance.id())) {
                diagnostics.add(
                        Diagnostic.error(
                                        DiagnosticCode.RESERVED_INSTANCE_ID,
                                        "Instance ID \""
                                                + instance.id()
                                                + "\" is reserved. Reserved names: "
                                                + RESERVED_LIST)
                                .withNode(instance.id())
                                .withLocation(instance.sourceLocation()));
            }
        }
        return diagnostics;
    }

    private static void checkReservedTypeName(
            String typeName, NodeType type, Diagnostics diagnostics) {
        if (ReservedNames.isVirtualNode(typeName)) {
            diagnostics.add(
                    Diagnostic.error(
                                    DiagnosticCode.RESERVED_NODE_NAME,
                                    "Node type name \""
                                            + typeName
                                            + "\" is reserved. Reserved node names: "
                                            + RESERVED_LIST)
                            .withNode(typeName)
                            .withLocation(type.getSourceLocation()));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package io.weft.core.validation.rule;

import io.weft.core.util.StringDistance;
import io.weft.core.validation.Diagnostic;
import io.weft.core.validation.DiagnosticCode;
import io.weft.core.validation.Diagnostics;
import io.weft.core.validation.ValidationContext;
import io.weft.core.validation.ValidationRule;
import io.weft.core.workflow.WorkflowIndex;
import io.weft.core.workflow.node.NodeInstance;
import io.weft.core.workflow.node.NodeType;
import java.util.List;
import java.util.Optional;

/// Checks that every instance references a declared node type.
///
/// Reports unknown types with a suggestion, then advisory warnings for
/// auto-inferred types, then errors for stub types. Draft mode later demotes
/// the stub errors.
public final class NodeTypeResolutionRule implements ValidationRule {

    @Override
    public Diagnostics check(ValidationContext context) {
        Diagnostics diagnostics = Diagnostics.empty();
        WorkflowIndex index = context.index();
        List<NodeInstance> instances = context.workflow().getInstances();
        List<String> knownTypes =
                context.workflow().getNodeTypes().stream().map(NodeType::getFunctionName).toList();

        for (NodeInstance instance : instances) {
            if (!index.hasType(instance.nodeType())) {
                diagnostics.add(
                        Diagnostic.error(
                                        DiagnosticCode.UNKNOWN_NODE_TYPE,
                                        "Node \""
                                                + instance.id()
                                                + "\" references unknown node type \""
                                                + instance.nodeType()
                                                + "\"."
                                                + StringDistance.didYouMean(
                                                        instance.nodeType(), knownTypes))
                                .withNode(instance.id())
                                .withLocation(instance.sourceLocation()));
            }
        }

        for (NodeInstance instance : instances) {
            Optional<NodeType> type = index.findType(instance.nodeType());
            if (type.isPresent() && type.get().isInferred() && !type.get().isStub()) {
                diagnostics.add(
                        Diagnostic.warning(
                                        DiagnosticCode.INFERRED_NODE_TYPE,
                                        "Node type \""
                                                + instance.nodeType()
                                                + "\" was auto-inferred from function signature"
                                                + " (expression mode). Add an explicit node type"
                                                + " declaration for explicit port control.")
                                .withNode(instance.id())
                                .withLocation(instance.sourceLocation()));
            }
        }

        for (NodeInstance instance : instances) {
            if (index.findType(instance.nodeType()).map(NodeType::isStub).orElse(false)) {
                diagnostics.add(
                        Diagnostic.error(
                                        DiagnosticCode.STUB_NODE,
                                        "Node \""
                                                + instance.id()
                                                + "\" uses stub type \""
                                                + instance.nodeType()
                                                + "\" which has no implementation. Use draft mode"
                                                + " to validate structure, or implement the node.")
                                .withNode(instance.id())
                                .withLocation(instance.sourceLocation()));
            }
        }
        return diagnostics;
    }
}

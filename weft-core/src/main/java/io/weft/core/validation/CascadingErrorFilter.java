package io.weft.core.validation;

import io.weft.core.workflow.node.NodeInstance;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/// Drops reference errors that merely echo an unknown node type.
///
/// When an instance references an unknown type, `UNKNOWN_NODE_TYPE` is the root
/// cause. Follow-up errors touching the same instance are noise and removed.
final class CascadingErrorFilter implements DiagnosticPostProcessor {

    private static final Set<DiagnosticCode> CASCADING =
            EnumSet.of(
                    DiagnosticCode.UNKNOWN_SOURCE_NODE,
                    DiagnosticCode.UNKNOWN_TARGET_NODE,
                    DiagnosticCode.UNDEFINED_NODE,
                    DiagnosticCode.MISSING_REQUIRED_INPUT);

    @Override
    public List<Diagnostic> apply(List<Diagnostic> diagnostics, ValidationContext context) {
        Set<String> unresolved =
                context.workflow().getInstances().stream()
                        .filter(instance -> !context.index().hasType(instance.nodeType()))
                        .map(NodeInstance::id)
                        .collect(Collectors.toSet());
        if (unresolved.isEmpty()) {
            return diagnostics;
        }
        return diagnostics.stream().filter(d -> !isCascade(d, unresolved)).toList();
    }

    private static boolean isCascade(Diagnostic d, Set<String> unresolved) {
        if (!d.isError() || !CASCADING.contains(d.code())) {
            return false;
        }
        return unresolved.stream().anyMatch(d::references);
    }
}

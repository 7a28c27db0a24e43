package io.weft.core.validation;

import io.weft.core.workflow.node.NodeInstance;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/// Demotes stub-related errors to warnings when validating in draft mode.
///
/// Affects `STUB_NODE` errors and `MISSING_REQUIRED_INPUT` errors on stub
/// instances. Demoted diagnostics move behind the remaining warnings.
final class DraftModeDemotion implements DiagnosticPostProcessor {

    @Override
    public List<Diagnostic> apply(List<Diagnostic> diagnostics, ValidationContext context) {
        if (!context.options().isDraft()) {
            return diagnostics;
        }
        Set<String> stubInstances =
                context.workflow().getInstances().stream()
                        .filter(
                                instance ->
                                        context.index()
                                                .findType(instance.nodeType())
                                                .map(type -> type.isStub())
                                                .orElse(false))
                        .map(NodeInstance::id)
                        .collect(Collectors.toSet());

        List<Diagnostic> kept = new ArrayList<>();
        List<Diagnostic> demoted = new ArrayList<>();
        for (Diagnostic d : diagnostics) {
            if (d.isError() && isStubFinding(d, stubInstances)) {
                demoted.add(d.withSeverity(Severity.WARNING));
            } else {
                kept.add(d);
            }
        }
        kept.addAll(demoted);
        return kept;
    }

    private static boolean isStubFinding(Diagnostic d, Set<String> stubInstances) {
        return d.code() == DiagnosticCode.STUB_NODE
                || (d.code() == DiagnosticCode.MISSING_REQUIRED_INPUT
                        && d.node() != null
                        && stubInstances.contains(d.node()));
    }
}

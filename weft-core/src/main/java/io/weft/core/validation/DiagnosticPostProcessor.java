package io.weft.core.validation;

import java.util.List;

/// Rewrites the concatenated rule output before it is split into errors and warnings.
///
/// Post-processors may drop, reclassify or annotate diagnostics. They run after
/// every rule, in the order the validator lists them.
public interface DiagnosticPostProcessor {

    /// @param diagnostics all diagnostics so far in check order, not null
    /// @param context validation input, not null
    /// @return rewritten diagnostics, never null
    List<Diagnostic> apply(List<Diagnostic> diagnostics, ValidationContext context);
}

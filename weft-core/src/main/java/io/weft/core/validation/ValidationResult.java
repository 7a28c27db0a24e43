package io.weft.core.validation;

import java.util.ArrayList;
import java.util.List;

/// Outcome of validating one workflow.
///
/// @param valid `true` when `errors` is empty
/// @param errors fatal diagnostics in check order, never null
/// @param warnings advisory diagnostics in check order, never null
public record ValidationResult(boolean valid, List<Diagnostic> errors, List<Diagnostic> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    /// Splits diagnostics by severity. The result is valid when no error remains.
    ///
    /// @param diagnostics diagnostics in check order, not null
    /// @return new result, never null
    public static ValidationResult of(List<Diagnostic> diagnostics) {
        List<Diagnostic> errors = new ArrayList<>();
        List<Diagnostic> warnings = new ArrayList<>();
        for (Diagnostic d : diagnostics) {
            (d.isError() ? errors : warnings).add(d);
        }
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    /// @return errors followed by warnings, never null
    public List<Diagnostic> all() {
        List<Diagnostic> all = new ArrayList<>(errors);
        all.addAll(warnings);
        return all;
    }

    public List<Diagnostic> errorsWithCode(DiagnosticCode code) {
        return errors.stream().filter(d -> d.code() == code).toList();
    }

    public List<Diagnostic> warningsWithCode(DiagnosticCode code) {
        return warnings.stream().filter(d -> d.code() == code).toList();
    }

    /// @return `true` if any error or warning carries the code
    public boolean hasCode(DiagnosticCode code) {
        return all().stream().anyMatch(d -> d.code() == code);
    }
}

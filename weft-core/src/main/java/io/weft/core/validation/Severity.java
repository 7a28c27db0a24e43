package io.weft.core.validation;

/// Severity of a {@link Diagnostic}.
public enum Severity {
    /// Blocks compilation.
    ERROR,
    /// Advisory only.
    WARNING
}

package io.weft.core.validation;

/// How strictly incomplete graphs are judged.
public enum ValidationMode {
    /// Stub node types are errors.
    STRICT,
    /// Stub node types and their missing inputs are demoted to warnings.
    DRAFT
}

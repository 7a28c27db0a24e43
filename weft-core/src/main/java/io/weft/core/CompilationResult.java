package io.weft.core;

import io.weft.core.analysis.ControlFlowAnalysis;
import io.weft.core.generator.GeneratedFunction;
import io.weft.core.validation.ValidationResult;
import java.util.Objects;

/// Output of a successful compilation.
///
/// @param function generated module, not null
/// @param validation validation report; valid, possibly with warnings, not null
/// @param analysis control-flow analysis the module was generated from, not null
public record CompilationResult(
        GeneratedFunction function, ValidationResult validation, ControlFlowAnalysis analysis) {

    public CompilationResult {
        Objects.requireNonNull(function, "function");
        Objects.requireNonNull(validation, "validation");
        Objects.requireNonNull(analysis, "analysis");
    }

    /// @return generated source text, never null
    public String source() {
        return function.source();
    }
}

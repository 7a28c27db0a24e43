package io.weft.core.generator;

import io.weft.core.analysis.ControlFlowAnalysis;
import io.weft.core.workflow.Workflow;

/// Backend that turns an analyzed workflow into program source.
///
/// Implementations do not validate. An invalid workflow yields unspecified
/// output.
///
/// @see DurableFunctionGenerator
public interface CodeGenerator {

    /// Generates source for a workflow.
    ///
    /// @param workflow validated workflow, not null
    /// @param analysis control-flow analysis of the same workflow, not null
    /// @param options generation options, not null
    /// @return generated module, never null
    GeneratedFunction generate(
            Workflow workflow, ControlFlowAnalysis analysis, GenerationOptions options);
}

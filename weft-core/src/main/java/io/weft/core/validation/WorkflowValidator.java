package io.weft.core.validation;

import io.weft.core.workflow.Workflow;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Validates a workflow graph before analysis and code generation.
///
/// Validation never throws for a malformed graph: every problem becomes a
/// {@link Diagnostic}. Callers gate on {@link ValidationResult#valid()}.
///
/// ### Contracts
/// - **Determinism**: validating the same workflow twice yields equal results
/// - **Purity**: the workflow is never modified
///
/// @implNote Stateless and thread-safe. One instance may validate many workflows
/// concurrently.
///
/// @see ValidationPipeline for the rule order
public final class WorkflowValidator {

    private static final Logger logger = Logger.getLogger(WorkflowValidator.class.getName());

    private final ValidationPipeline pipeline;

    public WorkflowValidator() {
        this(ValidationPipeline.standard());
    }

    /// Creates a validator running a custom pipeline.
    ///
    /// @param pipeline rule pipeline, not null
    public WorkflowValidator(ValidationPipeline pipeline) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
    }

    /// Validates with default options.
    ///
    /// @param workflow workflow to validate, not null
    /// @return validation result, never null
    public ValidationResult validate(Workflow workflow) {
        return validate(workflow, ValidationOptions.defaults());
    }

    /// Validates with the given options.
    ///
    /// @param workflow workflow to validate, not null
    /// @param options validation options, not null
    /// @return validation result, never null
    public ValidationResult validate(Workflow workflow, ValidationOptions options) {
        Objects.requireNonNull(workflow, "workflow must not be null");
        Objects.requireNonNull(options, "options must not be null");

        List<Diagnostic> diagnostics = pipeline.execute(ValidationContext.of(workflow, options));
        ValidationResult result = ValidationResult.of(diagnostics);
        logger.fine(
                () ->
                        "Validated workflow '"
                                + workflow.getName()
                                + "' ("
                                + options.getMode()
                                + "): "
                                + result.errors().size()
                                + " error(s), "
                                + result.warnings().size()
                                + " warning(s)");
        return result;
    }
}

package io.weft.core.validation;

import io.weft.core.workflow.Workflow;
import io.weft.core.workflow.WorkflowIndex;
import java.util.Objects;

/// Read-only input shared by every rule of one validation run.
///
/// @param workflow workflow under validation, not null
/// @param index lookup tables built once for this run, not null
/// @param options caller options, not null
public record ValidationContext(Workflow workflow, WorkflowIndex index, ValidationOptions options) {

    public ValidationContext {
        Objects.requireNonNull(workflow, "workflow");
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(options, "options");
    }

    /// Creates a context with a freshly built index.
    ///
    /// @param workflow workflow to validate, not null
    /// @param options caller options, not null
    /// @return new context, never null
    public static ValidationContext of(Workflow workflow, ValidationOptions options) {
        return new ValidationContext(workflow, WorkflowIndex.of(workflow), options);
    }

    /// Type issues are errors when the caller or the workflow asks for strict typing.
    ///
    /// @return `true` if type-compatibility findings are fatal
    public boolean strictTypes() {
        return options.isStrictMode() || workflow.getOptions().strictTypes();
    }
}

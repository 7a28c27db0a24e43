package io.weft.core.validation;

/// One family of checks run by the {@link ValidationPipeline}.
///
/// ### Contracts
/// - **Precondition**: `context` is fully populated
/// - **Postcondition**: Returns a non-null collector owned by the caller
/// - **Invariant**: Rules never mutate the workflow and never call other rules
///
/// @implNote Implementations are stateless and may be shared across threads.
public interface ValidationRule {

    /// Runs the checks of this rule.
    ///
    /// @param context validation input, not null
    /// @return diagnostics found by this rule in check order, never null
    Diagnostics check(ValidationContext context);
}

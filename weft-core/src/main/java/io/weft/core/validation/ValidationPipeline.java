package io.weft.core.validation;

import io.weft.core.validation.rule.ConnectionReferenceRule;
import io.weft.core.validation.rule.CycleRule;
import io.weft.core.validation.rule.DataFlowRule;
import io.weft.core.validation.rule.DeclarationRule;
import io.weft.core.validation.rule.MultipleWriterRule;
import io.weft.core.validation.rule.NodeTypeResolutionRule;
import io.weft.core.validation.rule.RequiredInputRule;
import io.weft.core.validation.rule.ScopeTopologyRule;
import io.weft.core.validation.rule.StructureRule;
import io.weft.core.validation.rule.TypeCompatibilityRule;
import io.weft.core.validation.rule.UsageRule;
import java.util.ArrayList;
import java.util.List;

/// Runs a list of {@link ValidationRule}s in order and then applies the
/// {@link DiagnosticPostProcessor}s to the concatenated output.
///
/// ### Contracts
/// - **Invariant**: Rules are invoked in list order and every rule runs; a rule
///   never sees the diagnostics of another rule
/// - **Postcondition**: Diagnostics appear in rule order, then each post-processor
///   rewrites the whole list in its own order
///
/// @implNote Stateless and thread-safe. Rule and processor lists are copied at
/// construction time.
///
/// @see ValidationRule for the rule contract
public final class ValidationPipeline {

    private final List<ValidationRule> rules;
    private final List<DiagnosticPostProcessor> postProcessors;

    /// Creates a pipeline with the given rules and post-processors.
    ///
    /// @param rules ordered rules, not null (may be empty)
    /// @param postProcessors ordered post-processors, not null (may be empty)
    public ValidationPipeline(
            List<ValidationRule> rules, List<DiagnosticPostProcessor> postProcessors) {
        this.rules = List.copyOf(rules);
        this.postProcessors = List.copyOf(postProcessors);
    }

    /// Builds the standard workflow validation pipeline.
    ///
    /// Rule order:
    /// 1. Node type resolution, inferred and stub types
    /// 2. Structure: names, duplicates, reserved identifiers
    /// 3. Connection references and duplicate connections
    /// 4. Type compatibility
    /// 5. Required inputs
    /// 6. Usage of nodes and the Start/Exit interface
    /// 7. Data flow: unused outputs and exit ports
    /// 8. Cycles per scope layer
    /// 9. Multiple writers into one input
    /// 10. Declarations: colors, port configs, scope names
    /// 11. Scope topology
    ///
    /// Post-processing order: cascade suppression, draft-mode demotion,
    /// documentation links.
    ///
    /// @return configured pipeline, never null
    public static ValidationPipeline standard() {
        return new ValidationPipeline(
                List.of(
                        new NodeTypeResolutionRule(),
                        new StructureRule(),
                        new ConnectionReferenceRule(),
                        new TypeCompatibilityRule(),
                        new RequiredInputRule(),
                        new UsageRule(),
                        new DataFlowRule(),
                        new CycleRule(),
                        new MultipleWriterRule(),
                        new DeclarationRule(),
                        new ScopeTopologyRule()),
                List.of(
                        new CascadingErrorFilter(),
                        new DraftModeDemotion(),
                        new DocumentationLinker()));
    }

    /// Runs every rule, then every post-processor.
    ///
    /// @param context shared validation input, not null
    /// @return final diagnostics in order, never null
    public List<Diagnostic> execute(ValidationContext context) {
        Diagnostics collected = Diagnostics.empty();
        for (var rule : rules) {
            collected.addAll(rule.check(context));
        }
        List<Diagnostic> diagnostics = new ArrayList<>(collected.asList());
        for (var processor : postProcessors) {
            diagnostics = processor.apply(diagnostics, context);
        }
        return diagnostics;
    }
}

package io.weft.core;

import io.weft.core.analysis.CircularDependencyException;
import io.weft.core.analysis.ControlFlowAnalysis;
import io.weft.core.analysis.ControlFlowAnalyzer;
import io.weft.core.exception.CompilationException;
import io.weft.core.generator.CodeGenerator;
import io.weft.core.generator.DurableFunctionGenerator;
import io.weft.core.generator.GeneratedFunction;
import io.weft.core.validation.Diagnostic;
import io.weft.core.validation.ValidationResult;
import io.weft.core.validation.WorkflowValidator;
import io.weft.core.workflow.Workflow;
import java.util.Objects;
import java.util.logging.Logger;

/// Entry point that compiles a workflow graph into a durable function module.
///
/// ### Pipeline
/// 1. Validate the workflow; errors stop compilation
/// 2. Analyze control flow
/// 3. Generate source
///
/// ### Contracts
/// - **Gate**: the generator never sees a workflow with validation errors
/// - **Purity**: the workflow is never modified
///
/// @implNote Thread-safe when its collaborators are. The default collaborators
/// are stateless.
///
/// @apiNote Create instances via {@link #create()} or {@link #create(CompilerConfig)}.
/// The public constructor exists for custom collaborators.
public final class WeftCompiler {

    private static final Logger logger = Logger.getLogger(WeftCompiler.class.getName());

    private final WorkflowValidator validator;
    private final ControlFlowAnalyzer analyzer;
    private final CodeGenerator generator;
    private final CompilerConfig config;

    /// Creates a compiler from explicit collaborators.
    ///
    /// @param validator workflow validator, not null
    /// @param analyzer control-flow analyzer, not null
    /// @param generator code generator, not null
    /// @param config compiler configuration, not null
    public WeftCompiler(
            WorkflowValidator validator,
            ControlFlowAnalyzer analyzer,
            CodeGenerator generator,
            CompilerConfig config) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /// @return compiler with default configuration, never null
    public static WeftCompiler create() {
        return create(CompilerConfig.defaults());
    }

    /// @param config compiler configuration, not null
    /// @return compiler with the standard validator, analyzer and durable generator
    public static WeftCompiler create(CompilerConfig config) {
        return new WeftCompiler(
                new WorkflowValidator(), new ControlFlowAnalyzer(), new DurableFunctionGenerator(), config);
    }

    public CompilerConfig getConfig() {
        return config;
    }

    /// Validates without generating.
    ///
    /// @param workflow workflow to validate, not null
    /// @return validation report, never null
    public ValidationResult validate(Workflow workflow) {
        return validator.validate(workflow, config.getValidationOptions());
    }

    /// Compiles a workflow.
    ///
    /// @param workflow workflow to compile, not null
    /// @return generated module with its validation report and analysis, never null
    /// @throws CompilationException if validation reports errors or the control
    ///     flow cannot be ordered
    public CompilationResult compile(Workflow workflow) throws CompilationException {
        Objects.requireNonNull(workflow, "workflow must not be null");

        ValidationResult validation = validate(workflow);
        if (!validation.valid()) {
            Diagnostic first = validation.errors().get(0);
            logger.info(
                    "Workflow '"
                            + workflow.getName()
                            + "' failed validation with "
                            + validation.errors().size()
                            + " error(s)");
            throw new CompilationException(
                    "Workflow '"
                            + workflow.getName()
                            + "' has "
                            + validation.errors().size()
                            + " validation error(s), first: "
                            + first.code()
                            + ": "
                            + first.message(),
                    validation);
        }

        ControlFlowAnalysis analysis;
        try {
            analysis = analyzer.analyze(workflow);
        } catch (CircularDependencyException e) {
            throw new CompilationException(
                    "Cannot order workflow '" + workflow.getName() + "': " + e.getMessage(), e);
        }

        GeneratedFunction function =
                generator.generate(workflow, analysis, config.getGenerationOptions());
        logger.info(
                "Compiled workflow '"
                        + workflow.getName()
                        + "' to function '"
                        + function.functionId()
                        + "' with "
                        + function.stepIds().size()
                        + " step(s), "
                        + validation.warnings().size()
                        + " warning(s)");
        return new CompilationResult(function, validation, analysis);
    }
}

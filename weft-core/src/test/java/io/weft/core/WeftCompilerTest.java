package io.weft.core;

import static io.weft.core.TestWorkflows.controlOnly;
import static io.weft.core.TestWorkflows.sink;
import static io.weft.core.TestWorkflows.source;
import static io.weft.core.TestWorkflows.workflow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.weft.core.analysis.CircularDependencyException;
import io.weft.core.analysis.ControlFlowAnalyzer;
import io.weft.core.exception.CompilationException;
import io.weft.core.generator.CodeGenerator;
import io.weft.core.generator.GenerationOptions;
import io.weft.core.validation.Diagnostic;
import io.weft.core.validation.DiagnosticCode;
import io.weft.core.validation.ValidationOptions;
import io.weft.core.validation.ValidationResult;
import io.weft.core.validation.WorkflowValidator;
import io.weft.core.workflow.Workflow;
import io.weft.core.workflow.port.DataType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("WeftCompiler")
@ExtendWith(MockitoExtension.class)
class WeftCompilerTest {

    @Mock private WorkflowValidator validator;
    @Mock private CodeGenerator generator;

    private static Workflow fetchAndSave() {
        return workflow("fetchAndSave")
                .nodeType(source("fetch", DataType.STRING))
                .nodeType(sink("save", DataType.STRING))
                .instance("fetch1", "fetch")
                .instance("save1", "save")
                .connect("Start", "execute", "fetch1", "execute")
                .connect("fetch1", "onSuccess", "save1", "execute")
                .connect("fetch1", "out", "save1", "in")
                .connect("save1", "onSuccess", "Exit", "onSuccess")
                .build();
    }

    @Nested
    @DisplayName("end to end")
    class EndToEnd {

        @Test
        void shouldCompileValidWorkflow() throws CompilationException {
            // Given
            WeftCompiler compiler = WeftCompiler.create();

            // When
            CompilationResult result = compiler.compile(fetchAndSave());

            // Then
            assertThat(result.validation().valid()).isTrue();
            assertThat(result.validation().warnings()).isEmpty();
            assertThat(result.analysis().branchingNodes()).containsExactly("fetch1");
            assertThat(result.function().functionId()).isEqualTo("fetch-and-save");
            assertThat(result.source())
                    .contains("export const fetchAndSaveFn = inngest.createFunction(")
                    .contains("    if (fetch1_result.onSuccess) {\n")
                    .contains("return save(fetch1_result.onSuccess, fetch1_result.out);");
        }

        @Test
        void shouldApplyConfiguredGenerationOptions() throws CompilationException {
            CompilerConfig config =
                    CompilerConfig.builder()
                            .generationOptions(GenerationOptions.builder().production(true).build())
                            .build();

            CompilationResult result = WeftCompiler.create(config).compile(fetchAndSave());

            assertThat(result.source()).doesNotContain("// Generated by weft");
        }

        @Test
        @DisplayName("stops at validation errors and keeps the report")
        void shouldRejectInvalidWorkflow() {
            // Given
            Workflow wf =
                    workflow("broken")
                            .nodeType(controlOnly("step"))
                            .instance("a", "missingType")
                            .build();

            // When / Then
            assertThatThrownBy(() -> WeftCompiler.create().compile(wf))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageStartingWith("Workflow 'broken workflow' has ")
                    .hasMessageContaining(" validation error(s), first: ")
                    .satisfies(
                            e ->
                                    assertThat(
                                                    ((CompilationException) e)
                                                            .getValidationResult()
                                                            .hasCode(
                                                                    DiagnosticCode
                                                                            .UNKNOWN_NODE_TYPE))
                                            .isTrue());
        }
    }

    @Nested
    @DisplayName("with collaborators")
    class WithCollaborators {

        @Test
        void shouldNotGenerateWhenValidationFails() {
            // Given
            Workflow wf = fetchAndSave();
            ValidationResult invalid =
                    ValidationResult.of(
                            List.of(
                                    Diagnostic.error(
                                            DiagnosticCode.UNKNOWN_NODE_TYPE,
                                            "Unknown node type 'x'"),
                                    Diagnostic.warning(
                                            DiagnosticCode.INFERRED_NODE_TYPE, "Inferred 'y'")));
            when(validator.validate(any(Workflow.class), any(ValidationOptions.class)))
                    .thenReturn(invalid);
            WeftCompiler compiler =
                    new WeftCompiler(
                            validator, new ControlFlowAnalyzer(), generator, CompilerConfig.defaults());

            // When / Then
            assertThatThrownBy(() -> compiler.compile(wf))
                    .isInstanceOf(CompilationException.class)
                    .hasMessage(
                            "Workflow 'fetchAndSave workflow' has 1 validation error(s), first:"
                                    + " UNKNOWN_NODE_TYPE: Unknown node type 'x'");
            verify(generator, never()).generate(any(), any(), any());
        }

        @Test
        void shouldPassConfiguredValidationOptions() {
            // Given
            ValidationOptions draft = ValidationOptions.draft();
            CompilerConfig config = CompilerConfig.builder().validationOptions(draft).build();
            Workflow wf = fetchAndSave();
            ValidationResult ok = ValidationResult.of(List.of());
            when(validator.validate(wf, draft)).thenReturn(ok);
            WeftCompiler compiler =
                    new WeftCompiler(validator, new ControlFlowAnalyzer(), generator, config);

            // When
            ValidationResult result = compiler.validate(wf);

            // Then
            assertThat(result).isSameAs(ok);
            verify(validator).validate(wf, draft);
        }

        @Test
        @DisplayName("wraps a cycle that slipped past validation")
        void shouldWrapCircularDependency() {
            // Given
            Workflow wf =
                    workflow("loop")
                            .nodeType(controlOnly("step"))
                            .instance("a", "step")
                            .instance("b", "step")
                            .connect("Start", "execute", "a", "execute")
                            .connect("a", "onSuccess", "b", "execute")
                            .connect("b", "onSuccess", "a", "execute")
                            .build();
            when(validator.validate(any(Workflow.class), any(ValidationOptions.class)))
                    .thenReturn(ValidationResult.of(List.of()));
            WeftCompiler compiler =
                    new WeftCompiler(
                            validator, new ControlFlowAnalyzer(), generator, CompilerConfig.defaults());

            // When / Then
            assertThatThrownBy(() -> compiler.compile(wf))
                    .isInstanceOf(CompilationException.class)
                    .hasMessage(
                            "Cannot order workflow 'loop workflow': Circular dependency detected"
                                    + " in workflow. Nodes in cycle: a, b")
                    .hasCauseInstanceOf(CircularDependencyException.class)
                    .satisfies(
                            e ->
                                    assertThat(((CompilationException) e).getValidationResult())
                                            .isNull());
            verify(generator, never()).generate(any(), any(), any());
        }

        @Test
        void shouldRejectNullCollaborators() {
            assertThatThrownBy(
                            () ->
                                    new WeftCompiler(
                                            null,
                                            new ControlFlowAnalyzer(),
                                            generator,
                                            CompilerConfig.defaults()))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("validator must not be null");
        }
    }
}

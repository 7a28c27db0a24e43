package io.weft.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.weft.core.analysis.ControlFlowAnalyzer;
import io.weft.core.generator.DurableFunctionGenerator;
import io.weft.core.generator.GenerationOptions;
import io.weft.core.validation.Diagnostic;
import io.weft.core.validation.DiagnosticCode;
import io.weft.core.validation.ValidationResult;
import io.weft.core.workflow.SourceLocation;
import io.weft.core.workflow.Workflow;
import io.weft.core.workflow.WorkflowOptions;
import io.weft.core.workflow.WorkflowOptions.Trigger;
import io.weft.core.workflow.connection.CoerceType;
import io.weft.core.workflow.connection.Connection;
import io.weft.core.workflow.connection.PortReference;
import io.weft.core.workflow.node.InstanceConfig;
import io.weft.core.workflow.node.NodeInstance;
import io.weft.core.workflow.node.NodeType;
import io.weft.core.workflow.node.PortConfig;
import io.weft.core.workflow.port.DataType;
import io.weft.core.workflow.port.MergeStrategy;
import io.weft.core.workflow.port.PortDefinition;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("WorkflowSerializer")
class WorkflowSerializerTest {

    private static Workflow loadFixture(String name) throws IOException {
        try (InputStream in =
                WorkflowSerializerTest.class.getResourceAsStream("/workflows/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return WorkflowSerializer.fromJson(in);
        }
    }

    /// Same graph as `workflows/user-sync.json`, built in code.
    private static Workflow userSync() {
        return Workflow.builder()
                .name("user sync")
                .functionName("userSync")
                .nodeType(
                        NodeType.builder()
                                .functionName("fetchUser")
                                .async(true)
                                .input("userId", PortDefinition.of(DataType.STRING))
                                .output("user", PortDefinition.of(DataType.OBJECT))
                                .build())
                .nodeType(
                        NodeType.builder()
                                .functionName("saveUser")
                                .input("payload", PortDefinition.of(DataType.STRING))
                                .build())
                .instance("fetch1", "fetchUser")
                .instance("save1", "saveUser")
                .connect("Start", "execute", "fetch1", "execute")
                .connect("Start", "userId", "fetch1", "userId")
                .connect("fetch1", "onSuccess", "save1", "execute")
                .connection(
                        Connection.of("fetch1", "user", "save1", "payload")
                                .coercedTo(CoerceType.JSON))
                .connect("save1", "onSuccess", "Exit", "onSuccess")
                .startPort("userId", PortDefinition.of(DataType.STRING))
                .options(
                        new WorkflowOptions(
                                false, 5, null, null, null, new Trigger(null, "0 * * * *")))
                .build();
    }

    @Nested
    @DisplayName("reading")
    class Reading {

        @Test
        @DisplayName("reads string endpoints, lowercase enums and ignores unknown fields")
        void shouldReadFixture() throws IOException {
            // When
            Workflow wf = loadFixture("user-sync.json");

            // Then
            assertThat(wf).isEqualTo(userSync());
            assertThat(wf.getStartPorts()).isEqualTo(userSync().getStartPorts());
            assertThat(wf.getOptions()).isEqualTo(userSync().getOptions());
            assertThat(wf.getConnections().get(3).coerce()).isEqualTo(CoerceType.JSON);
        }

        @Test
        void shouldAddImplicitControlPortsToDeclaredTypes() throws IOException {
            NodeType fetch = loadFixture("user-sync.json").getNodeTypes().get(0);

            assertThat(fetch.getName()).isEqualTo("fetchUser");
            assertThat(fetch.getInputs()).containsOnlyKeys("execute", "userId");
            assertThat(fetch.getOutputs()).containsOnlyKeys("onSuccess", "onFailure", "user");
            assertThat(fetch.isAsync()).isTrue();
        }

        @Test
        @DisplayName("produces a workflow the generator can compile")
        void shouldFeedGenerator() throws IOException {
            // Given
            Workflow wf = loadFixture("user-sync.json");

            // When
            String source =
                    new DurableFunctionGenerator()
                            .generate(
                                    wf,
                                    new ControlFlowAnalyzer().analyze(wf),
                                    GenerationOptions.defaults())
                            .source();

            // Then
            assertThat(source)
                    .contains("export const userSyncFn = inngest.createFunction(")
                    .contains("  { id: 'user-sync', retries: 5 },")
                    .contains("  { cron: '0 * * * *' },")
                    .contains("return await fetchUser(true, event.data.userId);")
                    .contains("return saveUser(fetch1_result.onSuccess, JSON.stringify(fetch1_result.user));");
        }

        @Test
        void shouldParseScopedStringEndpoint() throws IOException {
            ObjectMapper mapper = WorkflowSerializer.createMapper();

            PortReference ref = mapper.readValue("\"loop1.item:each\"", PortReference.class);

            assertThat(ref).isEqualTo(new PortReference("loop1", "item", "each"));
        }

        @Test
        void shouldSplitNodeAtFirstDot() throws IOException {
            ObjectMapper mapper = WorkflowSerializer.createMapper();

            PortReference ref = mapper.readValue("\"fetch.data.raw\"", PortReference.class);

            assertThat(ref.node()).isEqualTo("fetch");
            assertThat(ref.port()).isEqualTo("data.raw");
            assertThat(ref.isScoped()).isFalse();
        }

        @Test
        void shouldRejectMalformedEndpoint() {
            String json =
                    "{\"name\": \"bad\", \"functionName\": \"bad\","
                            + " \"connections\": [{\"from\": \"Start\", \"to\": \"a.execute\"}]}";

            assertThatThrownBy(() -> WorkflowSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Failed to deserialize workflow: ")
                    .hasMessageContaining("Expected 'node.port[:scope]' but got 'Start'");
        }

        @Test
        void shouldRejectInvalidJson() {
            assertThatThrownBy(() -> WorkflowSerializer.fromJson("{ not json"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Failed to deserialize workflow: ");
        }
    }

    @Nested
    @DisplayName("writing")
    class Writing {

        @Test
        @DisplayName("round-trips a workflow with scopes, configs and port metadata")
        void shouldRoundTrip() {
            // Given
            NodeType forEach =
                    NodeType.builder()
                            .functionName("forEach")
                            .input("items", PortDefinition.of(DataType.ARRAY))
                            .output(
                                    "item",
                                    PortDefinition.builder()
                                            .dataType(DataType.ANY)
                                            .scope("each")
                                            .build())
                            .build();
            NodeType collect =
                    NodeType.builder()
                            .functionName("collect")
                            .input(
                                    "value",
                                    PortDefinition.builder()
                                            .dataType(DataType.ANY)
                                            .mergeStrategy(MergeStrategy.COLLECT)
                                            .defaultValue("none")
                                            .label("Value")
                                            .build())
                            .build();
            Workflow original =
                    Workflow.builder()
                            .name("batch")
                            .functionName("batch")
                            .nodeType(forEach)
                            .nodeType(collect)
                            .instance("loop1", "forEach")
                            .instance(
                                    NodeInstance.of("c1", "collect")
                                            .inScope("loop1", "each")
                                            .withConfig(
                                                    new InstanceConfig(
                                                            List.of(
                                                                    PortConfig.expression(
                                                                            "value", "'x'")),
                                                            "#ff0000")))
                            .connect("Start", "items", "loop1", "items")
                            .connection(
                                    new Connection(
                                            new PortReference("loop1", "item", "each"),
                                            PortReference.of("c1", "value"),
                                            null,
                                            new SourceLocation("batch.ts", 4, 2)))
                            .startPort("items", PortDefinition.of(DataType.ARRAY))
                            .build();

            // When
            Workflow restored = WorkflowSerializer.fromJson(WorkflowSerializer.toJson(original));

            // Then
            assertThat(restored).isEqualTo(original);
            assertThat(restored.getInstances().get(1).parent().scope()).isEqualTo("each");
            assertThat(restored.getConnections().get(1).sourceLocation())
                    .isEqualTo(new SourceLocation("batch.ts", 4, 2));
            assertThat(restored.getStartPorts()).isEqualTo(original.getStartPorts());
        }

        @Test
        void shouldWriteEndpointsAsObjects() throws IOException {
            String json = WorkflowSerializer.toJson(userSync());

            JsonNode first = WorkflowSerializer.createMapper().readTree(json).get("connections").get(0);

            assertThat(first.get("from").get("node").asText()).isEqualTo("Start");
            assertThat(first.get("from").get("port").asText()).isEqualTo("execute");
            assertThat(first.get("from").has("scope")).isFalse();
            assertThat(first.has("coerce")).isFalse();
            assertThat(first.has("scoped")).isFalse();
        }
    }

    @Nested
    @DisplayName("validation report")
    class ValidationReport {

        @Test
        void shouldRenderDiagnostics() throws IOException {
            // Given
            ValidationResult result =
                    ValidationResult.of(
                            List.of(
                                    Diagnostic.error(DiagnosticCode.TYPE_MISMATCH, "Type mismatch")
                                            .withNode("b")
                                            .withConnection(Connection.of("a", "out", "b", "in"))
                                            .withLocation(new SourceLocation("flow.ts", 3, 7))
                                            .withDocUrl("https://weft.dev/docs/reference/types"),
                                    Diagnostic.warning(
                                            DiagnosticCode.INFERRED_NODE_TYPE, "Inferred 'x'")));

            // When
            JsonNode root =
                    WorkflowSerializer.createMapper().readTree(WorkflowSerializer.toJson(result));

            // Then
            assertThat(root.get("valid").asBoolean()).isFalse();
            JsonNode error = root.get("errors").get(0);
            assertThat(error.get("severity").asText()).isEqualTo("error");
            assertThat(error.get("code").asText()).isEqualTo("TYPE_MISMATCH");
            assertThat(error.get("message").asText()).isEqualTo("Type mismatch");
            assertThat(error.get("node").asText()).isEqualTo("b");
            assertThat(error.get("connection").asText()).isEqualTo("a.out -> b.in");
            assertThat(error.get("location").get("file").asText()).isEqualTo("flow.ts");
            assertThat(error.get("location").get("line").asInt()).isEqualTo(3);
            assertThat(error.get("location").get("column").asInt()).isEqualTo(7);
            assertThat(error.get("docUrl").asText())
                    .isEqualTo("https://weft.dev/docs/reference/types");

            JsonNode warning = root.get("warnings").get(0);
            assertThat(warning.get("severity").asText()).isEqualTo("warning");
            assertThat(warning.has("node")).isFalse();
            assertThat(warning.has("location")).isFalse();
        }

        @Test
        void shouldRenderValidResult() throws IOException {
            JsonNode root =
                    WorkflowSerializer.createMapper()
                            .readTree(WorkflowSerializer.toJson(ValidationResult.of(List.of())));

            assertThat(root.get("valid").asBoolean()).isTrue();
            assertThat(root.get("errors")).isEmpty();
            assertThat(root.get("warnings")).isEmpty();
        }
    }
}

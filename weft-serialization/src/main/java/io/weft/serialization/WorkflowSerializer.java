package io.weft.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.weft.core.validation.Diagnostic;
import io.weft.core.validation.ValidationResult;
import io.weft.core.workflow.SourceLocation;
import io.weft.core.workflow.Workflow;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;

/// Utility class for reading and writing weft workflows as JSON.
///
/// Provides a pre-configured `ObjectMapper` for the graph model and a renderer for
/// validation reports.
///
/// ### Usage
/// {@snippet :
/// // Serialize
/// String json = WorkflowSerializer.toJson(workflow);
///
/// // Deserialize
/// Workflow restored = WorkflowSerializer.fromJson(json);
///
/// // Validation report
/// String report = WorkflowSerializer.toJson(validator.validate(restored));
/// }
///
/// @implNote Thread-safe. The ObjectMapper is created per call via `createMapper()`.
/// For high-throughput scenarios, cache the mapper.
///
/// @see WeftJacksonModule for the registered type handlers
public final class WorkflowSerializer {

    private WorkflowSerializer() {}

    /// Serializes a workflow to pretty-printed JSON.
    ///
    /// @param workflow the workflow to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Workflow workflow) {
        try {
            return createMapper().writeValueAsString(workflow);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize workflow: " + e.getMessage(), e);
        }
    }

    /// Deserializes a workflow from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized workflow, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static Workflow fromJson(String json) {
        try {
            return createMapper().readValue(json, Workflow.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize workflow: " + e.getMessage(), e);
        }
    }

    /// Deserializes a workflow from a JSON stream. The stream is not closed.
    ///
    /// @param in JSON input, not null
    /// @return deserialized workflow, never null
    /// @throws IllegalArgumentException if the stream cannot be read or parsed
    public static Workflow fromJson(InputStream in) {
        try {
            return createMapper().readValue(in, Workflow.class);
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize workflow: " + e.getMessage(), e);
        }
    }

    /// Renders a validation report as
    /// `{"valid": .., "errors": [..], "warnings": [..]}`.
    ///
    /// Each diagnostic carries `severity`, `code`, `message` and, when present,
    /// `node`, `connection` (`"a.out -> b.in"`), `location` and `docUrl`.
    ///
    /// @param result validation result, not null
    /// @return pretty-printed JSON, never null
    /// @throws IllegalArgumentException if rendering fails
    public static String toJson(ValidationResult result) {
        ObjectMapper mapper = createMapper();
        ObjectNode root = mapper.createObjectNode();
        root.put("valid", result.valid());
        writeDiagnostics(root.putArray("errors"), result.errors());
        writeDiagnostics(root.putArray("warnings"), result.warnings());
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize validation result: " + e.getMessage(), e);
        }
    }

    private static void writeDiagnostics(ArrayNode array, List<Diagnostic> diagnostics) {
        for (Diagnostic d : diagnostics) {
            ObjectNode entry = array.addObject();
            entry.put("severity", d.severity().name().toLowerCase(Locale.ROOT));
            entry.put("code", d.code().name());
            entry.put("message", d.message());
            if (d.node() != null) {
                entry.put("node", d.node());
            }
            if (d.connection() != null) {
                entry.put("connection", d.connection().toString());
            }
            SourceLocation location = d.location();
            if (location != null) {
                ObjectNode loc = entry.putObject("location");
                if (location.file() != null) {
                    loc.put("file", location.file());
                }
                loc.put("line", location.line());
                loc.put("column", location.column());
            }
            if (d.docUrl() != null) {
                entry.put("docUrl", d.docUrl());
            }
        }
    }

    /// Creates an ObjectMapper configured for weft workflow serialization.
    ///
    /// Registers:
    /// - `WeftJacksonModule` for the graph model
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - case-insensitive enum names, so `"number"` reads as `NUMBER`
    /// - null fields omitted on write
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return JsonMapper.builder()
                .addModule(new WeftJacksonModule())
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .build();
    }
}

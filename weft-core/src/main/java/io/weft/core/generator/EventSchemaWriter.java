package io.weft.core.generator;

import io.weft.core.util.Identifiers;
import io.weft.core.workflow.ReservedNames;
import io.weft.core.workflow.Workflow;
import io.weft.core.workflow.port.PortDefinition;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Emits a zod schema describing the trigger event payload.
///
/// One field per declared start port. The structural type wins over the data
/// type tag when both are present.
final class EventSchemaWriter {

    private EventSchemaWriter() {}

    /// @return schema declaration lines, empty when the workflow declares no inputs
    static List<String> write(Workflow workflow, String eventName) {
        List<String> fields = new ArrayList<>();
        for (Map.Entry<String, PortDefinition> entry : workflow.getStartPorts().entrySet()) {
            if (ReservedNames.EXECUTE.equals(entry.getKey())) {
                continue;
            }
            PortDefinition port = entry.getValue();
            String type =
                    port.getTsType() != null ? port.getTsType() : port.getDataType().name();
            fields.add("      " + entry.getKey() + ": " + zodType(type) + ",");
        }
        if (fields.isEmpty()) {
            return List.of();
        }

        List<String> lines = new ArrayList<>();
        lines.add("const " + Identifiers.toValidIdentifier(workflow.getFunctionName()) + "Event = {");
        lines.add("  name: '" + eventName + "',");
        lines.add("  schema: z.object({");
        lines.add("    data: z.object({");
        lines.addAll(fields);
        lines.add("    }),");
        lines.add("  }),");
        lines.add("};");
        lines.add("");
        return lines;
    }

    static String zodType(String type) {
        if (type == null || type.isBlank()) {
            return "z.unknown()";
        }
        String t = type.trim().toLowerCase(Locale.ROOT);
        return switch (t) {
            case "string" -> "z.string()";
            case "number" -> "z.number()";
            case "boolean" -> "z.boolean()";
            case "string[]" -> "z.array(z.string())";
            case "number[]" -> "z.array(z.number())";
            case "object" -> "z.record(z.unknown())";
            case "array" -> "z.array(z.unknown())";
            case "any" -> "z.unknown()";
            default -> t.startsWith("record<")
                    ? "z.record(z.unknown())"
                    : "z.unknown() /* " + type + " */";
        };
    }
}

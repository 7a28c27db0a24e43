package io.weft.core.generator;

import java.util.List;
import java.util.Objects;

/// Source module produced for one workflow, with the identifiers it declares.
///
/// @param source complete module text, not null
/// @param functionId id of the generated durable function, not null
/// @param serviceName client id, not null
/// @param triggerEvent event the function listens to, or null for cron triggers
/// @param importedFunctions node functions imported by the module, in import order
/// @param stepIds step ids in emission order; loop steps keep their template suffix
public record GeneratedFunction(
        String source,
        String functionId,
        String serviceName,
        String triggerEvent,
        List<String> importedFunctions,
        List<String> stepIds) {

    public GeneratedFunction {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(functionId, "functionId");
        Objects.requireNonNull(serviceName, "serviceName");
        importedFunctions = List.copyOf(importedFunctions);
        stepIds = List.copyOf(stepIds);
    }
}

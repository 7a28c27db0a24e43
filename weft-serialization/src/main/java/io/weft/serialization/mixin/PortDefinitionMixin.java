package io.weft.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.weft.core.workflow.port.PortDefinition;

/// Binds `PortDefinition` deserialization to its builder. Derived flags are
/// computed from stored fields and never written.
///
/// @see PortDefinitionBuilderMixin
@JsonDeserialize(builder = PortDefinition.Builder.class)
public abstract class PortDefinitionMixin {

    @JsonIgnore
    abstract boolean isScoped();

    @JsonIgnore
    abstract boolean isStep();

    @JsonIgnore
    abstract boolean isSelfSatisfied();
}

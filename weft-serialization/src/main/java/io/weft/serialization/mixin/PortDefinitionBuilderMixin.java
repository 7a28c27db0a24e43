package io.weft.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Jackson mixin for `PortDefinition.Builder`.
///
/// @see PortDefinitionMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class PortDefinitionBuilderMixin {}

package io.weft.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Jackson mixin for `NodeType.Builder`.
///
/// @see NodeTypeMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class NodeTypeBuilderMixin {}

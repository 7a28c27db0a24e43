package io.weft.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.weft.core.workflow.node.NodeType;

/// Binds `NodeType` deserialization to its builder and hides derived getters.
///
/// @see NodeTypeBuilderMixin
@JsonDeserialize(builder = NodeType.Builder.class)
public abstract class NodeTypeMixin {

    @JsonIgnore
    abstract boolean isStub();
}

package io.weft.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import io.weft.core.workflow.Workflow;
import io.weft.core.workflow.connection.Connection;
import io.weft.core.workflow.node.NodeInstance;
import io.weft.core.workflow.node.NodeType;

/// Jackson mixin for `Workflow.Builder`: JSON field names map directly to builder
/// methods. The single-element appenders are hidden so only the list setters bind.
///
/// @see WorkflowMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class WorkflowBuilderMixin {

    @JsonIgnore
    abstract Workflow.Builder nodeType(NodeType nodeType);

    @JsonIgnore
    abstract Workflow.Builder instance(NodeInstance instance);

    @JsonIgnore
    abstract Workflow.Builder connection(Connection connection);
}

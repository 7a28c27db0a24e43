package io.weft.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.weft.core.workflow.Workflow;

/// Jackson mixin that binds `Workflow` deserialization to its builder.
///
/// @apiNote The companion mixin {@link WorkflowBuilderMixin} must also be registered
/// so Jackson knows how to invoke the builder's setters and `build()` method.
///
/// @see io.weft.serialization.WeftJacksonModule
@JsonDeserialize(builder = Workflow.Builder.class)
public abstract class WorkflowMixin {}

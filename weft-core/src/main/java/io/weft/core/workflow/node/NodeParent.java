package io.weft.core.workflow.node;

import java.util.Objects;

/// Places an instance inside a named scope of a container instance.
///
/// The container is referenced by id only. Resolve it through
/// {@link io.weft.core.workflow.WorkflowIndex}.
///
/// @param id container instance id, not null
/// @param scope scope name declared on the container's node type, not null
public record NodeParent(String id, String scope) {

    public NodeParent {
        Objects.requireNonNull(id, "Parent id required");
        Objects.requireNonNull(scope, "Parent scope required");
    }
}

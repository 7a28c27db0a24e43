package io.weft.core.workflow.node;

import io.weft.core.workflow.SourceLocation;
import java.util.Objects;
import java.util.Optional;

/// One usage of a {@link NodeType} inside a workflow.
///
/// @param id unique instance id within the workflow, not null
/// @param nodeType reference to a node type by `name` or `functionName`, not null
/// @param config per-instance overrides, may be null
/// @param parent enclosing scope, null for top-level instances
/// @param sourceLocation declaration position, may be null
public record NodeInstance(
        String id,
        String nodeType,
        InstanceConfig config,
        NodeParent parent,
        SourceLocation sourceLocation) {

    public NodeInstance {
        Objects.requireNonNull(id, "Instance id required");
        Objects.requireNonNull(nodeType, "Instance nodeType required");
    }

    /// Creates a top-level instance without configuration.
    ///
    /// @param id instance id, not null
    /// @param nodeType node type reference, not null
    /// @return new instance, never null
    public static NodeInstance of(String id, String nodeType) {
        return new NodeInstance(id, nodeType, null, null, null);
    }

    /// Returns a copy placed inside the given container scope.
    ///
    /// @param parentId container instance id, not null
    /// @param scope scope name on the container, not null
    /// @return new instance, never null
    public NodeInstance inScope(String parentId, String scope) {
        return new NodeInstance(id, nodeType, config, new NodeParent(parentId, scope), sourceLocation);
    }

    /// Returns a copy with the given configuration.
    ///
    /// @param config instance configuration, may be null
    /// @return new instance, never null
    public NodeInstance withConfig(InstanceConfig config) {
        return new NodeInstance(id, nodeType, config, parent, sourceLocation);
    }

    /// Finds the instance-level expression override for an input port.
    ///
    /// @param portName input port name, not null
    /// @return expression text, or empty if the port is not overridden
    public Optional<String> inputExpression(String portName) {
        if (config == null) {
            return Optional.empty();
        }
        return config.inputExpression(portName).map(PortConfig::expression);
    }

    /// @return `true` if the instance sits inside a container scope
    public boolean hasParent() {
        return parent != null;
    }
}

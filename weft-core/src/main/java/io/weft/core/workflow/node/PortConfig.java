package io.weft.core.workflow.node;

import io.weft.core.workflow.port.PortDirection;
import java.util.Objects;

/// Per-instance override for one port.
///
/// @param portName name of the overridden port, not null
/// @param direction side of the port, null means "input unless stated otherwise"
/// @param order explicit display order, may be null
/// @param expression value expression replacing any connection, may be null
public record PortConfig(String portName, PortDirection direction, Integer order, String expression) {

    public PortConfig {
        Objects.requireNonNull(portName, "Port name required");
    }

    /// Creates an input expression override.
    ///
    /// @param portName input port name, not null
    /// @param expression value expression, not null
    /// @return new port config, never null
    public static PortConfig expression(String portName, String expression) {
        return new PortConfig(portName, PortDirection.INPUT, null, expression);
    }

    /// @return `true` if this override applies to an input port
    public boolean appliesToInput() {
        return direction == null || direction == PortDirection.INPUT;
    }

    public boolean hasExpression() {
        return expression != null;
    }
}

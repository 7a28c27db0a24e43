package io.weft.core.workflow.node;

import java.util.List;
import java.util.Optional;

/// Per-instance configuration attached by the front-end.
///
/// @param portConfigs per-port overrides, never null after construction
/// @param color visual color override, may be null
public record InstanceConfig(List<PortConfig> portConfigs, String color) {

    public InstanceConfig {
        portConfigs = portConfigs != null ? List.copyOf(portConfigs) : List.of();
    }

    /// Finds the expression override for an input port.
    ///
    /// @param portName input port name, not null
    /// @return the override, or empty if the instance sets no expression for the port
    public Optional<PortConfig> inputExpression(String portName) {
        return portConfigs.stream()
                .filter(pc -> pc.portName().equals(portName))
                .filter(PortConfig::appliesToInput)
                .filter(PortConfig::hasExpression)
                .findFirst();
    }
}

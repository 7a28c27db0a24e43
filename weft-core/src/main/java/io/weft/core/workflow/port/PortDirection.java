package io.weft.core.workflow.port;

/// Side of a node a port belongs to.
public enum PortDirection {
    INPUT,
    OUTPUT
}

package io.weft.core.workflow.connection;

import io.weft.core.workflow.SourceLocation;
import java.util.Objects;

/// Directed edge from an output port to an input port.
///
/// Connections carry both data and control flow: a connection between STEP ports
/// is a control edge, any other connection moves a value.
///
/// @param from source output port, not null
/// @param to target input port, not null
/// @param coerce explicit value conversion, may be null
/// @param sourceLocation declaration position, may be null
public record Connection(
        PortReference from, PortReference to, CoerceType coerce, SourceLocation sourceLocation) {

    public Connection {
        Objects.requireNonNull(from, "Connection source required");
        Objects.requireNonNull(to, "Connection target required");
    }

    /// Creates an unscoped connection without coercion.
    ///
    /// @param fromNode source node id, not null
    /// @param fromPort source output port, not null
    /// @param toNode target node id, not null
    /// @param toPort target input port, not null
    /// @return new connection, never null
    public static Connection of(String fromNode, String fromPort, String toNode, String toPort) {
        return new Connection(
                PortReference.of(fromNode, fromPort), PortReference.of(toNode, toPort), null, null);
    }

    /// Returns a copy with the given coercion.
    ///
    /// @param coerce coercion to apply, may be null
    /// @return new connection, never null
    public Connection coercedTo(CoerceType coerce) {
        return new Connection(from, to, coerce, sourceLocation);
    }

    /// @return `true` if either end carries a scope qualifier
    public boolean isScoped() {
        return from.isScoped() || to.isScoped();
    }

    /// @return `true` if the connection starts and ends on the same node
    public boolean isSelfLoop() {
        return from.node().equals(to.node());
    }

    /// Identity key used for duplicate detection, ignoring scope qualifiers.
    ///
    /// @return `from.node.from.port->to.node.to.port`, never null
    public String key() {
        return from.node() + "." + from.port() + "->" + to.node() + "." + to.port();
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}

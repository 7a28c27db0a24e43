package io.weft.core.workflow.connection;

import java.util.Objects;

/// One end of a connection.
///
/// @param node instance id, or `Start`/`Exit`, not null
/// @param port port name on that node, not null
/// @param scope scope qualifier for connections crossing into a container's scope,
///     may be null
public record PortReference(String node, String port, String scope) {

    public PortReference {
        Objects.requireNonNull(node, "Port reference node required");
        Objects.requireNonNull(port, "Port reference port required");
    }

    /// Creates an unscoped reference.
    ///
    /// @param node node id, not null
    /// @param port port name, not null
    /// @return new reference, never null
    public static PortReference of(String node, String port) {
        return new PortReference(node, port, null);
    }

    public boolean isScoped() {
        return scope != null;
    }

    /// Renders the reference as `node.port` or `node.port:scope`.
    @Override
    public String toString() {
        return scope == null ? node + "." + port : node + "." + port + ":" + scope;
    }
}

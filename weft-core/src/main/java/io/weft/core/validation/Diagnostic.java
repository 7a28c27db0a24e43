package io.weft.core.validation;

import io.weft.core.workflow.SourceLocation;
import io.weft.core.workflow.connection.Connection;
import java.util.Objects;

/// A single validation finding.
///
/// Diagnostics are values: the `with*` methods return modified copies.
///
/// @param severity error or warning, not null
/// @param code stable diagnostic code, not null
/// @param message human-readable explanation, not null
/// @param node instance or node type the finding refers to, may be null
/// @param connection connection the finding refers to, may be null
/// @param location source position, may be null
/// @param docUrl documentation link, may be null
public record Diagnostic(
        Severity severity,
        DiagnosticCode code,
        String message,
        String node,
        Connection connection,
        SourceLocation location,
        String docUrl) {

    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }

    public static Diagnostic error(DiagnosticCode code, String message) {
        return new Diagnostic(Severity.ERROR, code, message, null, null, null, null);
    }

    public static Diagnostic warning(DiagnosticCode code, String message) {
        return new Diagnostic(Severity.WARNING, code, message, null, null, null, null);
    }

    public Diagnostic withNode(String node) {
        return new Diagnostic(severity, code, message, node, connection, location, docUrl);
    }

    /// Attaches a connection, adopting its source location unless one is set.
    ///
    /// @param connection connection, may be null
    /// @return modified copy, never null
    public Diagnostic withConnection(Connection connection) {
        SourceLocation loc =
                location == null && connection != null ? connection.sourceLocation() : location;
        return new Diagnostic(severity, code, message, node, connection, loc, docUrl);
    }

    public Diagnostic withLocation(SourceLocation location) {
        return new Diagnostic(severity, code, message, node, connection, location, docUrl);
    }

    public Diagnostic withSeverity(Severity severity) {
        return new Diagnostic(severity, code, message, node, connection, location, docUrl);
    }

    public Diagnostic withCode(DiagnosticCode code) {
        return new Diagnostic(severity, code, message, node, connection, location, docUrl);
    }

    public Diagnostic withDocUrl(String docUrl) {
        return new Diagnostic(severity, code, message, node, connection, location, docUrl);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /// Returns whether the finding's node or either connection endpoint is the instance.
    ///
    /// @param instanceId instance id, not null
    /// @return `true` if the diagnostic references the instance
    public boolean references(String instanceId) {
        if (instanceId.equals(node)) {
            return true;
        }
        return connection != null
                && (instanceId.equals(connection.from().node())
                        || instanceId.equals(connection.to().node()));
    }

    @Override
    public String toString() {
        return severity + " " + code + ": " + message;
    }
}

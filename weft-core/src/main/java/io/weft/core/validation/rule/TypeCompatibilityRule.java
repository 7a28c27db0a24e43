package io.weft.core.validation.rule;

import io.weft.core.validation.Diagnostic;
import io.weft.core.validation.DiagnosticCode;
import io.weft.core.validation.Diagnostics;
import io.weft.core.validation.Severity;
import io.weft.core.validation.ValidationContext;
import io.weft.core.validation.ValidationRule;
import io.weft.core.validation.types.Coercion;
import io.weft.core.validation.types.CoercionKind;
import io.weft.core.validation.types.StructuralTypes;
import io.weft.core.validation.types.TypeCompatibility;
import io.weft.core.workflow.ReservedNames;
import io.weft.core.workflow.WorkflowIndex;
import io.weft.core.workflow.connection.CoerceType;
import io.weft.core.workflow.connection.Connection;
import io.weft.core.workflow.node.NodeType;
import io.weft.core.workflow.port.DataType;
import io.weft.core.workflow.port.PortDefinition;
import java.util.Optional;
import java.util.logging.Logger;

/// Classifies the value flowing over each connection between two instances.
///
/// ### Rule order
/// 1. STEP on exactly one side is fatal; STEP on both sides is plain control flow
/// 2. Coercing a FUNCTION value is fatal
/// 3. Equal data types pass; a coercion is redundant; OBJECT ports compare their
///    structural types
/// 4. `ANY` on either side passes
/// 5. An explicit coercion must produce the target type
/// 6. Safe, lossy and unusual conversions follow {@link TypeCompatibility}
/// 7. Everything else is a plain mismatch
///
/// Findings of steps 5 to 7 are warnings, or `TYPE_INCOMPATIBLE` errors when
/// strict typing applies. Connections from `Start` or into `Exit` are not checked.
public final class TypeCompatibilityRule implements ValidationRule {

    private static final Logger logger = Logger.getLogger(TypeCompatibilityRule.class.getName());

    @Override
    public Diagnostics check(ValidationContext context) {
        Diagnostics diagnostics = Diagnostics.empty();
        boolean strict = context.strictTypes();
        WorkflowIndex index = context.index();

        for (Connection conn : context.workflow().getConnections()) {
            if (ReservedNames.isStart(conn.from().node()) || ReservedNames.isExit(conn.to().node())) {
                continue;
            }
            Optional<PortDefinition> source =
                    index.typeOf(conn.from().node()).map(t -> outputOf(t, conn.from().port()));
            Optional<PortDefinition> target =
                    index.typeOf(conn.to().node()).map(t -> inputOf(t, conn.to().port()));
            if (source.isEmpty() || target.isEmpty()) {
                continue;
            }
            checkConnection(conn, source.get(), target.get(), strict, diagnostics);
        }
        logger.fine(() -> "Type compatibility produced " + diagnostics.size() + " diagnostic(s)");
        return diagnostics;
    }

    private static PortDefinition outputOf(NodeType type, String port) {
        return type.getOutputs().get(port);
    }

    private static PortDefinition inputOf(NodeType type, String port) {
        return type.getInputs().get(port);
    }

    private static void checkConnection(
            Connection conn,
            PortDefinition source,
            PortDefinition target,
            boolean strict,
            Diagnostics diagnostics) {
        String fromNode = conn.from().node();
        String fromPort = conn.from().port();
        String toNode = conn.to().node();
        String toPort = conn.to().port();
        DataType sourceType = source.getDataType();
        DataType targetType = target.getDataType();
        String sourceFmt = StructuralTypes.format(sourceType, source.getTsType());
        String targetFmt = StructuralTypes.format(targetType, target.getTsType());
        CoerceType coerce = conn.coerce();

        if (sourceType == DataType.STEP && targetType != DataType.STEP) {
            diagnostics.add(
                    Diagnostic.error(
                                    DiagnosticCode.STEP_PORT_TYPE_MISMATCH,
                                    "STEP port \"" + fromPort + "\" on node \"" + fromNode
                                            + "\" cannot connect to non-STEP port \"" + toPort
                                            + "\" (" + targetFmt + ") on node \"" + toNode + "\"")
                            .withConnection(conn));
            return;
        }
        if (targetType == DataType.STEP && sourceType != DataType.STEP) {
            diagnostics.add(
                    Diagnostic.error(
                                    DiagnosticCode.STEP_PORT_TYPE_MISMATCH,
                                    "Non-STEP port \"" + fromPort + "\" (" + sourceFmt
                                            + ") on node \"" + fromNode
                                            + "\" cannot connect to STEP port \"" + toPort
                                            + "\" on node \"" + toNode + "\"")
                            .withConnection(conn));
            return;
        }
        if (sourceType == DataType.STEP) {
            return;
        }

        String route = "\"" + fromNode + "." + fromPort + "\" → \"" + toNode + "." + toPort + "\"";
        if (coerce != null && (sourceType == DataType.FUNCTION || targetType == DataType.FUNCTION)) {
            diagnostics.add(
                    Diagnostic.error(
                                    DiagnosticCode.COERCE_ON_FUNCTION_PORT,
                                    "Coercion `as " + coerce.keyword()
                                            + "` cannot be used on FUNCTION ports in connection "
                                            + route
                                            + ". FUNCTION values cannot be meaningfully coerced.")
                            .withConnection(conn));
            return;
        }

        if (sourceType == targetType) {
            if (coerce != null) {
                diagnostics.add(
                        Diagnostic.warning(
                                        DiagnosticCode.REDUNDANT_COERCE,
                                        "Coercion `as " + coerce.keyword() + "` on connection "
                                                + route
                                                + " is redundant: source and target are both "
                                                + sourceType + ".")
                                .withConnection(conn));
                return;
            }
            checkStructure(conn, source, target, diagnostics);
            return;
        }

        if (sourceType == DataType.ANY || targetType == DataType.ANY) {
            return;
        }

        if (coerce != null) {
            if (coerce.produces() != targetType) {
                diagnostics.add(
                        typeIssue(
                                DiagnosticCode.COERCE_TYPE_MISMATCH,
                                "Coercion `as " + coerce.keyword() + "` produces "
                                        + coerce.produces() + " but target port \"" + toPort
                                        + "\" on \"" + toNode + "\" expects " + targetType
                                        + ". Use `as " + CoerceType.suggestFor(targetType)
                                        + "` instead.",
                                conn,
                                strict));
            }
            return;
        }

        String path = fromNode + "." + fromPort + " → " + toNode + "." + toPort;
        Optional<Coercion> coercion = TypeCompatibility.lookup(sourceType, targetType);
        if (coercion.isPresent()) {
            Coercion c = coercion.get();
            if (c.kind() == CoercionKind.LOSSY) {
                diagnostics.add(
                        typeIssue(
                                DiagnosticCode.LOSSY_TYPE_COERCION,
                                "Lossy type coercion from " + sourceFmt + " to " + targetFmt
                                        + " in connection " + path + ". " + c.reason()
                                        + ". Set strictTypes on the workflow to enforce type"
                                        + " safety.",
                                conn,
                                strict));
            } else if (c.kind() == CoercionKind.UNUSUAL) {
                diagnostics.add(
                        typeIssue(
                                DiagnosticCode.UNUSUAL_TYPE_COERCION,
                                "Unusual type coercion from " + sourceFmt + " to " + targetFmt
                                        + " in connection " + path + ". " + c.reason() + ".",
                                conn,
                                strict));
            }
            return;
        }

        diagnostics.add(
                typeIssue(
                        DiagnosticCode.TYPE_MISMATCH,
                        "Type mismatch in connection " + fromNode + "." + fromPort + " ("
                                + sourceFmt + ") → " + toNode + "." + toPort + " (" + targetFmt
                                + "). Runtime coercion will be attempted.",
                        conn,
                        strict));
    }

    private static void checkStructure(
            Connection conn, PortDefinition source, PortDefinition target, Diagnostics diagnostics) {
        if (source.getDataType() != DataType.OBJECT
                || source.getTsType() == null
                || target.getTsType() == null) {
            return;
        }
        String sourceTs = source.getTsType();
        String targetTs = target.getTsType();
        if (StructuralTypes.normalize(sourceTs).equals(StructuralTypes.normalize(targetTs))
                || StructuralTypes.isCompatible(sourceTs, targetTs)) {
            return;
        }
        diagnostics.add(
                Diagnostic.warning(
                                DiagnosticCode.OBJECT_TYPE_MISMATCH,
                                "Structural type mismatch: " + conn.from().node() + "."
                                        + conn.from().port() + " outputs \"" + sourceTs + "\" but "
                                        + conn.to().node() + "." + conn.to().port() + " expects \""
                                        + targetTs
                                        + "\". Verify the object shapes are compatible.")
                        .withConnection(conn));
    }

    // Strict typing keeps the risk-specific message and reports it under one code.
    private static Diagnostic typeIssue(
            DiagnosticCode code, String message, Connection conn, boolean strict) {
        Diagnostic issue = Diagnostic.warning(code, message).withConnection(conn);
        return strict
                ? issue.withSeverity(Severity.ERROR).withCode(DiagnosticCode.TYPE_INCOMPATIBLE)
                : issue;
    }
}

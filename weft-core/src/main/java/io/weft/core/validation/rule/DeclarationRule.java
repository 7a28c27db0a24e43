package io.weft.core.validation.rule;

import io.weft.core.util.Identifiers;
import io.weft.core.util.StringDistance;
import io.weft.core.validation.Diagnostic;
import io.weft.core.validation.DiagnosticCode;
import io.weft.core.validation.Diagnostics;
import io.weft.core.validation.ValidationContext;
import io.weft.core.validation.ValidationRule;
import io.weft.core.workflow.node.NodeInstance;
import io.weft.core.workflow.node.NodeType;
import io.weft.core.workflow.node.PortConfig;
import io.weft.core.workflow.port.PortDefinition;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Checks front-end declarations that the generator does not consume directly:
/// visual colors, per-instance port configuration and scope names.
public final class DeclarationRule implements ValidationRule {

    static final List<String> VALID_COLORS =
            List.of("blue", "purple", "cyan", "orange", "pink", "green", "red", "yellow", "teal");

    @Override
    public Diagnostics check(ValidationContext context) {
        Diagnostics diagnostics = Diagnostics.empty();

        for (NodeType type : context.workflow().getNodeTypes()) {
            String color = type.getColor();
            if (color != null && !VALID_COLORS.contains(color)) {
                diagnostics.add(
                        Diagnostic.warning(
                                        DiagnosticCode.INVALID_COLOR,
                                        "Node type \"" + type.getFunctionName() + "\""
                                                + invalidColor(color))
                                .withNode(type.getFunctionName())
                                .withLocation(type.getSourceLocation()));
            }
        }
        for (NodeInstance instance : context.workflow().getInstances()) {
            String color = instance.config() != null ? instance.config().color() : null;
            if (color != null && !VALID_COLORS.contains(color)) {
                diagnostics.add(
                        Diagnostic.warning(
                                        DiagnosticCode.INVALID_COLOR,
                                        "Instance \"" + instance.id() + "\"" + invalidColor(color))
                                .withNode(instance.id())
                                .withLocation(instance.sourceLocation()));
            }
        }

        for (NodeInstance instance : context.workflow().getInstances()) {
            if (instance.config() == null || instance.config().portConfigs().isEmpty()) {
                continue;
            }
            NodeType type = context.index().typeOf(instance.id()).orElse(null);
            if (type == null) {
                continue;
            }
            Set<String> ports = new LinkedHashSet<>(type.getInputs().keySet());
            ports.addAll(type.getOutputs().keySet());
            for (PortConfig pc : instance.config().portConfigs()) {
                if (!ports.contains(pc.portName())) {
                    diagnostics.add(
                            Diagnostic.warning(
                                            DiagnosticCode.INVALID_PORT_CONFIG_REF,
                                            "Instance \"" + instance.id() + "\" references port \""
                                                    + pc.portName()
                                                    + "\" in portConfig, but this port does not"
                                                    + " exist on node type \""
                                                    + instance.nodeType() + "\"."
                                                    + StringDistance.didYouMean(pc.portName(), ports))
                                    .withNode(instance.id())
                                    .withLocation(instance.sourceLocation()));
                }
            }
        }

        for (NodeType type : context.workflow().getNodeTypes()) {
            checkScopeNames(type, type.getInputs(), diagnostics);
            checkScopeNames(type, type.getOutputs(), diagnostics);
        }
        return diagnostics;
    }

    private static String invalidColor(String color) {
        return " has invalid color \"" + color + "\"."
                + StringDistance.didYouMean(color, VALID_COLORS)
                + " Valid colors: " + String.join(", ", VALID_COLORS) + ".";
    }

    private static void checkScopeNames(
            NodeType type, Map<String, PortDefinition> ports, Diagnostics diagnostics) {
        for (Map.Entry<String, PortDefinition> entry : ports.entrySet()) {
            String scope = entry.getValue().getScope();
            if (scope != null && !Identifiers.isValidScopeName(scope)) {
                diagnostics.add(
                        Diagnostic.error(
                                        DiagnosticCode.INVALID_SCOPE_NAME,
                                        "Port \"" + entry.getKey() + "\" has invalid scope name \""
                                                + scope + "\". Scope names must be valid identifiers"
                                                + " (letters, numbers, underscore, dollar sign;"
                                                + " cannot start with number).")
                                .withNode(type.getFunctionName())
                                .withLocation(type.getSourceLocation()));
            }
        }
    }
}

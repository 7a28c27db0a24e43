package io.weft.core.generator;

import static io.weft.core.util.Identifiers.toValidIdentifier;

import io.weft.core.util.JsonUtil;
import io.weft.core.workflow.ReservedNames;
import io.weft.core.workflow.WorkflowIndex;
import io.weft.core.workflow.connection.CoerceType;
import io.weft.core.workflow.connection.Connection;
import io.weft.core.workflow.node.NodeType;
import io.weft.core.workflow.port.MergeStrategy;
import io.weft.core.workflow.port.PortDefinition;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Builds call arguments for node functions as script expressions.
///
/// Values come from local `<id>_result` variables of earlier steps or from
/// `event.data` for workflow inputs.
///
/// ### Resolution order for one data input
/// 1. Instance-level expression override
/// 2. Inbound unscoped connections, fanned in by the port's merge strategy
/// 3. Type-level expression
/// 4. JSON default value
/// 5. `undefined` for optional ports
/// 6. `undefined` with a comment naming the missing source
final class ArgumentResolver {

    static final String LOOP_ITEM = "__item__";

    private final WorkflowIndex index;

    ArgumentResolver(WorkflowIndex index) {
        this.index = index;
    }

    /// Builds the argument list for a top-level call.
    ///
    /// Non-expression nodes receive the execute flag first.
    List<String> arguments(String instanceId, NodeType type) {
        List<String> args = new ArrayList<>();
        if (!type.isExpression()) {
            args.add(executeFlag(instanceId));
        }
        for (Map.Entry<String, PortDefinition> input : dataInputs(type)) {
            args.add(resolve(input.getKey(), instanceId, input.getValue()));
        }
        return args;
    }

    /// Builds the argument list for a child called inside a scope loop.
    ///
    /// Inputs fed by the parent's item port receive the current loop item.
    List<String> loopArguments(String childId, NodeType type, String parentId, String itemPort) {
        List<String> args = new ArrayList<>();
        if (!type.isExpression()) {
            args.add("true");
        }
        for (Map.Entry<String, PortDefinition> input : dataInputs(type)) {
            String portName = input.getKey();
            boolean fromItem =
                    index.incoming(childId).stream()
                            .anyMatch(
                                    conn ->
                                            conn.to().port().equals(portName)
                                                    && conn.from().node().equals(parentId)
                                                    && conn.from().port().equals(itemPort));
            args.add(fromItem ? LOOP_ITEM : resolve(portName, childId, input.getValue()));
        }
        return args;
    }

    private String executeFlag(String instanceId) {
        List<Connection> executeConns = index.unscopedInto(instanceId, ReservedNames.EXECUTE);
        if (executeConns.isEmpty()) {
            return "true";
        }
        Connection conn = executeConns.get(0);
        if (ReservedNames.isStart(conn.from().node())) {
            return "true";
        }
        return sourceRef(conn, false);
    }

    private static List<Map.Entry<String, PortDefinition>> dataInputs(NodeType type) {
        List<Map.Entry<String, PortDefinition>> inputs = new ArrayList<>();
        for (Map.Entry<String, PortDefinition> input : type.getInputs().entrySet()) {
            if (!ReservedNames.EXECUTE.equals(input.getKey()) && !input.getValue().isScoped()) {
                inputs.add(input);
            }
        }
        return inputs;
    }

    /// Resolves the value expression for one input port.
    String resolve(String portName, String instanceId, PortDefinition port) {
        Optional<String> override =
                index.findInstance(instanceId).flatMap(i -> i.inputExpression(portName));
        if (override.isPresent()) {
            return expressionValue(override.get());
        }

        List<Connection> connections = index.unscopedInto(instanceId, portName);
        if (connections.size() == 1) {
            return coerce(sourceRef(connections.get(0), false), connections.get(0).coerce());
        }
        if (connections.size() > 1) {
            List<String> sources = new ArrayList<>();
            for (Connection conn : connections) {
                sources.add(coerce(sourceRef(conn, true), conn.coerce()));
            }
            MergeStrategy strategy = port != null ? port.getMergeStrategy() : null;
            return strategy == null ? String.join(" ?? ", sources) : merge(sources, strategy);
        }

        if (port != null && port.getExpression() != null) {
            return expressionValue(port.getExpression());
        }
        if (port != null && port.getDefaultValue() != null) {
            return JsonUtil.toJson(port.getDefaultValue());
        }
        if (port != null && port.isOptional()) {
            return "undefined";
        }
        return "undefined /* no source for " + toValidIdentifier(instanceId) + "." + portName + " */";
    }

    /// Renders a connection source. Fan-in sources use optional chaining because
    /// the writer may not have run.
    ///
    /// `step.sleep` leaves no result variable, so a delay's outcome ports render
    /// as literals: `onSuccess` is `true`, `onFailure` is `false`.
    String sourceRef(Connection conn, boolean optionalChain) {
        String node = conn.from().node();
        if (ReservedNames.isStart(node)) {
            return "event.data." + conn.from().port();
        }
        if (index.typeOf(node).map(BuiltInNode::isDelay).orElse(false)) {
            String port = conn.from().port();
            if (ReservedNames.ON_SUCCESS.equals(port)) {
                return "true";
            }
            return ReservedNames.ON_FAILURE.equals(port) ? "false" : "undefined";
        }
        return toValidIdentifier(node) + (optionalChain ? "_result?." : "_result.") + conn.from().port();
    }

    /// Function-valued expressions are called; anything else is used as is.
    static String expressionValue(String expression) {
        if (expression.contains("=>") || expression.trim().startsWith("function")) {
            return "await (" + expression + ")()";
        }
        return expression;
    }

    static String coerce(String value, CoerceType coerce) {
        if (coerce == null) {
            return value;
        }
        return switch (coerce) {
            case STRING -> "String(" + value + ")";
            case NUMBER -> "Number(" + value + ")";
            case BOOLEAN -> "Boolean(" + value + ")";
            case JSON -> "JSON.stringify(" + value + ")";
            case OBJECT -> "JSON.parse(" + value + ")";
        };
    }

    static String merge(List<String> sources, MergeStrategy strategy) {
        String list = String.join(", ", sources);
        return switch (strategy) {
            case FIRST -> "[" + list + "].find(v => v !== undefined)";
            case LAST -> "[" + list + "].filter(v => v !== undefined).pop()";
            case COLLECT -> "[" + list + "]";
            case MERGE -> "Object.assign({}, " + list + ")";
            case CONCAT -> "[" + list + "].flat()";
        };
    }
}

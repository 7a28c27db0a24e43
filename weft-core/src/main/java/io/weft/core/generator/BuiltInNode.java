package io.weft.core.generator;

import io.weft.core.workflow.ReservedNames;
import io.weft.core.workflow.node.NodeType;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/// Control primitives that lower to dedicated runtime calls instead of `step.run`.
///
/// ### Resolution
/// A node type is a built-in when either
/// 1. its import source starts with {@value #IMPORT_PREFIX} and its function name
///    names a built-in, or
/// 2. its function name names a built-in and its input ports match that
///    built-in's signature exactly (for same-file definitions and fixtures).
public enum BuiltInNode {
    /// `step.sleep`. Inputs: only `duration`.
    DELAY("delay") {
        @Override
        boolean matchesSignature(Set<String> inputs) {
            return inputs.size() == 1 && inputs.contains("duration");
        }
    },
    /// `step.waitForEvent`. Inputs include `eventName`.
    WAIT_FOR_EVENT("waitForEvent") {
        @Override
        boolean matchesSignature(Set<String> inputs) {
            return inputs.contains("eventName");
        }
    },
    /// `step.waitForEvent` on `agent/<agentId>`. Inputs include `agentId` and `context`.
    WAIT_FOR_AGENT("waitForAgent") {
        @Override
        boolean matchesSignature(Set<String> inputs) {
            return inputs.contains("agentId") && inputs.contains("context");
        }
    },
    /// `step.invoke`. Inputs include `functionId` and `payload`.
    INVOKE_WORKFLOW("invokeWorkflow") {
        @Override
        boolean matchesSignature(Set<String> inputs) {
            return inputs.contains("functionId") && inputs.contains("payload");
        }
    };

    public static final String IMPORT_PREFIX = "@weft/built-in-nodes";

    private final String functionName;

    BuiltInNode(String functionName) {
        this.functionName = functionName;
    }

    public String functionName() {
        return functionName;
    }

    abstract boolean matchesSignature(Set<String> inputs);

    /// Resolves the built-in a node type stands for.
    ///
    /// @param type node type, may be null
    /// @return the built-in, or empty for ordinary node types
    public static Optional<BuiltInNode> resolve(NodeType type) {
        if (type == null) {
            return Optional.empty();
        }
        Optional<BuiltInNode> named = byFunctionName(type.getFunctionName());
        if (named.isEmpty()) {
            return Optional.empty();
        }
        String importSource = type.getImportSource();
        if (importSource != null && importSource.startsWith(IMPORT_PREFIX)) {
            return named;
        }
        Set<String> inputs = new LinkedHashSet<>(type.getInputs().keySet());
        inputs.remove(ReservedNames.EXECUTE);
        return named.filter(builtIn -> builtIn.matchesSignature(inputs));
    }

    /// @return `true` if the node type resolves to {@link #DELAY}
    public static boolean isDelay(NodeType type) {
        return resolve(type).filter(b -> b == DELAY).isPresent();
    }

    private static Optional<BuiltInNode> byFunctionName(String functionName) {
        for (BuiltInNode builtIn : values()) {
            if (builtIn.functionName.equals(functionName)) {
                return Optional.of(builtIn);
            }
        }
        return Optional.empty();
    }
}

package io.weft.core.workflow.node;

import io.weft.core.workflow.ReservedNames;
import io.weft.core.workflow.SourceLocation;
import io.weft.core.workflow.port.DataType;
import io.weft.core.workflow.port.PortDefinition;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Immutable node type: the callable unit that instances refer to.
///
/// A node type is identified by two keys. `functionName` is the identifier the
/// generated code calls and imports; `name` may differ for imported nodes
/// (e.g. `npm/pkg/fn`). Instances may reference either key.
///
/// ### Mandatory control ports
/// Every node type exposes the STEP input `execute` and the STEP outputs
/// `onSuccess` and `onFailure`. The builder adds any of them the front-end omitted,
/// ahead of the declared ports, and leaves declared ones untouched.
///
/// ### Port order
/// `inputs` and `outputs` keep insertion order. The generator passes data inputs
/// to the function in this order.
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see NodeInstance for usages of a node type
/// @see PortDefinition for port metadata
public final class NodeType {

    private final String name;
    private final String functionName;
    private final Map<String, PortDefinition> inputs;
    private final Map<String, PortDefinition> outputs;
    private final boolean hasSuccessPort;
    private final boolean hasFailurePort;
    private final ExecuteWhen executeWhen;
    private final boolean expression;
    private final boolean async;
    private final String importSource;
    private final NodeVariant variant;
    private final boolean inferred;
    private final String color;
    private final SourceLocation sourceLocation;

    private NodeType(Builder builder) {
        this.functionName =
                Objects.requireNonNull(builder.functionName, "Node type functionName required");
        this.name = builder.name != null ? builder.name : builder.functionName;
        this.inputs = Collections.unmodifiableMap(withControlInputs(builder.inputs));
        this.outputs = Collections.unmodifiableMap(withControlOutputs(builder.outputs));
        this.hasSuccessPort = builder.hasSuccessPort;
        this.hasFailurePort = builder.hasFailurePort;
        this.executeWhen = builder.executeWhen;
        this.expression = builder.expression;
        this.async = builder.async;
        this.importSource = builder.importSource;
        this.variant = builder.variant;
        this.inferred = builder.inferred;
        this.color = builder.color;
        this.sourceLocation = builder.sourceLocation;
    }

    private static Map<String, PortDefinition> withControlInputs(
            Map<String, PortDefinition> declared) {
        Map<String, PortDefinition> ports = new LinkedHashMap<>();
        if (!declared.containsKey(ReservedNames.EXECUTE)) {
            ports.put(ReservedNames.EXECUTE, PortDefinition.step());
        }
        ports.putAll(declared);
        return ports;
    }

    private static Map<String, PortDefinition> withControlOutputs(
            Map<String, PortDefinition> declared) {
        Map<String, PortDefinition> ports = new LinkedHashMap<>();
        if (!declared.containsKey(ReservedNames.ON_SUCCESS)) {
            ports.put(ReservedNames.ON_SUCCESS, PortDefinition.step());
        }
        if (!declared.containsKey(ReservedNames.ON_FAILURE)) {
            ports.put(
                    ReservedNames.ON_FAILURE,
                    PortDefinition.builder()
                            .dataType(DataType.STEP)
                            .controlFlow(true)
                            .failure(true)
                            .build());
        }
        ports.putAll(declared);
        return ports;
    }

    /// Returns the registry name, which defaults to the function name.
    ///
    /// @return node type name, never null
    public String getName() {
        return name;
    }

    /// Returns the function identifier used in generated calls and imports.
    ///
    /// @return function name, never null
    public String getFunctionName() {
        return functionName;
    }

    /// @return unmodifiable ordered map of input ports, never null
    public Map<String, PortDefinition> getInputs() {
        return inputs;
    }

    /// @return unmodifiable ordered map of output ports, never null
    public Map<String, PortDefinition> getOutputs() {
        return outputs;
    }

    public boolean isHasSuccessPort() {
        return hasSuccessPort;
    }

    public boolean isHasFailurePort() {
        return hasFailurePort;
    }

    public ExecuteWhen getExecuteWhen() {
        return executeWhen;
    }

    /// Returns whether the node is pure and may be inlined without a durability step.
    public boolean isExpression() {
        return expression;
    }

    public boolean isAsync() {
        return async;
    }

    /// Returns the module the implementation is imported from.
    ///
    /// @return import source, or null for same-project functions
    public String getImportSource() {
        return importSource;
    }

    public NodeVariant getVariant() {
        return variant;
    }

    public boolean isInferred() {
        return inferred;
    }

    public String getColor() {
        return color;
    }

    public SourceLocation getSourceLocation() {
        return sourceLocation;
    }

    /// @return `true` if the variant is {@link NodeVariant#STUB}
    public boolean isStub() {
        return variant == NodeVariant.STUB;
    }

    /// Returns whether either key of this node type equals the reference.
    ///
    /// @param reference node type reference from an instance, may be null
    /// @return `true` if `name` or `functionName` matches
    public boolean matches(String reference) {
        return name.equals(reference) || functionName.equals(reference);
    }

    /// Collects every scope name tagged on an input or output port.
    ///
    /// @return ordered set of scope names, never null
    public Set<String> scopeNames() {
        Set<String> scopes = new LinkedHashSet<>();
        outputs.values().stream()
                .map(PortDefinition::getScope)
                .filter(Objects::nonNull)
                .forEach(scopes::add);
        inputs.values().stream()
                .map(PortDefinition::getScope)
                .filter(Objects::nonNull)
                .forEach(scopes::add);
        return scopes;
    }

    /// Creates a new node type builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing immutable NodeType instances.
    ///
    /// Required field: `functionName`. `name` defaults to it.
    public static final class Builder {
        private String name;
        private String functionName;
        private Map<String, PortDefinition> inputs = new LinkedHashMap<>();
        private Map<String, PortDefinition> outputs = new LinkedHashMap<>();
        private boolean hasSuccessPort = true;
        private boolean hasFailurePort = true;
        private ExecuteWhen executeWhen = ExecuteWhen.CONJUNCTION;
        private boolean expression;
        private boolean async;
        private String importSource;
        private NodeVariant variant = NodeVariant.FUNCTION;
        private boolean inferred;
        private String color;
        private SourceLocation sourceLocation;

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder functionName(String functionName) {
            this.functionName = functionName;
            return this;
        }

        /// Replaces all input ports, keeping the given iteration order.
        ///
        /// @param inputs ordered map of port name to definition, not null
        /// @return this builder for chaining
        public Builder inputs(Map<String, PortDefinition> inputs) {
            this.inputs = new LinkedHashMap<>(inputs);
            return this;
        }

        /// Replaces all output ports, keeping the given iteration order.
        ///
        /// @param outputs ordered map of port name to definition, not null
        /// @return this builder for chaining
        public Builder outputs(Map<String, PortDefinition> outputs) {
            this.outputs = new LinkedHashMap<>(outputs);
            return this;
        }

        /// Appends one input port.
        ///
        /// @param portName port name, not null
        /// @param port port definition, not null
        /// @return this builder for chaining
        public Builder input(String portName, PortDefinition port) {
            this.inputs.put(portName, port);
            return this;
        }

        /// Appends one output port.
        ///
        /// @param portName port name, not null
        /// @param port port definition, not null
        /// @return this builder for chaining
        public Builder output(String portName, PortDefinition port) {
            this.outputs.put(portName, port);
            return this;
        }

        public Builder hasSuccessPort(boolean hasSuccessPort) {
            this.hasSuccessPort = hasSuccessPort;
            return this;
        }

        public Builder hasFailurePort(boolean hasFailurePort) {
            this.hasFailurePort = hasFailurePort;
            return this;
        }

        public Builder executeWhen(ExecuteWhen executeWhen) {
            this.executeWhen = executeWhen != null ? executeWhen : ExecuteWhen.CONJUNCTION;
            return this;
        }

        public Builder expression(boolean expression) {
            this.expression = expression;
            return this;
        }

        public Builder async(boolean async) {
            this.async = async;
            return this;
        }

        public Builder importSource(String importSource) {
            this.importSource = importSource;
            return this;
        }

        public Builder variant(NodeVariant variant) {
            this.variant = variant != null ? variant : NodeVariant.FUNCTION;
            return this;
        }

        public Builder inferred(boolean inferred) {
            this.inferred = inferred;
            return this;
        }

        public Builder color(String color) {
            this.color = color;
            return this;
        }

        public Builder sourceLocation(SourceLocation sourceLocation) {
            this.sourceLocation = sourceLocation;
            return this;
        }

        /// Builds the immutable node type, adding missing control ports.
        ///
        /// @return new NodeType, never null
        /// @throws NullPointerException if functionName is null
        public NodeType build() {
            return new NodeType(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeType nodeType)) return false;
        return Objects.equals(name, nodeType.name)
                && Objects.equals(functionName, nodeType.functionName)
                && Objects.equals(inputs, nodeType.inputs)
                && Objects.equals(outputs, nodeType.outputs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, functionName);
    }

    @Override
    public String toString() {
        return "NodeType{name='" + name + "', functionName='" + functionName + "'}";
    }
}

package io.weft.core.workflow.port;

import java.util.Objects;

/// Immutable description of a single input or output port.
///
/// The port name is not part of the definition; it is the key under which the
/// definition is stored in its owning map (`NodeType.getInputs()`,
/// `Workflow.getStartPorts()`, ...).
///
/// ### Requiredness
/// An input port is required when it is not optional, has no default value and
/// no type-level expression. Instance-level expressions are resolved by the
/// validator, which sees the instance configuration.
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see DataType for the type tag
/// @see MergeStrategy for fan-in semantics
public final class PortDefinition {

    private final DataType dataType;
    private final String tsType;
    private final boolean optional;
    private final Object defaultValue;
    private final String expression;
    private final String label;
    private final boolean failure;
    private final boolean controlFlow;
    private final String scope;
    private final MergeStrategy mergeStrategy;
    private final Integer order;

    private PortDefinition(Builder builder) {
        this.dataType = Objects.requireNonNull(builder.dataType, "Port data type required");
        this.tsType = builder.tsType;
        this.optional = builder.optional;
        this.defaultValue = builder.defaultValue;
        this.expression = builder.expression;
        this.label = builder.label;
        this.failure = builder.failure;
        this.controlFlow = builder.controlFlow;
        this.scope = builder.scope;
        this.mergeStrategy = builder.mergeStrategy;
        this.order = builder.order;
    }

    /// Shorthand for a port with only a data type.
    ///
    /// @param dataType type tag, not null
    /// @return new port definition, never null
    public static PortDefinition of(DataType dataType) {
        return builder().dataType(dataType).build();
    }

    /// Shorthand for a control-flow STEP port.
    ///
    /// @return new STEP port flagged as control flow, never null
    public static PortDefinition step() {
        return builder().dataType(DataType.STEP).controlFlow(true).build();
    }

    public DataType getDataType() {
        return dataType;
    }

    /// Returns the structural type string supplied by the front-end.
    ///
    /// @return type text such as `{ id: string }`, or null if unknown
    public String getTsType() {
        return tsType;
    }

    public boolean isOptional() {
        return optional;
    }

    /// Returns the default value used when no connection feeds the port.
    ///
    /// @return JSON-compatible value, or null if the port has no default
    public Object getDefaultValue() {
        return defaultValue;
    }

    /// Returns the type-level expression that supplies this port's value.
    ///
    /// @return expression source text, or null
    public String getExpression() {
        return expression;
    }

    public String getLabel() {
        return label;
    }

    public boolean isFailure() {
        return failure;
    }

    public boolean isControlFlow() {
        return controlFlow;
    }

    /// Returns the scope this port belongs to.
    ///
    /// Scoped output ports feed a callback's children, scoped input ports receive
    /// values returned from inside the callback.
    ///
    /// @return scope name, or null for ordinary ports
    public String getScope() {
        return scope;
    }

    public MergeStrategy getMergeStrategy() {
        return mergeStrategy;
    }

    public Integer getOrder() {
        return order;
    }

    /// @return `true` if the port carries a scope tag
    public boolean isScoped() {
        return scope != null;
    }

    /// @return `true` if the port is a STEP port
    public boolean isStep() {
        return dataType == DataType.STEP;
    }

    /// Returns whether a value is available without any connection.
    ///
    /// @return `true` if optional, defaulted or expression-backed
    public boolean isSelfSatisfied() {
        return optional || defaultValue != null || (expression != null && !expression.isEmpty());
    }

    /// Creates a new port definition builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing immutable PortDefinition instances.
    ///
    /// Required field: `dataType`.
    public static final class Builder {
        private DataType dataType;
        private String tsType;
        private boolean optional;
        private Object defaultValue;
        private String expression;
        private String label;
        private boolean failure;
        private boolean controlFlow;
        private String scope;
        private MergeStrategy mergeStrategy;
        private Integer order;

        private Builder() {}

        public Builder dataType(DataType dataType) {
            this.dataType = dataType;
            return this;
        }

        public Builder tsType(String tsType) {
            this.tsType = tsType;
            return this;
        }

        public Builder optional(boolean optional) {
            this.optional = optional;
            return this;
        }

        /// Sets the default value used when nothing is connected.
        ///
        /// @param defaultValue JSON-compatible value (string, number, boolean, list, map),
        ///     may be null
        /// @return this builder for chaining
        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder expression(String expression) {
            this.expression = expression;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder failure(boolean failure) {
            this.failure = failure;
            return this;
        }

        public Builder controlFlow(boolean controlFlow) {
            this.controlFlow = controlFlow;
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder mergeStrategy(MergeStrategy mergeStrategy) {
            this.mergeStrategy = mergeStrategy;
            return this;
        }

        public Builder order(Integer order) {
            this.order = order;
            return this;
        }

        /// Builds the immutable port definition.
        ///
        /// @return new PortDefinition, never null
        /// @throws NullPointerException if dataType is null
        public PortDefinition build() {
            return new PortDefinition(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PortDefinition that)) return false;
        return optional == that.optional
                && failure == that.failure
                && controlFlow == that.controlFlow
                && dataType == that.dataType
                && Objects.equals(tsType, that.tsType)
                && Objects.equals(defaultValue, that.defaultValue)
                && Objects.equals(expression, that.expression)
                && Objects.equals(label, that.label)
                && Objects.equals(scope, that.scope)
                && mergeStrategy == that.mergeStrategy
                && Objects.equals(order, that.order);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataType, tsType, optional, defaultValue, expression, scope);
    }

    @Override
    public String toString() {
        return tsType != null ? tsType + " (" + dataType + ")" : dataType.name();
    }
}

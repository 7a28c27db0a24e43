package io.weft.core.workflow;

import io.weft.core.workflow.connection.Connection;
import io.weft.core.workflow.node.NodeInstance;
import io.weft.core.workflow.node.NodeType;
import io.weft.core.workflow.port.PortDefinition;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Immutable workflow graph: typed node instances wired by connections.
///
/// A workflow is a pure data snapshot produced by a front-end. It is not
/// validated on build: structural problems (missing names, dangling references,
/// cycles) are reported as diagnostics by the validator so that incomplete graphs
/// can still be inspected.
///
/// ### Structure
/// - **Node types**: callable units, resolved by `name` or `functionName`
/// - **Instances**: usages of node types, optionally nested in a container scope
/// - **Connections**: port-to-port edges, including edges from `Start` and to `Exit`
/// - **Start/Exit ports**: the workflow's own input and output interface
/// - **Scopes**: container-scope key to child ids, used for consistency checks
/// - **Options**: strict typing and runtime settings for the generated function
///
/// @implNote Immutable and thread-safe after construction. All collections are
/// unmodifiable and keep declaration order; declaration order drives every
/// deterministic tie-break downstream.
///
/// @see io.weft.core.validation.WorkflowValidator for validation
/// @see io.weft.core.analysis.ControlFlowAnalyzer for control-flow analysis
public final class Workflow {

    private final String name;
    private final String functionName;
    private final List<NodeType> nodeTypes;
    private final List<NodeInstance> instances;
    private final List<Connection> connections;
    private final Map<String, PortDefinition> startPorts;
    private final Map<String, PortDefinition> exitPorts;
    private final Map<String, List<String>> scopes;
    private final WorkflowOptions options;

    private Workflow(Builder builder) {
        this.name = builder.name;
        this.functionName = builder.functionName;
        this.nodeTypes = List.copyOf(builder.nodeTypes);
        this.instances = List.copyOf(builder.instances);
        this.connections = List.copyOf(builder.connections);
        this.startPorts = Collections.unmodifiableMap(new LinkedHashMap<>(builder.startPorts));
        this.exitPorts = Collections.unmodifiableMap(new LinkedHashMap<>(builder.exitPorts));
        Map<String, List<String>> scopeCopy = new LinkedHashMap<>();
        builder.scopes.forEach((key, children) -> scopeCopy.put(key, List.copyOf(children)));
        this.scopes = Collections.unmodifiableMap(scopeCopy);
        this.options = builder.options != null ? builder.options : WorkflowOptions.defaults();
    }

    /// Returns the workflow display name.
    ///
    /// @return name, or null if the front-end supplied none
    public String getName() {
        return name;
    }

    /// Returns the identifier the generated function is derived from.
    ///
    /// @return function name, or null if the front-end supplied none
    public String getFunctionName() {
        return functionName;
    }

    /// @return unmodifiable list of node types in declaration order, never null
    public List<NodeType> getNodeTypes() {
        return nodeTypes;
    }

    /// @return unmodifiable list of instances in declaration order, never null
    public List<NodeInstance> getInstances() {
        return instances;
    }

    /// @return unmodifiable list of connections in declaration order, never null
    public List<Connection> getConnections() {
        return connections;
    }

    /// Returns the workflow input ports exposed on the virtual `Start` node.
    ///
    /// `execute` is implicit and need not be declared.
    ///
    /// @return unmodifiable ordered map, never null
    public Map<String, PortDefinition> getStartPorts() {
        return startPorts;
    }

    /// Returns the workflow output ports accepted by the virtual `Exit` node.
    ///
    /// `onSuccess` and `onFailure` are implicit and need not be declared.
    ///
    /// @return unmodifiable ordered map, never null
    public Map<String, PortDefinition> getExitPorts() {
        return exitPorts;
    }

    /// @return unmodifiable map of container-scope key to child instance ids, never null
    public Map<String, List<String>> getScopes() {
        return scopes;
    }

    /// @return workflow options, never null
    public WorkflowOptions getOptions() {
        return options;
    }

    /// Creates a new workflow builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing immutable Workflow instances.
    ///
    /// No field is required. Missing names are reported by the validator.
    public static final class Builder {
        private String name;
        private String functionName;
        private List<NodeType> nodeTypes = new ArrayList<>();
        private List<NodeInstance> instances = new ArrayList<>();
        private List<Connection> connections = new ArrayList<>();
        private Map<String, PortDefinition> startPorts = new LinkedHashMap<>();
        private Map<String, PortDefinition> exitPorts = new LinkedHashMap<>();
        private Map<String, List<String>> scopes = new LinkedHashMap<>();
        private WorkflowOptions options;

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder functionName(String functionName) {
            this.functionName = functionName;
            return this;
        }

        /// Replaces all node types.
        ///
        /// @param nodeTypes node types in declaration order, not null
        /// @return this builder for chaining
        public Builder nodeTypes(List<NodeType> nodeTypes) {
            this.nodeTypes = new ArrayList<>(nodeTypes);
            return this;
        }

        /// Appends a node type.
        ///
        /// @param nodeType node type, not null
        /// @return this builder for chaining
        public Builder nodeType(NodeType nodeType) {
            this.nodeTypes.add(Objects.requireNonNull(nodeType, "nodeType"));
            return this;
        }

        /// Replaces all instances.
        ///
        /// @param instances instances in declaration order, not null
        /// @return this builder for chaining
        public Builder instances(List<NodeInstance> instances) {
            this.instances = new ArrayList<>(instances);
            return this;
        }

        /// Appends an instance.
        ///
        /// @param instance instance, not null
        /// @return this builder for chaining
        public Builder instance(NodeInstance instance) {
            this.instances.add(Objects.requireNonNull(instance, "instance"));
            return this;
        }

        /// Appends a top-level instance of the given node type.
        ///
        /// @param id instance id, not null
        /// @param nodeType node type reference, not null
        /// @return this builder for chaining
        public Builder instance(String id, String nodeType) {
            return instance(NodeInstance.of(id, nodeType));
        }

        /// Replaces all connections.
        ///
        /// @param connections connections in declaration order, not null
        /// @return this builder for chaining
        public Builder connections(List<Connection> connections) {
            this.connections = new ArrayList<>(connections);
            return this;
        }

        /// Appends a connection.
        ///
        /// @param connection connection, not null
        /// @return this builder for chaining
        public Builder connection(Connection connection) {
            this.connections.add(Objects.requireNonNull(connection, "connection"));
            return this;
        }

        /// Appends an unscoped connection.
        ///
        /// @return this builder for chaining
        public Builder connect(String fromNode, String fromPort, String toNode, String toPort) {
            return connection(Connection.of(fromNode, fromPort, toNode, toPort));
        }

        public Builder startPorts(Map<String, PortDefinition> startPorts) {
            this.startPorts = new LinkedHashMap<>(startPorts);
            return this;
        }

        public Builder startPort(String portName, PortDefinition port) {
            this.startPorts.put(portName, port);
            return this;
        }

        public Builder exitPorts(Map<String, PortDefinition> exitPorts) {
            this.exitPorts = new LinkedHashMap<>(exitPorts);
            return this;
        }

        public Builder exitPort(String portName, PortDefinition port) {
            this.exitPorts.put(portName, port);
            return this;
        }

        public Builder scopes(Map<String, List<String>> scopes) {
            this.scopes = new LinkedHashMap<>(scopes);
            return this;
        }

        /// Sets workflow options.
        ///
        /// @param options options, may be null for defaults
        /// @return this builder for chaining
        public Builder options(WorkflowOptions options) {
            this.options = options;
            return this;
        }

        /// Builds the immutable workflow.
        ///
        /// @return new Workflow instance, never null
        public Workflow build() {
            return new Workflow(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Workflow workflow)) return false;
        return Objects.equals(name, workflow.name)
                && Objects.equals(functionName, workflow.functionName)
                && nodeTypes.equals(workflow.nodeTypes)
                && instances.equals(workflow.instances)
                && connections.equals(workflow.connections);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, functionName, instances, connections);
    }

    @Override
    public String toString() {
        return "Workflow{name='"
                + name
                + "', instances="
                + instances.size()
                + ", connections="
                + connections.size()
                + "}";
    }
}

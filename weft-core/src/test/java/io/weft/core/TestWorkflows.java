package io.weft.core;

import io.weft.core.workflow.Workflow;
import io.weft.core.workflow.node.NodeType;
import io.weft.core.workflow.port.DataType;
import io.weft.core.workflow.port.PortDefinition;

/// Shared fixtures for building small workflows in tests.
public final class TestWorkflows {

    private TestWorkflows() {}

    /// Workflow builder with name and function name set.
    public static Workflow.Builder workflow(String functionName) {
        return Workflow.builder().name(functionName + " workflow").functionName(functionName);
    }

    /// Node type with only the implicit control ports.
    public static NodeType controlOnly(String functionName) {
        return NodeType.builder().functionName(functionName).build();
    }

    /// Node type with one data input `in` and one data output `out`.
    public static NodeType passThrough(String functionName, DataType in, DataType out) {
        return NodeType.builder()
                .functionName(functionName)
                .input("in", PortDefinition.of(in))
                .output("out", PortDefinition.of(out))
                .build();
    }

    /// Node type producing a single data output `out`.
    public static NodeType source(String functionName, DataType out) {
        return NodeType.builder()
                .functionName(functionName)
                .output("out", PortDefinition.of(out))
                .build();
    }

    /// Node type consuming a single required data input `in`.
    public static NodeType sink(String functionName, DataType in) {
        return NodeType.builder()
                .functionName(functionName)
                .input("in", PortDefinition.of(in))
                .build();
    }
}

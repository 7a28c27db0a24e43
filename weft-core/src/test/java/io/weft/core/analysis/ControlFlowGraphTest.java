package io.weft.core.analysis;

import static io.weft.core.TestWorkflows.controlOnly;
import static io.weft.core.TestWorkflows.passThrough;
import static io.weft.core.TestWorkflows.workflow;
import static org.assertj.core.api.Assertions.assertThat;

import io.weft.core.workflow.Workflow;
import io.weft.core.workflow.WorkflowIndex;
import io.weft.core.workflow.connection.Connection;
import io.weft.core.workflow.connection.PortReference;
import io.weft.core.workflow.node.NodeInstance;
import io.weft.core.workflow.node.NodeType;
import io.weft.core.workflow.port.DataType;
import io.weft.core.workflow.port.PortDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ControlFlowGraph")
class ControlFlowGraphTest {

    @Test
    @DisplayName("frames instances between Start and Exit in declaration order")
    void shouldFrameInstancesBetweenStartAndExit() {
        Workflow wf =
                workflow("frame")
                        .nodeType(controlOnly("step"))
                        .instance("b", "step")
                        .instance("a", "step")
                        .build();

        ControlFlowGraph graph = ControlFlowGraph.build(WorkflowIndex.of(wf));

        assertThat(graph.nodes()).containsExactly("Start", "b", "a", "Exit");
        assertThat(graph.successors("Start")).containsExactly("b", "a");
        assertThat(graph.successors("a")).containsExactly("Exit");
        assertThat(graph.inDegree("Exit")).isEqualTo(2);
        assertThat(graph.topologicalOrder()).containsExactly("b", "a");
    }

    @Test
    void shouldDeduplicateParallelEdgesAndIgnoreSelfLoops() {
        Workflow wf =
                workflow("edges")
                        .nodeType(passThrough("step", DataType.STRING, DataType.STRING))
                        .instance("a", "step")
                        .instance("b", "step")
                        .connect("Start", "execute", "a", "execute")
                        .connect("a", "onSuccess", "b", "execute")
                        .connect("a", "out", "b", "in")
                        .connect("a", "onFailure", "a", "execute")
                        .build();

        ControlFlowGraph graph = ControlFlowGraph.build(WorkflowIndex.of(wf));

        assertThat(graph.successors("a")).containsExactly("b");
        assertThat(graph.inDegree("b")).isEqualTo(1);
        assertThat(graph.inDegree("a")).isEqualTo(1);
        assertThat(graph.topologicalOrder()).containsExactly("a", "b");
    }

    @Test
    @DisplayName("orders ready nodes by declaration, not by edge order")
    void shouldBreakTiesByDeclarationOrder() {
        Workflow wf =
                workflow("ties")
                        .nodeType(controlOnly("step"))
                        .instance("first", "step")
                        .instance("second", "step")
                        .instance("third", "step")
                        .connect("Start", "execute", "third", "execute")
                        .connect("Start", "execute", "second", "execute")
                        .connect("Start", "execute", "first", "execute")
                        .build();

        assertThat(ControlFlowGraph.build(WorkflowIndex.of(wf)).topologicalOrder())
                .containsExactly("first", "second", "third");
    }

    @Test
    void shouldLeaveScopedChildrenOutOfTheGraph() {
        NodeType forEach =
                NodeType.builder()
                        .functionName("forEach")
                        .output("item", PortDefinition.builder().dataType(DataType.ANY).scope("each").build())
                        .build();
        Workflow wf =
                workflow("scoped")
                        .nodeType(forEach)
                        .nodeType(passThrough("work", DataType.ANY, DataType.ANY))
                        .instance("loop", "forEach")
                        .instance(NodeInstance.of("child", "work").inScope("loop", "each"))
                        .connect("Start", "execute", "loop", "execute")
                        .connection(
                                new Connection(
                                        new PortReference("loop", "item", "each"),
                                        PortReference.of("child", "in"),
                                        null,
                                        null))
                        .build();

        ControlFlowGraph graph = ControlFlowGraph.build(WorkflowIndex.of(wf));

        assertThat(graph.contains("child")).isFalse();
        assertThat(graph.successors("loop")).containsExactly("Exit");
    }
}

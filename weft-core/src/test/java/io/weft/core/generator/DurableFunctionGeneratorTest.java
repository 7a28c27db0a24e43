package io.weft.core.generator;

import static io.weft.core.TestWorkflows.controlOnly;
import static io.weft.core.TestWorkflows.sink;
import static io.weft.core.TestWorkflows.source;
import static io.weft.core.TestWorkflows.workflow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.weft.core.analysis.ControlFlowAnalyzer;
import io.weft.core.workflow.Workflow;
import io.weft.core.workflow.WorkflowOptions;
import io.weft.core.workflow.WorkflowOptions.CancelOn;
import io.weft.core.workflow.WorkflowOptions.Throttle;
import io.weft.core.workflow.WorkflowOptions.Trigger;
import io.weft.core.workflow.connection.CoerceType;
import io.weft.core.workflow.connection.Connection;
import io.weft.core.workflow.connection.PortReference;
import io.weft.core.workflow.node.InstanceConfig;
import io.weft.core.workflow.node.NodeInstance;
import io.weft.core.workflow.node.NodeType;
import io.weft.core.workflow.node.PortConfig;
import io.weft.core.workflow.port.DataType;
import io.weft.core.workflow.port.MergeStrategy;
import io.weft.core.workflow.port.PortDefinition;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DurableFunctionGenerator")
class DurableFunctionGeneratorTest {

    private DurableFunctionGenerator generator;
    private ControlFlowAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        generator = new DurableFunctionGenerator();
        analyzer = new ControlFlowAnalyzer();
    }

    private GeneratedFunction generate(Workflow workflow) {
        return generate(workflow, GenerationOptions.defaults());
    }

    private GeneratedFunction generate(Workflow workflow, GenerationOptions options) {
        return generator.generate(workflow, analyzer.analyze(workflow), options);
    }

    /// load1 reads a user, store1 saves it, Exit exposes the loaded value.
    private static Workflow.Builder pipeline() {
        return workflow("pipeline")
                .nodeType(source("loadUser", DataType.STRING))
                .nodeType(sink("storeUser", DataType.STRING))
                .instance("load1", "loadUser")
                .instance("store1", "storeUser")
                .exitPort("saved", PortDefinition.of(DataType.STRING))
                .connect("Start", "execute", "load1", "execute")
                .connect("load1", "onSuccess", "store1", "execute")
                .connect("load1", "out", "store1", "in")
                .connect("store1", "onSuccess", "Exit", "onSuccess")
                .connect("load1", "out", "Exit", "saved");
    }

    @Test
    @DisplayName("generates the complete module for a guarded two-step pipeline")
    void shouldGenerateCompleteModule() {
        // Given
        Workflow wf = pipeline().build();

        // When
        GeneratedFunction result = generate(wf);

        // Then
        assertThat(result.source())
                .isEqualTo(
                        """
                        // Generated by weft from workflow 'pipeline workflow' (2 nodes)
                        import { Inngest } from 'inngest';

                        import { loadUser } from './node-types/loadUser.js';
                        import { storeUser } from './node-types/storeUser.js';

                        const inngest = new Inngest({ id: 'pipeline' });

                        export const pipelineFn = inngest.createFunction(
                          { id: 'pipeline', retries: 3 },
                          { event: 'weft/pipeline.execute' },
                          async ({ event, step }) => {
                            let load1_result: any, store1_result: any;

                            // load1 (loadUser)
                            load1_result = await step.run('load1', async () => {
                              return loadUser(true);
                            });

                            if (load1_result.onSuccess) {
                              // store1 (storeUser)
                              store1_result = await step.run('store1', async () => {
                                return storeUser(load1_result.onSuccess, load1_result.out);
                              });

                            }
                            return { onSuccess: store1_result?.onSuccess, saved: load1_result?.out };
                          }
                        );
                        """);
        assertThat(result.functionId()).isEqualTo("pipeline");
        assertThat(result.serviceName()).isEqualTo("pipeline");
        assertThat(result.triggerEvent()).isEqualTo("weft/pipeline.execute");
        assertThat(result.importedFunctions()).containsExactly("loadUser", "storeUser");
        assertThat(result.stepIds()).containsExactly("load1", "store1");
    }

    @Test
    void shouldRejectNullArguments() {
        Workflow wf = pipeline().build();

        assertThatThrownBy(() -> generator.generate(wf, null, GenerationOptions.defaults()))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void shouldProduceIdenticalOutputForRepeatedRuns() {
        Workflow wf = pipeline().build();

        assertThat(generate(wf).source()).isEqualTo(generate(wf).source());
    }

    @Nested
    @DisplayName("control flow")
    class ControlFlow {

        @Test
        @DisplayName("joins independent steps with Promise.all")
        void shouldJoinIndependentSteps() {
            // Given
            Workflow wf =
                    workflow("fanOut")
                            .nodeType(controlOnly("taskA"))
                            .nodeType(controlOnly("taskB"))
                            .instance("A", "taskA")
                            .instance("B", "taskB")
                            .connect("Start", "execute", "A", "execute")
                            .connect("Start", "execute", "B", "execute")
                            .build();

            // When
            String source = generate(wf).source();

            // Then
            assertThat(source)
                    .contains("    // A (taskA)\n    // B (taskB)\n")
                    .contains("    [A_result, B_result] = await Promise.all([\n")
                    .contains("      step.run('A', async () => taskA(true)),\n")
                    .contains("      step.run('B', async () => taskB(true))\n")
                    .contains("    ]);\n")
                    .doesNotContain("A_result = await step.run");
        }

        @Test
        @DisplayName("flattens a chain of branching nodes instead of nesting it")
        void shouldFlattenChain() {
            // Given
            Workflow wf =
                    workflow("ladder")
                            .nodeType(controlOnly("gate"))
                            .nodeType(controlOnly("work"))
                            .instance("g1", "gate")
                            .instance("g2", "gate")
                            .instance("s2", "work")
                            .instance("f2", "work")
                            .connect("Start", "execute", "g1", "execute")
                            .connect("g1", "onSuccess", "g2", "execute")
                            .connect("g1", "onFailure", "Exit", "onFailure")
                            .connect("g2", "onSuccess", "s2", "execute")
                            .connect("g2", "onFailure", "f2", "execute")
                            .build();

            // When
            String source = generate(wf).source();

            // Then
            assertThat(source)
                    .contains("    g2_result = await step.run('g2', async () => {\n")
                    .contains("      return gate(g1_result.onSuccess);\n")
                    .contains("    if (g2_result.onSuccess) {\n      // s2 (work)\n")
                    .contains("        return work(g2_result.onSuccess);\n")
                    .contains("    } else {\n      // f2 (work)\n")
                    .contains("        return work(g2_result.onFailure);\n")
                    .doesNotContain("if (g1_result.onSuccess)");
        }

        @Test
        void shouldEmitElseBranchForFailureRegion() {
            // Given
            Workflow wf =
                    workflow("split")
                            .nodeType(controlOnly("check"))
                            .nodeType(controlOnly("notify"))
                            .instance("c1", "check")
                            .instance("ok", "notify")
                            .instance("ko", "notify")
                            .connect("c1", "onSuccess", "ok", "execute")
                            .connect("c1", "onFailure", "ko", "execute")
                            .build();

            // When
            String source = generate(wf).source();

            // Then
            assertThat(source)
                    .contains("    if (c1_result.onSuccess) {\n")
                    .contains("      return notify(c1_result.onSuccess);\n")
                    .contains("    } else {\n")
                    .contains("      return notify(c1_result.onFailure);\n");
        }

        @Test
        @DisplayName("runs a node fed by both branches after the branch bodies")
        void shouldEmitSharedNodeAfterBranches() {
            // Given
            NodeType join =
                    NodeType.builder()
                            .functionName("joinIt")
                            .input("a", PortDefinition.of(DataType.STRING))
                            .input("b", PortDefinition.of(DataType.STRING))
                            .build();
            Workflow wf =
                    workflow("rejoin")
                            .nodeType(controlOnly("gate"))
                            .nodeType(source("produce", DataType.STRING))
                            .nodeType(join)
                            .instance("P", "gate")
                            .instance("A", "produce")
                            .instance("B", "produce")
                            .instance("S", "joinIt")
                            .connect("Start", "execute", "P", "execute")
                            .connect("P", "onSuccess", "A", "execute")
                            .connect("P", "onFailure", "B", "execute")
                            .connect("A", "out", "S", "a")
                            .connect("B", "out", "S", "b")
                            .build();

            // When
            String source = generate(wf).source();

            // Then
            assertThat(source)
                    .doesNotContain("Promise.all")
                    .contains("    if (P_result.onSuccess) {\n")
                    .contains("    S_result = await step.run('S', async () => {\n")
                    .contains("      return joinIt(true, A_result.out, B_result.out);\n");
            assertThat(source.indexOf("step.run('S'"))
                    .isGreaterThan(source.indexOf("step.run('A'"))
                    .isGreaterThan(source.indexOf("step.run('B'"));
        }

        @Test
        @DisplayName("emits plain nodes beside a nested branching node")
        void shouldEmitNodesBesideNestedBranchingNode() {
            // Given
            Workflow wf =
                    workflow("sideBySide")
                            .nodeType(controlOnly("gate"))
                            .nodeType(controlOnly("work"))
                            .instance("P1", "gate")
                            .instance("P2", "gate")
                            .instance("Q", "work")
                            .instance("F", "work")
                            .instance("s2", "work")
                            .instance("f2", "work")
                            .connect("Start", "execute", "P1", "execute")
                            .connect("P1", "onSuccess", "P2", "execute")
                            .connect("P1", "onSuccess", "Q", "execute")
                            .connect("P1", "onFailure", "F", "execute")
                            .connect("P2", "onSuccess", "s2", "execute")
                            .connect("P2", "onFailure", "f2", "execute")
                            .build();

            // When
            GeneratedFunction result = generate(wf);

            // Then
            assertThat(result.source())
                    .contains("    if (P1_result.onSuccess) {\n")
                    .contains("step.run('Q', async () => work(P1_result.onSuccess))")
                    .contains("step.run('P2', async () => gate(P1_result.onSuccess))")
                    .contains("      if (P2_result.onSuccess) {\n");
            assertThat(result.stepIds()).contains("P1", "P2", "Q", "F", "s2", "f2");
        }
    }

    @Nested
    @DisplayName("node kinds")
    class NodeKinds {

        @Test
        @DisplayName("inlines expression nodes without a durable step")
        void shouldInlineExpressionNode() {
            // Given
            NodeType doubler =
                    NodeType.builder()
                            .functionName("double")
                            .expression(true)
                            .input("value", PortDefinition.of(DataType.NUMBER))
                            .output("out", PortDefinition.of(DataType.NUMBER))
                            .build();
            Workflow wf =
                    workflow("calc")
                            .nodeType(doubler)
                            .instance("d1", "double")
                            .startPort("value", PortDefinition.of(DataType.NUMBER))
                            .exitPort("result", PortDefinition.of(DataType.NUMBER))
                            .connect("Start", "value", "d1", "value")
                            .connect("d1", "out", "Exit", "result")
                            .build();

            // When
            GeneratedFunction result = generate(wf);

            // Then
            assertThat(result.source())
                    .contains("    d1_result = double(event.data.value);\n")
                    .contains("return { result: d1_result?.out };")
                    .doesNotContain("step.run('d1'");
            assertThat(result.stepIds()).isEmpty();
        }

        @Test
        void shouldAwaitAsyncNodeFunctions() {
            NodeType fetch = NodeType.builder().functionName("fetchIt").async(true).build();
            Workflow wf = workflow("remote").nodeType(fetch).instance("f1", "fetchIt").build();

            assertThat(generate(wf).source()).contains("      return await fetchIt(true);\n");
        }

        @Test
        @DisplayName("lowers delay to step.sleep and runs its successors unguarded")
        void shouldLowerDelayToSleep() {
            // Given
            NodeType delay =
                    NodeType.builder()
                            .functionName("delay")
                            .importSource(BuiltInNode.IMPORT_PREFIX)
                            .input(
                                    "duration",
                                    PortDefinition.builder()
                                            .dataType(DataType.STRING)
                                            .defaultValue("1h")
                                            .build())
                            .build();
            Workflow wf =
                    workflow("later")
                            .nodeType(delay)
                            .nodeType(controlOnly("notify"))
                            .instance("wait1", "delay")
                            .instance("next1", "notify")
                            .connect("Start", "execute", "wait1", "execute")
                            .connect("wait1", "onSuccess", "next1", "execute")
                            .build();

            // When
            GeneratedFunction result = generate(wf);

            // Then
            assertThat(result.source())
                    .contains("    await step.sleep('wait1', \"1h\");\n")
                    .contains("    let next1_result: any;\n")
                    .contains("      return notify(true);\n")
                    .doesNotContain("wait1_result")
                    .doesNotContain("built-in-nodes");
            assertThat(result.importedFunctions()).containsExactly("notify");
            assertThat(result.stepIds()).containsExactly("wait1", "next1");
        }

        @Test
        void shouldReturnLiteralOutcomeForDelayWiredToExit() {
            // Given
            NodeType delay =
                    NodeType.builder()
                            .functionName("delay")
                            .importSource(BuiltInNode.IMPORT_PREFIX)
                            .input(
                                    "duration",
                                    PortDefinition.builder()
                                            .dataType(DataType.STRING)
                                            .defaultValue("1s")
                                            .build())
                            .build();
            Workflow wf =
                    workflow("pause")
                            .nodeType(delay)
                            .instance("wait1", "delay")
                            .connect("Start", "execute", "wait1", "execute")
                            .connect("wait1", "onSuccess", "Exit", "onSuccess")
                            .connect("wait1", "onFailure", "Exit", "onFailure")
                            .build();

            // When
            String source = generate(wf).source();

            // Then
            assertThat(source)
                    .contains("    await step.sleep('wait1', \"1s\");\n")
                    .contains("return { onSuccess: true, onFailure: false };")
                    .doesNotContain("wait1_result");
        }

        @Test
        void shouldLowerWaitForEvent() {
            // Given
            NodeType wait =
                    NodeType.builder()
                            .functionName("waitForEvent")
                            .input(
                                    "eventName",
                                    PortDefinition.builder()
                                            .dataType(DataType.STRING)
                                            .defaultValue("order/paid")
                                            .build())
                            .build();
            Workflow wf = workflow("paid").nodeType(wait).instance("w1", "waitForEvent").build();

            // When
            String source = generate(wf).source();

            // Then
            assertThat(source)
                    .contains("    const w1_raw = await step.waitForEvent('w1', {\n")
                    .contains("      event: \"order/paid\",\n")
                    .contains("    w1_result = w1_raw\n")
                    .contains(
                            "      ? { onSuccess: true, onFailure: false, eventData: w1_raw.data }\n")
                    .doesNotContain("match:");
        }

        @Test
        void shouldLowerInvokeWorkflowWithCatch() {
            // Given
            NodeType invoke =
                    NodeType.builder()
                            .functionName("invokeWorkflow")
                            .input(
                                    "functionId",
                                    PortDefinition.builder()
                                            .dataType(DataType.STRING)
                                            .defaultValue("child-fn")
                                            .build())
                            .input("payload", PortDefinition.of(DataType.ANY))
                            .build();
            Workflow wf =
                    workflow("parent")
                            .nodeType(invoke)
                            .instance("i1", "invokeWorkflow")
                            .startPort("payload", PortDefinition.of(DataType.ANY))
                            .connect("Start", "payload", "i1", "payload")
                            .build();

            // When
            String source = generate(wf).source();

            // Then
            assertThat(source)
                    .contains("    try {\n      i1_result = await step.invoke('i1', {\n")
                    .contains("        function: \"child-fn\",\n")
                    .contains("        data: event.data.payload,\n")
                    .contains("    } catch (err) {\n");
        }

        @Test
        @DisplayName("runs per-port scoped children once per item with indexed step ids")
        void shouldLoopOverScopedChildren() {
            // Given
            NodeType forEach =
                    NodeType.builder()
                            .functionName("forEach")
                            .output(
                                    "item",
                                    PortDefinition.builder()
                                            .dataType(DataType.ANY)
                                            .scope("each")
                                            .build())
                            .build();
            NodeType work =
                    NodeType.builder()
                            .functionName("work")
                            .input("in", PortDefinition.of(DataType.ANY))
                            .build();
            Workflow wf =
                    workflow("batch")
                            .nodeType(forEach)
                            .nodeType(work)
                            .instance("loop1", "forEach")
                            .instance(NodeInstance.of("work1", "work").inScope("loop1", "each"))
                            .connect("Start", "execute", "loop1", "execute")
                            .connection(
                                    new Connection(
                                            new PortReference("loop1", "item", "each"),
                                            PortReference.of("work1", "in"),
                                            null,
                                            null))
                            .build();

            // When
            GeneratedFunction result = generate(wf);

            // Then
            assertThat(result.source())
                    .contains("    const loop1_each_results = [];\n")
                    .contains(
                            "    for (let __i__ = 0; __i__ < loop1_result.item.length; __i__++) {\n")
                    .contains("      const __item__ = loop1_result.item[__i__];\n")
                    .contains(
                            "      const work1_result = await step.run(`work1-${__i__}`, async () => {\n")
                    .contains("        return work(true, __item__);\n")
                    .contains("      loop1_each_results.push(work1_result);\n")
                    .doesNotContain("work1_result: any");
            assertThat(result.stepIds()).containsExactly("loop1", "work1-${__i__}");
            assertThat(result.importedFunctions()).containsExactly("forEach");
        }
    }

    @Nested
    @DisplayName("arguments")
    class Arguments {

        private Workflow.Builder fanIn(PortDefinition input) {
            return workflow("fanIn")
                    .nodeType(source("produce", DataType.STRING))
                    .nodeType(
                            NodeType.builder().functionName("combine").input("in", input).build())
                    .instance("a1", "produce")
                    .instance("a2", "produce")
                    .instance("c1", "combine")
                    .connect("a1", "out", "c1", "in")
                    .connect("a2", "out", "c1", "in");
        }

        @Test
        void shouldCollectFanInWithMergeStrategy() {
            PortDefinition collect =
                    PortDefinition.builder()
                            .dataType(DataType.ARRAY)
                            .mergeStrategy(MergeStrategy.COLLECT)
                            .build();

            assertThat(generate(fanIn(collect).build()).source())
                    .contains("return combine(true, [a1_result?.out, a2_result?.out]);");
        }

        @Test
        void shouldFallBackAcrossWritersWithoutMergeStrategy() {
            assertThat(generate(fanIn(PortDefinition.of(DataType.STRING)).build()).source())
                    .contains("return combine(true, a1_result?.out ?? a2_result?.out);");
        }

        @Test
        void shouldWrapCoercedConnection() {
            // Given
            Workflow wf =
                    workflow("coerce")
                            .nodeType(source("loadUser", DataType.STRING))
                            .nodeType(sink("storeUser", DataType.NUMBER))
                            .instance("load1", "loadUser")
                            .instance("store1", "storeUser")
                            .connection(
                                    Connection.of("load1", "out", "store1", "in")
                                            .coercedTo(CoerceType.NUMBER))
                            .build();

            // When / Then
            assertThat(generate(wf).source())
                    .contains("return storeUser(true, Number(load1_result.out));");
        }

        @Test
        void shouldPreferInstanceExpressionOverride() {
            Workflow wf =
                    workflow("override")
                            .nodeType(sink("storeUser", DataType.STRING))
                            .instance(
                                    NodeInstance.of("store1", "storeUser")
                                            .withConfig(
                                                    new InstanceConfig(
                                                            List.of(
                                                                    PortConfig.expression(
                                                                            "in", "'fixed'")),
                                                            null)))
                            .build();

            assertThat(generate(wf).source()).contains("return storeUser(true, 'fixed');");
        }

        @Test
        void shouldMarkMissingSource() {
            Workflow wf =
                    workflow("missing")
                            .nodeType(sink("storeUser", DataType.STRING))
                            .instance("store1", "storeUser")
                            .build();

            assertThat(generate(wf).source())
                    .contains("return storeUser(true, undefined /* no source for store1.in */);");
        }

        @Test
        void shouldPassUndefinedForUnconnectedOptionalPort() {
            NodeType store =
                    NodeType.builder()
                            .functionName("storeUser")
                            .input(
                                    "in",
                                    PortDefinition.builder()
                                            .dataType(DataType.STRING)
                                            .optional(true)
                                            .build())
                            .build();
            Workflow wf = workflow("optional").nodeType(store).instance("store1", "storeUser").build();

            assertThat(generate(wf).source()).contains("return storeUser(true, undefined);");
        }
    }

    @Nested
    @DisplayName("function configuration")
    class FunctionConfiguration {

        @Test
        @DisplayName("lets workflow options win over generation options")
        void shouldPreferWorkflowOptions() {
            // Given
            Workflow wf =
                    pipeline()
                            .options(
                                    new WorkflowOptions(
                                            false,
                                            5,
                                            "1h",
                                            new Throttle(10, "1m"),
                                            new CancelOn("app/cancel", "data.id", null),
                                            null))
                            .build();
            GenerationOptions options =
                    GenerationOptions.builder()
                            .retries(1)
                            .timeout("5m")
                            .functionConfig(Map.of("retries", 9))
                            .build();

            // When
            String source = generate(wf, options).source();

            // Then
            assertThat(source)
                    .contains(
                            "  { id: 'pipeline', retries: 5, timeouts: { finish: '1h' },"
                                    + " throttle: { limit: 10, period: '1m' },"
                                    + " cancelOn: [{ event: 'app/cancel', match: 'data.id' }] },\n");
        }

        @Test
        void shouldAppendExtraFunctionConfigAsJson() {
            GenerationOptions options =
                    GenerationOptions.builder()
                            .functionConfig(Map.of("id", "ignored", "concurrency", 2))
                            .build();

            assertThat(generate(pipeline().build(), options).source())
                    .contains("  { id: 'pipeline', retries: 3, concurrency: 2 },\n");
        }

        @Test
        void shouldUseServiceNameOverride() {
            GenerationOptions options = GenerationOptions.builder().serviceName("billing").build();

            GeneratedFunction result = generate(pipeline().build(), options);

            assertThat(result.serviceName()).isEqualTo("billing");
            assertThat(result.source()).contains("const inngest = new Inngest({ id: 'billing' });");
        }

        @Test
        void shouldEmitCronTrigger() {
            Workflow wf =
                    pipeline()
                            .options(
                                    new WorkflowOptions(
                                            false, null, null, null, null,
                                            new Trigger(null, "0 * * * *")))
                            .build();

            GeneratedFunction result = generate(wf);

            assertThat(result.source()).contains("  { cron: '0 * * * *' },\n");
            assertThat(result.triggerEvent()).isNull();
        }

        @Test
        void shouldPreferWorkflowTriggerEvent() {
            Workflow wf =
                    pipeline()
                            .options(
                                    new WorkflowOptions(
                                            false, null, null, null, null,
                                            new Trigger("orders/created", null)))
                            .build();
            GenerationOptions options =
                    GenerationOptions.builder().triggerEvent("app/fallback").build();

            assertThat(generate(wf, options).triggerEvent()).isEqualTo("orders/created");
        }

        @Test
        void shouldUseTriggerEventOption() {
            GenerationOptions options =
                    GenerationOptions.builder().triggerEvent("app/fallback").build();

            GeneratedFunction result = generate(pipeline().build(), options);

            assertThat(result.triggerEvent()).isEqualTo("app/fallback");
            assertThat(result.source()).contains("  { event: 'app/fallback' },\n");
        }
    }

    @Nested
    @DisplayName("output modes")
    class OutputModes {

        @Test
        void shouldOmitDebugCommentsInProduction() {
            GenerationOptions options = GenerationOptions.builder().production(true).build();

            String source = generate(pipeline().build(), options).source();

            assertThat(source)
                    .startsWith("import { Inngest } from 'inngest';")
                    .doesNotContain("// Generated by weft")
                    .doesNotContain("// load1 (loadUser)");
        }

        @Test
        @DisplayName("emits a zod schema for typed events")
        void shouldEmitEventSchema() {
            // Given
            Workflow wf =
                    pipeline()
                            .startPort("userId", PortDefinition.of(DataType.STRING))
                            .startPort(
                                    "tags",
                                    PortDefinition.builder()
                                            .dataType(DataType.ARRAY)
                                            .tsType("string[]")
                                            .build())
                            .build();
            GenerationOptions options = GenerationOptions.builder().typedEvents(true).build();

            // When
            String source = generate(wf, options).source();

            // Then
            assertThat(source)
                    .contains("import { z } from 'zod';\n")
                    .contains("const pipelineEvent = {\n  name: 'weft/pipeline.execute',\n")
                    .contains("      userId: z.string(),\n")
                    .contains("      tags: z.array(z.string()),\n");
        }

        @Test
        void shouldAppendServeHandler() {
            GenerationOptions options =
                    GenerationOptions.builder()
                            .framework(ServeFramework.HONO)
                            .serveHandler(true)
                            .build();

            String source = generate(pipeline().build(), options).source();

            assertThat(source)
                    .contains("import { serve } from 'inngest/hono';\n")
                    .contains("// --- Serve handler (hono) ---\n")
                    .contains("export const handler = serve({\n  client: inngest,\n")
                    .contains("  functions: [pipelineFn],\n");
        }

        @Test
        void shouldUseNamedExportsForNext() {
            GenerationOptions options =
                    GenerationOptions.builder()
                            .framework(ServeFramework.NEXT)
                            .serveHandler(true)
                            .build();

            assertThat(generate(pipeline().build(), options).source())
                    .contains("export const { GET, POST, PUT } = serve({\n");
        }

        @Test
        void shouldSkipServeHandlerWhenNotRequested() {
            GenerationOptions options =
                    GenerationOptions.builder().framework(ServeFramework.HONO).build();

            assertThat(generate(pipeline().build(), options).source())
                    .doesNotContain("serve");
        }
    }
}

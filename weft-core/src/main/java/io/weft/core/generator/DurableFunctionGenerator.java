package io.weft.core.generator;

import static io.weft.core.util.Identifiers.toKebabCase;
import static io.weft.core.util.Identifiers.toValidIdentifier;

import io.weft.core.analysis.ControlFlowAnalysis;
import io.weft.core.util.JsonUtil;
import io.weft.core.workflow.ReservedNames;
import io.weft.core.workflow.Workflow;
import io.weft.core.workflow.WorkflowIndex;
import io.weft.core.workflow.WorkflowOptions;
import io.weft.core.workflow.WorkflowOptions.CancelOn;
import io.weft.core.workflow.WorkflowOptions.Throttle;
import io.weft.core.workflow.connection.Connection;
import io.weft.core.workflow.node.NodeInstance;
import io.weft.core.workflow.node.NodeType;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Generates an `inngest` durable function module from an analyzed workflow.
///
/// ### Emission policy
/// - Expression nodes are inlined as plain assignments
/// - Every other node runs inside `step.run('<id>', ...)`, one durable step each
/// - Built-in primitives lower to `step.sleep`, `step.waitForEvent` and `step.invoke`
/// - Independent steps are joined with `Promise.all`
/// - Branching nodes guard their regions with `if`/`else`; chains are flattened
/// - Per-port scoped children run in an indexed loop over the parent's item output
///
/// ### Module layout
/// ```
/// imports
/// const inngest = new Inngest({ id: '<serviceName>' });
/// [event schema]
/// export const <fn>Fn = inngest.createFunction({ config }, { trigger }, async ({ event, step }) => {
///   let <id>_result: any, ...;
///   <body>
///   return { <exitPort>: ..., ... };
/// });
/// [serve handler]
/// ```
///
/// @implNote Stateless and thread-safe. Per-call state lives in a {@link StepEmitter}.
public final class DurableFunctionGenerator implements CodeGenerator {

    private static final Logger logger =
            Logger.getLogger(DurableFunctionGenerator.class.getName());

    private static final String BODY_INDENT = "    ";

    @Override
    public GeneratedFunction generate(
            Workflow workflow, ControlFlowAnalysis analysis, GenerationOptions options) {
        Objects.requireNonNull(workflow, "workflow must not be null");
        Objects.requireNonNull(analysis, "analysis must not be null");
        Objects.requireNonNull(options, "options must not be null");

        WorkflowIndex index = WorkflowIndex.of(workflow);
        WorkflowOptions workflowOptions = workflow.getOptions();

        String functionId = toKebabCase(workflow.getFunctionName());
        String serviceName =
                options.getServiceName() != null ? options.getServiceName() : functionId;
        String defaultEvent =
                options.getTriggerEvent() != null
                        ? options.getTriggerEvent()
                        : "weft/" + functionId + ".execute";
        String fnVar = toValidIdentifier(workflow.getFunctionName()) + "Fn";

        List<String> lines = new ArrayList<>();
        if (!options.isProduction()) {
            lines.add(
                    "// Generated by weft from workflow '"
                            + workflow.getName()
                            + "' ("
                            + workflow.getInstances().size()
                            + " nodes)");
        }

        lines.add("import { Inngest } from 'inngest';");
        if (options.isTypedEvents()) {
            lines.add("import { z } from 'zod';");
        }
        if (options.emitsServeHandler()) {
            lines.add("import { serve } from '" + options.getFramework().importPath() + "';");
        }
        lines.add("");

        List<String> imported = importedFunctions(workflow, index);
        for (String fn : imported) {
            lines.add("import { " + fn + " } from './node-types/" + fn + ".js';");
        }
        lines.add("");

        lines.add("const inngest = new Inngest({ id: '" + serviceName + "' });");
        lines.add("");

        WorkflowOptions.Trigger trigger = workflowOptions.trigger();
        if (options.isTypedEvents()) {
            String schemaEvent =
                    trigger != null && trigger.event() != null ? trigger.event() : defaultEvent;
            lines.addAll(EventSchemaWriter.write(workflow, schemaEvent));
        }

        lines.add("export const " + fnVar + " = inngest.createFunction(");
        lines.add("  { " + String.join(", ", configEntries(functionId, workflowOptions, options)) + " },");

        String triggerEvent;
        if (trigger != null && trigger.event() != null) {
            triggerEvent = trigger.event();
            lines.add("  { event: '" + triggerEvent + "' },");
        } else if (trigger != null && trigger.cron() != null) {
            triggerEvent = null;
            lines.add("  { cron: '" + trigger.cron() + "' },");
        } else {
            triggerEvent = defaultEvent;
            lines.add("  { event: '" + triggerEvent + "' },");
        }
        lines.add("  async ({ event, step }) => {");

        List<String> resultVars = resultVariables(workflow, index);
        if (!resultVars.isEmpty()) {
            lines.add(BODY_INDENT + "let " + String.join(", ", resultVars) + ";");
            lines.add("");
        }

        StepEmitter emitter = new StepEmitter(index, analysis, options.isProduction(), lines);
        emitter.emitBlock(analysis.topLevelNodes(), BODY_INDENT);

        lines.add(BODY_INDENT + returnStatement(index));
        lines.add("  }");
        lines.add(");");
        lines.add("");

        if (options.emitsServeHandler()) {
            ServeFramework framework = options.getFramework();
            lines.add("// --- Serve handler (" + framework.displayName() + ") ---");
            lines.add(framework.exportLine());
            lines.add("  client: inngest,");
            lines.add("  functions: [" + fnVar + "],");
            lines.add("});");
            lines.add("");
        }

        GeneratedFunction result =
                new GeneratedFunction(
                        String.join("\n", lines),
                        functionId,
                        serviceName,
                        triggerEvent,
                        imported,
                        emitter.stepIds());
        logger.fine(
                () ->
                        "Generated function '"
                                + functionId
                                + "': "
                                + result.stepIds().size()
                                + " step(s), "
                                + imported.size()
                                + " import(s)");
        return result;
    }

    /// Node functions to import, one per function name. Scoped children and
    /// built-ins are skipped.
    private static List<String> importedFunctions(Workflow workflow, WorkflowIndex index) {
        Set<String> functions = new LinkedHashSet<>();
        for (NodeInstance instance : workflow.getInstances()) {
            if (index.isPerPortScopedChild(instance.id())) {
                continue;
            }
            index.findType(instance.nodeType())
                    .filter(type -> BuiltInNode.resolve(type).isEmpty())
                    .map(NodeType::getFunctionName)
                    .ifPresent(functions::add);
        }
        return List.copyOf(functions);
    }

    private static List<String> configEntries(
            String functionId, WorkflowOptions workflowOptions, GenerationOptions options) {
        int retries =
                workflowOptions.retries() != null ? workflowOptions.retries() : options.getRetries();
        List<String> entries = new ArrayList<>();
        entries.add("id: '" + functionId + "'");
        entries.add("retries: " + retries);

        String timeout = firstNonNull(workflowOptions.timeout(), options.getTimeout());
        if (timeout != null) {
            entries.add("timeouts: { finish: '" + timeout + "' }");
        }

        Throttle throttle = firstNonNull(workflowOptions.throttle(), options.getThrottle());
        if (throttle != null) {
            String config = "limit: " + throttle.limit();
            if (throttle.period() != null) {
                config += ", period: '" + throttle.period() + "'";
            }
            entries.add("throttle: { " + config + " }");
        }

        CancelOn cancelOn = firstNonNull(workflowOptions.cancelOn(), options.getCancelOn());
        if (cancelOn != null) {
            String config = "event: '" + cancelOn.event() + "'";
            if (cancelOn.match() != null) {
                config += ", match: '" + cancelOn.match() + "'";
            }
            if (cancelOn.timeout() != null) {
                config += ", timeout: '" + cancelOn.timeout() + "'";
            }
            entries.add("cancelOn: [{ " + config + " }]");
        }

        for (Map.Entry<String, Object> extra : options.getFunctionConfig().entrySet()) {
            if (!"id".equals(extra.getKey()) && !"retries".equals(extra.getKey())) {
                entries.add(extra.getKey() + ": " + JsonUtil.toJson(extra.getValue()));
            }
        }
        return entries;
    }

    /// Result variables are declared up front so branch bodies and the return
    /// statement can read them. Delays and scoped children have none.
    private static List<String> resultVariables(Workflow workflow, WorkflowIndex index) {
        List<String> vars = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (NodeInstance instance : workflow.getInstances()) {
            if (index.isPerPortScopedChild(instance.id()) || !seen.add(instance.id())) {
                continue;
            }
            Optional<NodeType> type = index.findType(instance.nodeType());
            if (type.isPresent() && BuiltInNode.isDelay(type.get())) {
                continue;
            }
            vars.add(toValidIdentifier(instance.id()) + "_result: any");
        }
        return vars;
    }

    /// Maps each exit port to its first writer.
    private static String returnStatement(WorkflowIndex index) {
        ArgumentResolver resolver = new ArgumentResolver(index);
        List<String> props = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Connection conn : index.incoming(ReservedNames.EXIT)) {
            String exitPort = conn.to().port();
            if (!seen.add(exitPort)) {
                continue;
            }
            props.add(exitPort + ": " + resolver.sourceRef(conn, true));
        }
        return props.isEmpty() ? "return {};" : "return { " + String.join(", ", props) + " };";
    }

    private static <T> T firstNonNull(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}

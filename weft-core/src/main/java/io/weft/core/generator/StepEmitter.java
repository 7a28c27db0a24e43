package io.weft.core.generator;

import static io.weft.core.util.Identifiers.toValidIdentifier;

import io.weft.core.analysis.BranchRegion;
import io.weft.core.analysis.BranchingChain;
import io.weft.core.analysis.ControlFlowAnalysis;
import io.weft.core.analysis.ParallelGroups;
import io.weft.core.workflow.ReservedNames;
import io.weft.core.workflow.WorkflowIndex;
import io.weft.core.workflow.connection.Connection;
import io.weft.core.workflow.node.NodeInstance;
import io.weft.core.workflow.node.NodeType;
import io.weft.core.workflow.port.PortDefinition;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Emits the body of one durable function: node calls, parallel joins, branch
/// bodies, flattened chains and scope loops.
///
/// ### Contracts
/// - Each node is emitted at most once, tracked in the emitter's own set.
/// - Expression nodes are emitted right before their first consumer if they have
///   not been emitted yet.
/// - Members of a flattened chain are emitted only by the chain head.
///
/// @implNote Not thread-safe. One instance per generated function.
final class StepEmitter {

    private static final String STEP = "  ";

    private final WorkflowIndex index;
    private final ControlFlowAnalysis analysis;
    private final ArgumentResolver arguments;
    private final boolean production;
    private final List<String> lines;
    private final Set<String> generated = new HashSet<>();
    private final List<String> stepIds = new ArrayList<>();

    StepEmitter(
            WorkflowIndex index,
            ControlFlowAnalysis analysis,
            boolean production,
            List<String> lines) {
        this.index = index;
        this.analysis = analysis;
        this.arguments = new ArgumentResolver(index);
        this.production = production;
        this.lines = lines;
    }

    /// @return step ids in emission order
    List<String> stepIds() {
        return stepIds;
    }

    /// Emits a list of nodes, joining independent durable steps.
    void emitBlock(List<String> nodes, String indent) {
        List<String> remaining =
                nodes.stream()
                        .filter(n -> !generated.contains(n) && !ReservedNames.isVirtualNode(n))
                        .toList();
        if (remaining.isEmpty()) {
            return;
        }

        for (List<String> group : ParallelGroups.detect(remaining, index)) {
            List<String> eligible = group.stream().filter(n -> !generated.contains(n)).toList();
            if (eligible.size() < 2 || eligible.stream().allMatch(this::isExpression)) {
                eligible.forEach(node -> emitSingle(node, indent));
            } else {
                emitMixedGroup(eligible, indent);
            }
        }
    }

    private void emitMixedGroup(List<String> group, String indent) {
        List<String> expressions = new ArrayList<>();
        List<String> chainHeads = new ArrayList<>();
        List<String> steps = new ArrayList<>();
        for (String node : group) {
            Optional<NodeType> type = index.typeOf(node);
            if (type.isEmpty()) {
                continue;
            }
            if (type.get().isExpression()) {
                expressions.add(node);
            } else if (analysis.flattenedChainHeadedBy(node).isPresent()) {
                chainHeads.add(node);
            } else {
                steps.add(node);
            }
        }

        // Expressions may feed the joined steps, so they go first.
        expressions.forEach(node -> emitSingle(node, indent));
        steps.forEach(node -> ensureExpressionDependencies(node, indent));

        if (steps.size() >= 2) {
            emitPromiseAll(steps, indent);
            for (String node : steps) {
                if (analysis.isBranching(node)) {
                    emitBranchingBody(node, indent);
                }
                index.typeOf(node).ifPresent(type -> emitScopes(node, type, indent));
            }
        } else {
            steps.forEach(node -> emitSingle(node, indent));
        }
        chainHeads.forEach(node -> emitSingle(node, indent));
    }

    private void emitSingle(String node, String indent) {
        if (generated.contains(node) || analysis.isChainMember(node)) {
            return;
        }
        Optional<NodeType> resolved = index.typeOf(node);
        if (resolved.isEmpty()) {
            return;
        }
        NodeType type = resolved.get();

        ensureExpressionDependencies(node, indent);
        generated.add(node);

        Optional<BranchingChain> chain = analysis.flattenedChainHeadedBy(node);
        if (chain.isPresent()) {
            emitChain(chain.get().nodes(), indent);
            return;
        }

        emitNodeCall(node, type, indent);
        if (analysis.isBranching(node)) {
            emitBranchingBody(node, indent);
        }
        emitScopes(node, type, indent);
    }

    private void ensureExpressionDependencies(String node, String indent) {
        for (Connection conn : index.incoming(node)) {
            String source = conn.from().node();
            if (conn.isScoped()
                    || ReservedNames.isVirtualNode(source)
                    || generated.contains(source)) {
                continue;
            }
            Optional<NodeType> type = index.typeOf(source);
            if (type.isEmpty() || !type.get().isExpression()) {
                continue;
            }
            ensureExpressionDependencies(source, indent);
            if (generated.add(source)) {
                emitNodeCall(source, type.get(), indent);
            }
        }
    }

    // -- node calls --

    private void emitNodeCall(String node, NodeType type, String indent) {
        if (!production) {
            lines.add(indent + "// " + node + " (" + type.getFunctionName() + ")");
        }
        String safeId = toValidIdentifier(node);
        Optional<BuiltInNode> builtIn = BuiltInNode.resolve(type);
        List<String> args = arguments.arguments(node, type);

        if (builtIn.isPresent()) {
            stepIds.add(node);
            switch (builtIn.get()) {
                case DELAY -> lines.add(indent + "await step.sleep('" + node + "', " + arg(args, 1) + ");");
                case WAIT_FOR_EVENT -> emitWaitForEvent(node, safeId, args, indent);
                case WAIT_FOR_AGENT -> emitWaitForAgent(node, safeId, args, indent);
                case INVOKE_WORKFLOW -> emitInvoke(node, safeId, args, indent);
            }
        } else if (type.isExpression()) {
            lines.add(indent + safeId + "_result = " + awaitPrefix(type) + call(type, args) + ";");
        } else {
            stepIds.add(node);
            lines.add(indent + safeId + "_result = await step.run('" + node + "', async () => {");
            lines.add(indent + STEP + "return " + awaitPrefix(type) + call(type, args) + ";");
            lines.add(indent + "});");
        }
        lines.add("");
    }

    private void emitWaitForEvent(String node, String safeId, List<String> args, String indent) {
        lines.add(indent + "const " + safeId + "_raw = await step.waitForEvent('" + node + "', {");
        lines.add(indent + STEP + "event: " + arg(args, 1) + ",");
        if (isDefined(arg(args, 2))) {
            lines.add(indent + STEP + "match: " + arg(args, 2) + ",");
        }
        if (isDefined(arg(args, 3))) {
            lines.add(indent + STEP + "timeout: " + arg(args, 3) + ",");
        }
        lines.add(indent + "});");
        lines.add(indent + safeId + "_result = " + safeId + "_raw");
        lines.add(indent + STEP + "? { onSuccess: true, onFailure: false, eventData: " + safeId + "_raw.data }");
        lines.add(indent + STEP + ": { onSuccess: false, onFailure: true, eventData: {} };");
    }

    private void emitWaitForAgent(String node, String safeId, List<String> args, String indent) {
        lines.add(indent + "const " + safeId + "_raw = await step.waitForEvent('" + node + "', {");
        lines.add(indent + STEP + "event: `agent/${" + arg(args, 1) + "}`,");
        lines.add(indent + STEP + "timeout: '7d',");
        lines.add(indent + "});");
        lines.add(indent + safeId + "_result = " + safeId + "_raw");
        lines.add(indent + STEP + "? { onSuccess: true, onFailure: false, agentResult: " + safeId + "_raw.data ?? {} }");
        lines.add(indent + STEP + ": { onSuccess: false, onFailure: true, agentResult: {} };");
    }

    private void emitInvoke(String node, String safeId, List<String> args, String indent) {
        lines.add(indent + "try {");
        lines.add(indent + STEP + safeId + "_result = await step.invoke('" + node + "', {");
        lines.add(indent + STEP + STEP + "function: " + arg(args, 1) + ",");
        lines.add(indent + STEP + STEP + "data: " + arg(args, 2) + ",");
        if (isDefined(arg(args, 3))) {
            lines.add(indent + STEP + STEP + "timeout: " + arg(args, 3) + ",");
        }
        lines.add(indent + STEP + "});");
        lines.add(indent + STEP + safeId + "_result = { onSuccess: true, onFailure: false, result: " + safeId + "_result };");
        lines.add(indent + "} catch (err) {");
        lines.add(indent + STEP + safeId + "_result = { onSuccess: false, onFailure: true, result: {} };");
        lines.add(indent + "}");
    }

    // -- parallel join --

    /// Joins durable steps with `Promise.all`. Delays produce no value and run
    /// sequentially before the join. Expression nodes never reach the join.
    private void emitPromiseAll(List<String> nodes, String indent) {
        List<String> joined = new ArrayList<>();
        for (String node : nodes) {
            NodeType type = index.typeOf(node).orElseThrow();
            generated.add(node);
            if (BuiltInNode.isDelay(type)) {
                emitNodeCall(node, type, indent);
            } else {
                joined.add(node);
            }
        }
        if (joined.size() == 1) {
            String node = joined.get(0);
            emitNodeCall(node, index.typeOf(node).orElseThrow(), indent);
            return;
        }
        if (joined.isEmpty()) {
            return;
        }

        List<String> targets = new ArrayList<>();
        List<String> calls = new ArrayList<>();
        for (String node : joined) {
            NodeType type = index.typeOf(node).orElseThrow();
            if (!production) {
                lines.add(indent + "// " + node + " (" + type.getFunctionName() + ")");
            }
            targets.add(toValidIdentifier(node) + "_result");
            calls.add(indent + STEP + joinedCall(node, type));
        }
        lines.add(indent + "[" + String.join(", ", targets) + "] = await Promise.all([");
        lines.add(String.join(",\n", calls));
        lines.add(indent + "]);");
        lines.add("");
    }

    private String joinedCall(String node, NodeType type) {
        List<String> args = arguments.arguments(node, type);
        Optional<BuiltInNode> builtIn = BuiltInNode.resolve(type);
        if (builtIn.isPresent()) {
            stepIds.add(node);
            StringBuilder call = new StringBuilder();
            switch (builtIn.get()) {
                case WAIT_FOR_EVENT -> {
                    call.append("step.waitForEvent('").append(node).append("', { event: ").append(arg(args, 1));
                    appendIfDefined(call, "match", arg(args, 2));
                    appendIfDefined(call, "timeout", arg(args, 3));
                }
                case WAIT_FOR_AGENT -> call.append("step.waitForEvent('").append(node)
                        .append("', { event: `agent/${").append(arg(args, 1)).append("}`, timeout: '7d'");
                case INVOKE_WORKFLOW -> {
                    call.append("step.invoke('").append(node).append("', { function: ").append(arg(args, 1))
                            .append(", data: ").append(arg(args, 2));
                    appendIfDefined(call, "timeout", arg(args, 3));
                }
                case DELAY -> throw new IllegalStateException("Delay step cannot be joined: " + node);
            }
            return call.append(" })").toString();
        }
        stepIds.add(node);
        return "step.run('" + node + "', async () => " + awaitPrefix(type) + call(type, args) + ")";
    }

    // -- branching --

    private void emitBranchingBody(String node, String indent) {
        Optional<BranchRegion> found = analysis.region(node);
        if (found.isEmpty() || found.get().isEmpty()) {
            return;
        }
        BranchRegion region = found.get();
        if (isDelay(node)) {
            // step.sleep always succeeds
            emitBlock(analysis.orderSubset(region.successNodes()), indent);
            return;
        }
        emitIfElse(node, region, indent);
    }

    private void emitIfElse(String node, BranchRegion region, String indent) {
        lines.add(indent + "if (" + toValidIdentifier(node) + "_result.onSuccess) {");
        emitBlock(analysis.orderSubset(region.successNodes()), indent + STEP);
        if (!region.failureNodes().isEmpty()) {
            lines.add(indent + "} else {");
            emitBlock(analysis.orderSubset(region.failureNodes()), indent + STEP);
        }
        lines.add(indent + "}");
    }

    /// Emits a flattened chain. The off-chain side of each link is guarded in
    /// place; built-in successors ignore the execute flag and get an explicit
    /// guard around the rest of the chain.
    private void emitChain(List<String> chain, String indent) {
        for (int i = 0; i < chain.size(); i++) {
            String node = chain.get(i);
            String safeId = toValidIdentifier(node);

            ensureExpressionDependencies(node, indent);
            generated.add(node);
            Optional<NodeType> type = index.typeOf(node);
            type.ifPresent(t -> emitNodeCall(node, t, indent));

            Optional<BranchRegion> found = analysis.region(node);
            if (found.isEmpty() || found.get().isEmpty()) {
                continue;
            }
            BranchRegion region = found.get();

            if (i == chain.size() - 1) {
                if (isDelay(node)) {
                    emitBlock(analysis.orderSubset(region.successNodes()), indent);
                } else {
                    emitIfElse(node, region, indent);
                }
                continue;
            }

            String next = chain.get(i + 1);
            boolean viaSuccess = region.successNodes().contains(next);
            boolean viaFailure = region.failureNodes().contains(next);
            if (!viaSuccess && !viaFailure) {
                continue;
            }
            Set<String> offChain = viaSuccess ? region.failureNodes() : region.successNodes();
            String offGuard = viaSuccess ? "!" + safeId + "_result.onSuccess" : safeId + "_result.onSuccess";
            String onGuard = viaSuccess ? safeId + "_result.onSuccess" : "!" + safeId + "_result.onSuccess";

            if (!offChain.isEmpty()) {
                lines.add(indent + "if (" + offGuard + ") {");
                emitBlock(analysis.orderSubset(offChain), indent + STEP);
                lines.add(indent + "}");
            }
            if (index.typeOf(next).flatMap(BuiltInNode::resolve).isPresent()) {
                lines.add(indent + "if (" + onGuard + ") {");
                emitChain(chain.subList(i + 1, chain.size()), indent + STEP);
                lines.add(indent + "}");
                return;
            }
        }
    }

    // -- scopes --

    private void emitScopes(String node, NodeType type, String indent) {
        boolean hasScopedChildren =
                index.workflow().getInstances().stream()
                        .anyMatch(
                                child ->
                                        child.hasParent()
                                                && child.parent().id().equals(node)
                                                && index.isPerPortScopedChild(child.id()));
        if (!hasScopedChildren) {
            return;
        }
        for (String scope : type.scopeNames()) {
            emitScope(node, type, scope, indent);
        }
    }

    /// Emits the children of one scope. With an item output the children run
    /// once per item, keyed by the loop index so a resumed run skips finished
    /// iterations.
    private void emitScope(String parent, NodeType parentType, String scope, String indent) {
        List<NodeInstance> children = index.childrenOf(parent, scope);
        if (children.isEmpty()) {
            return;
        }
        String safeParent = toValidIdentifier(parent);
        Optional<String> itemPort = itemPort(parentType, scope);

        if (itemPort.isEmpty()) {
            lines.add(indent + "// Scope '" + scope + "' for " + parent + " (callback pattern)");
            for (NodeInstance child : children) {
                Optional<NodeType> childType = index.typeOf(child.id());
                if (childType.isEmpty()) {
                    continue;
                }
                List<String> args = arguments.arguments(child.id(), childType.get());
                stepIds.add(child.id());
                lines.add(indent + "const " + toValidIdentifier(child.id()) + "_result = await step.run('"
                        + child.id() + "', async () => {");
                lines.add(indent + STEP + "return " + awaitPrefix(childType.get()) + call(childType.get(), args) + ";");
                lines.add(indent + "});");
                lines.add("");
            }
            return;
        }

        String items = safeParent + "_result." + itemPort.get();
        String results = safeParent + "_" + scope + "_results";
        lines.add(indent + "const " + results + " = [];");
        lines.add(indent + "for (let __i__ = 0; __i__ < " + items + ".length; __i__++) {");
        lines.add(indent + STEP + "const " + ArgumentResolver.LOOP_ITEM + " = " + items + "[__i__];");
        for (NodeInstance child : children) {
            Optional<NodeType> childType = index.typeOf(child.id());
            if (childType.isEmpty()) {
                continue;
            }
            NodeType t = childType.get();
            String safeChild = toValidIdentifier(child.id());
            List<String> args = arguments.loopArguments(child.id(), t, parent, itemPort.get());
            if (t.isExpression()) {
                lines.add(indent + STEP + "const " + safeChild + "_result = " + awaitPrefix(t) + call(t, args) + ";");
            } else {
                stepIds.add(child.id() + "-${__i__}");
                lines.add(indent + STEP + "const " + safeChild + "_result = await step.run(`"
                        + child.id() + "-${__i__}`, async () => {");
                lines.add(indent + STEP + STEP + "return " + awaitPrefix(t) + call(t, args) + ";");
                lines.add(indent + STEP + "});");
            }
            lines.add(indent + STEP + results + ".push(" + safeChild + "_result);");
        }
        lines.add(indent + "}");
        lines.add("");
    }

    private static Optional<String> itemPort(NodeType type, String scope) {
        for (Map.Entry<String, PortDefinition> output : type.getOutputs().entrySet()) {
            if (scope.equals(output.getValue().getScope())
                    && !ReservedNames.SCOPED_CONTROL_PORTS.contains(output.getKey())) {
                return Optional.of(output.getKey());
            }
        }
        return Optional.empty();
    }

    // -- helpers --

    private boolean isExpression(String node) {
        return index.typeOf(node).map(NodeType::isExpression).orElse(false);
    }

    private boolean isDelay(String node) {
        return index.typeOf(node).map(BuiltInNode::isDelay).orElse(false);
    }

    private static String call(NodeType type, List<String> args) {
        return type.getFunctionName() + "(" + String.join(", ", args) + ")";
    }

    private static String awaitPrefix(NodeType type) {
        return type.isAsync() ? "await " : "";
    }

    private static String arg(List<String> args, int position) {
        return position < args.size() ? args.get(position) : "undefined";
    }

    private static boolean isDefined(String arg) {
        return !"undefined".equals(arg);
    }

    private static void appendIfDefined(StringBuilder call, String key, String value) {
        if (isDefined(value)) {
            call.append(", ").append(key).append(": ").append(value);
        }
    }
}

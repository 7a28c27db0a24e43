package io.weft.core.analysis;

import io.weft.core.workflow.ReservedNames;
import io.weft.core.workflow.Workflow;
import io.weft.core.workflow.WorkflowIndex;
import io.weft.core.workflow.connection.Connection;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Derives execution order, branch regions and branching chains from a workflow.
///
/// The analyzer expects a workflow that passed validation, at least in draft
/// mode. It does not report diagnostics.
///
/// ### Stages
/// 1. Build the {@link ControlFlowGraph} and order it topologically
/// 2. Find branching nodes: `onSuccess`/`onFailure` wired to something other than `Exit`
/// 3. Compute each branching node's success and failure regions
/// 4. Remove shared nodes from every region
/// 5. Link branching nodes into chains
///
/// ### Contracts
/// - **Determinism**: analyzing the same workflow twice yields equal results
/// - **Scope isolation**: per-port scoped children never appear in the analysis
///
/// @implNote Stateless and thread-safe. Each call owns its traversal state.
public final class ControlFlowAnalyzer {

    private static final Logger logger = Logger.getLogger(ControlFlowAnalyzer.class.getName());

    /// Analyzes a workflow.
    ///
    /// @param workflow validated workflow, not null
    /// @return analysis, never null
    /// @throws CircularDependencyException if the graph contains a cycle
    public ControlFlowAnalysis analyze(Workflow workflow) {
        Objects.requireNonNull(workflow, "workflow must not be null");
        return analyze(WorkflowIndex.of(workflow));
    }

    /// Analyzes an already indexed workflow.
    ///
    /// @param index workflow index, not null
    /// @return analysis, never null
    /// @throws CircularDependencyException if the graph contains a cycle
    public ControlFlowAnalysis analyze(WorkflowIndex index) {
        ControlFlowGraph graph = ControlFlowGraph.build(index);
        List<String> order = graph.topologicalOrder();

        Set<String> branching = findBranchingNodes(index, graph);
        Map<String, BranchRegion> regions = computeRegions(index, graph, branching);
        List<BranchingChain> chains = detectChains(branching, regions);

        ControlFlowAnalysis analysis =
                new ControlFlowAnalysis(graph, order, branching, regions, chains);
        logger.fine(
                () ->
                        "Analyzed workflow '"
                                + index.workflow().getName()
                                + "': "
                                + order.size()
                                + " node(s), "
                                + branching.size()
                                + " branching, "
                                + chains.size()
                                + " chain(s), top level "
                                + analysis.topLevelNodes());
        return analysis;
    }

    private static Set<String> findBranchingNodes(WorkflowIndex index, ControlFlowGraph graph) {
        Set<String> branching = new LinkedHashSet<>();
        for (String node : graph.nodes()) {
            if (ReservedNames.isVirtualNode(node)) {
                continue;
            }
            for (Connection conn : index.outgoing(node)) {
                if (ReservedNames.isBranchPort(conn.from().port())
                        && !conn.isScoped()
                        && !ReservedNames.isExit(conn.to().node())) {
                    branching.add(node);
                    break;
                }
            }
        }
        return branching;
    }

    private static Map<String, BranchRegion> computeRegions(
            WorkflowIndex index, ControlFlowGraph graph, Set<String> branching) {
        Map<String, Set<String>> success = new LinkedHashMap<>();
        Map<String, Set<String>> failure = new LinkedHashMap<>();
        for (String node : branching) {
            success.put(node, reach(node, BranchDirection.SUCCESS, index, graph, branching));
            failure.put(node, reach(node, BranchDirection.FAILURE, index, graph, branching));
        }

        Set<String> shared = new HashSet<>();
        Map<String, Integer> regionCount = new HashMap<>();
        for (String node : branching) {
            Set<String> both = new HashSet<>(success.get(node));
            both.retainAll(failure.get(node));
            shared.addAll(both);

            Set<String> union = new HashSet<>(success.get(node));
            union.addAll(failure.get(node));
            union.forEach(member -> regionCount.merge(member, 1, Integer::sum));
        }
        regionCount.forEach((member, count) -> {
            if (count > 1) {
                shared.add(member);
            }
        });

        Map<String, BranchRegion> regions = new LinkedHashMap<>();
        for (String node : branching) {
            success.get(node).removeAll(shared);
            failure.get(node).removeAll(shared);
            regions.put(node, new BranchRegion(node, success.get(node), failure.get(node)));
        }
        return regions;
    }

    /// Breadth-first walk from one outcome port of a branching node.
    ///
    /// Other branching nodes are included but not expanded. Only data and
    /// non-outcome outputs are followed past the first hop.
    private static Set<String> reach(
            String origin,
            BranchDirection direction,
            WorkflowIndex index,
            ControlFlowGraph graph,
            Set<String> branching) {
        Set<String> reachable = new LinkedHashSet<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (Connection conn : index.outgoing(origin)) {
            if (conn.from().port().equals(direction.port()) && !conn.isScoped()) {
                queue.add(conn.to().node());
            }
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (ReservedNames.isVirtualNode(current)
                    || current.equals(origin)
                    || !visited.add(current)
                    || !graph.contains(current)) {
                continue;
            }
            reachable.add(current);
            if (branching.contains(current)) {
                continue;
            }
            for (Connection conn : index.outgoing(current)) {
                if (!conn.isScoped()
                        && !ReservedNames.isBranchPort(conn.from().port())
                        && !visited.contains(conn.to().node())) {
                    queue.add(conn.to().node());
                }
            }
        }
        return reachable;
    }

    private static List<BranchingChain> detectChains(
            Set<String> branching, Map<String, BranchRegion> regions) {
        Map<String, String> next = new LinkedHashMap<>();
        Map<String, BranchDirection> via = new HashMap<>();
        for (String node : branching) {
            BranchRegion region = regions.get(node);
            List<String> successBranching = branchingIn(region.successNodes(), branching);
            List<String> failureBranching = branchingIn(region.failureNodes(), branching);
            // A link needs the continue side to hold exactly the next branching node.
            if (successBranching.size() == 1
                    && failureBranching.isEmpty()
                    && region.successNodes().size() == 1) {
                next.put(node, successBranching.get(0));
                via.put(node, BranchDirection.SUCCESS);
            } else if (failureBranching.size() == 1
                    && successBranching.isEmpty()
                    && region.failureNodes().size() == 1) {
                next.put(node, failureBranching.get(0));
                via.put(node, BranchDirection.FAILURE);
            }
        }

        Set<String> linkedTo = new HashSet<>(next.values());
        List<BranchingChain> chains = new ArrayList<>();
        Set<String> chained = new HashSet<>();
        for (String head : branching) {
            if (linkedTo.contains(head) || !next.containsKey(head)) {
                continue;
            }
            List<String> nodes = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            String current = head;
            while (current != null && seen.add(current)) {
                nodes.add(current);
                current = next.get(current);
            }
            chains.add(new BranchingChain(nodes, via.get(head)));
            chained.addAll(nodes);
        }

        for (String node : branching) {
            if (chained.contains(node)) {
                continue;
            }
            BranchRegion region = regions.get(node);
            boolean hasSuccess = !region.successNodes().isEmpty();
            boolean hasFailure = !region.failureNodes().isEmpty();
            if (hasSuccess != hasFailure) {
                BranchDirection direction =
                        hasSuccess ? BranchDirection.SUCCESS : BranchDirection.FAILURE;
                chains.add(new BranchingChain(List.of(node), direction));
            }
        }
        return chains;
    }

    private static List<String> branchingIn(Set<String> nodes, Set<String> branching) {
        return nodes.stream().filter(branching::contains).toList();
    }
}

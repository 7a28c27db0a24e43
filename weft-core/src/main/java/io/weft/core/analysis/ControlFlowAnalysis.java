package io.weft.core.analysis;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Result of analyzing the control flow of one workflow.
///
/// Consumed by code generators. Holds ids only; node types and instances are
/// looked up through the workflow index.
///
/// @implNote Immutable and thread-safe.
///
/// @see ControlFlowAnalyzer
public final class ControlFlowAnalysis {

    private final ControlFlowGraph graph;
    private final List<String> executionOrder;
    private final Set<String> branchingNodes;
    private final Map<String, BranchRegion> regions;
    private final List<BranchingChain> chains;
    private final Set<String> chainMembers;
    private final List<String> topLevelNodes;

    ControlFlowAnalysis(
            ControlFlowGraph graph,
            List<String> executionOrder,
            Set<String> branchingNodes,
            Map<String, BranchRegion> regions,
            List<BranchingChain> chains) {
        this.graph = graph;
        this.executionOrder = List.copyOf(executionOrder);
        this.branchingNodes = Collections.unmodifiableSet(new LinkedHashSet<>(branchingNodes));
        this.regions = Collections.unmodifiableMap(new LinkedHashMap<>(regions));
        this.chains = List.copyOf(chains);

        Set<String> members = new LinkedHashSet<>();
        for (BranchingChain chain : chains) {
            if (chain.flattened()) {
                members.addAll(chain.nodes().subList(1, chain.nodes().size()));
            }
        }
        this.chainMembers = Collections.unmodifiableSet(members);

        Set<String> guarded = new HashSet<>();
        regions.values().forEach(region -> {
            guarded.addAll(region.successNodes());
            guarded.addAll(region.failureNodes());
        });
        this.topLevelNodes =
                executionOrder.stream()
                        .filter(node -> !guarded.contains(node) && !members.contains(node))
                        .toList();
    }

    public ControlFlowGraph graph() {
        return graph;
    }

    /// @return instance ids in topological order, without `Start` and `Exit`
    public List<String> executionOrder() {
        return executionOrder;
    }

    /// @return branching instance ids in declaration order, never null
    public Set<String> branchingNodes() {
        return branchingNodes;
    }

    public boolean isBranching(String node) {
        return branchingNodes.contains(node);
    }

    /// @return region per branching node, in declaration order, never null
    public Map<String, BranchRegion> regions() {
        return regions;
    }

    public Optional<BranchRegion> region(String node) {
        return Optional.ofNullable(regions.get(node));
    }

    /// @return flattened chains followed by single-element chains, never null
    public List<BranchingChain> chains() {
        return chains;
    }

    /// Returns the flattened chain headed by the node.
    ///
    /// @param node instance id, not null
    /// @return the chain, or empty if the node heads no chain of two or more
    public Optional<BranchingChain> flattenedChainHeadedBy(String node) {
        return chains.stream()
                .filter(chain -> chain.flattened() && chain.head().equals(node))
                .findFirst();
    }

    /// @return non-head members of flattened chains, emitted by their head
    public Set<String> chainMembers() {
        return chainMembers;
    }

    public boolean isChainMember(String node) {
        return chainMembers.contains(node);
    }

    /// @return nodes outside every branch region and chain, in execution order
    public List<String> topLevelNodes() {
        return topLevelNodes;
    }

    /// Orders a subset of nodes by the full execution order.
    ///
    /// @param nodes node ids, not null
    /// @return the ids that appear in the execution order, in that order
    public List<String> orderSubset(Collection<String> nodes) {
        Set<String> wanted = new HashSet<>(nodes);
        return executionOrder.stream().filter(wanted::contains).toList();
    }
}

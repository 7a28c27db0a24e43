package io.weft.core.analysis;

import java.util.List;
import java.util.Objects;

/// Sequence of branching nodes where each node continues into the next through
/// one outcome while the other outcome holds no branching node.
///
/// Chains of two or more nodes are flattened into one `if`/`else if` ladder.
/// A single-element chain records a branching node that guards nodes on one
/// side only.
///
/// @param nodes chain members, head first, not empty
/// @param direction outcome through which the head continues, not null
public record BranchingChain(List<String> nodes, BranchDirection direction) {

    public BranchingChain {
        nodes = List.copyOf(nodes);
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("Chain must contain at least one node");
        }
        Objects.requireNonNull(direction, "direction");
    }

    public String head() {
        return nodes.get(0);
    }

    /// @return `true` if the generator emits the chain as a flat ladder
    public boolean flattened() {
        return nodes.size() >= 2;
    }
}

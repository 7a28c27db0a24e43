package io.weft.core.workflow.node;

/// Strategy deciding when a node with several STEP inputs fires.
public enum ExecuteWhen {
    /// Fire once all connected control inputs have fired.
    CONJUNCTION,
    /// Fire as soon as any connected control input fires.
    DISJUNCTION,
    /// The node decides itself.
    CUSTOM
}

package io.weft.core.workflow.node;

/// Kind of implementation behind a node type.
public enum NodeVariant {
    /// Plain function implemented in user code.
    FUNCTION,
    /// Another workflow used as a node.
    WORKFLOW,
    /// Declared but not yet implemented. Rejected unless validating in draft mode.
    STUB
}

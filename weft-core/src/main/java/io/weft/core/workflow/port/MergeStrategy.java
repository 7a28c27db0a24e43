package io.weft.core.workflow.port;

/// Strategy for combining several inbound connections on one input port.
///
/// Declaring a merge strategy on a port lifts the single-writer restriction that
/// otherwise applies to non-STEP inputs.
public enum MergeStrategy {
    /// Use the first value that is not `undefined`, in connection order.
    FIRST,

    /// Use the last value that is not `undefined`, in connection order.
    LAST,

    /// Collect all values into an array, including `undefined` entries.
    COLLECT,

    /// Shallow-merge object values. Later writers override earlier keys.
    MERGE,

    /// Concatenate array values into one flat array.
    CONCAT
}

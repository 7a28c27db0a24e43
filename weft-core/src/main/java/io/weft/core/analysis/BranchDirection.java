package io.weft.core.analysis;

import io.weft.core.workflow.ReservedNames;

/// Outcome port of a branching node.
public enum BranchDirection {
    SUCCESS(ReservedNames.ON_SUCCESS),
    FAILURE(ReservedNames.ON_FAILURE);

    private final String port;

    BranchDirection(String port) {
        this.port = port;
    }

    /// @return output port name, `onSuccess` or `onFailure`
    public String port() {
        return port;
    }
}

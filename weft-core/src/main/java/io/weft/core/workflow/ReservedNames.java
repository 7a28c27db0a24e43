package io.weft.core.workflow;

import java.util.List;

/// Reserved node and port names shared by the validator, analyzer and generator.
///
/// `Start` and `Exit` are virtual nodes representing the workflow's input and output
/// interface. They never appear in `Workflow.getInstances()`.
public final class ReservedNames {

    public static final String START = "Start";
    public static final String EXIT = "Exit";

    public static final String EXECUTE = "execute";
    public static final String ON_SUCCESS = "onSuccess";
    public static final String ON_FAILURE = "onFailure";

    /// Port names that scoped callbacks use for control flow rather than data.
    public static final List<String> SCOPED_CONTROL_PORTS = List.of("start", "success", "failure");

    public static final List<String> NODE_NAMES = List.of(START, EXIT);

    private ReservedNames() {}

    public static boolean isStart(String node) {
        return START.equals(node);
    }

    public static boolean isExit(String node) {
        return EXIT.equals(node);
    }

    /// @return `true` for `Start` or `Exit`
    public static boolean isVirtualNode(String node) {
        return isStart(node) || isExit(node);
    }

    /// @return `true` for `onSuccess` or `onFailure`
    public static boolean isBranchPort(String port) {
        return ON_SUCCESS.equals(port) || ON_FAILURE.equals(port);
    }
}

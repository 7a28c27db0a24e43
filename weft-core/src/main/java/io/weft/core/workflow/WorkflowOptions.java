package io.weft.core.workflow;

/// Workflow-level options declared alongside the graph.
///
/// Runtime settings (`retries`, `timeout`, `throttle`, `cancelOn`, `trigger`) are
/// not interpreted by the compiler; they are embedded verbatim in the generated
/// function configuration.
///
/// @param strictTypes promote type-compatibility warnings to errors
/// @param retries retry count for the generated function, null to use the
///     generation default
/// @param timeout finish timeout such as `"1h"`, may be null
/// @param throttle throttle settings, may be null
/// @param cancelOn cancellation event, may be null
/// @param trigger trigger override, may be null
public record WorkflowOptions(
        boolean strictTypes,
        Integer retries,
        String timeout,
        Throttle throttle,
        CancelOn cancelOn,
        Trigger trigger) {

    /// Options with every field unset.
    public static WorkflowOptions defaults() {
        return new WorkflowOptions(false, null, null, null, null, null);
    }

    /// @param limit maximum runs per period
    /// @param period period such as `"1m"`, may be null
    public record Throttle(int limit, String period) {}

    /// @param event event name that cancels a running function, not null
    /// @param match field expression matched between trigger and cancel events, may be null
    /// @param timeout how long the cancel listener stays active, may be null
    public record CancelOn(String event, String match, String timeout) {}

    /// @param event trigger event name, may be null
    /// @param cron cron schedule, may be null
    public record Trigger(String event, String cron) {}
}

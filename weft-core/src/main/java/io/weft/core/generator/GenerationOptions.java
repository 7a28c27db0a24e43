package io.weft.core.generator;

import io.weft.core.workflow.WorkflowOptions.CancelOn;
import io.weft.core.workflow.WorkflowOptions.Throttle;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Options for one {@link CodeGenerator#generate} call.
///
/// Workflow-level options take precedence: a workflow that declares `retries`,
/// `timeout`, `throttle` or `cancelOn` overrides the value set here.
///
/// ### Default Values
/// - `production`: `false` (debug comments are emitted)
/// - `serviceName`: kebab-case function name of the workflow
/// - `triggerEvent`: `weft/<kebab-function-name>.execute`
/// - `retries`: {@value #DEFAULT_RETRIES}
/// - `typedEvents`, `serveHandler`: `false`
///
/// @implNote Immutable and thread-safe.
public final class GenerationOptions {

    public static final int DEFAULT_RETRIES = 3;

    private static final GenerationOptions DEFAULTS = builder().build();

    private final boolean production;
    private final String serviceName;
    private final String triggerEvent;
    private final int retries;
    private final String timeout;
    private final Throttle throttle;
    private final CancelOn cancelOn;
    private final Map<String, Object> functionConfig;
    private final boolean typedEvents;
    private final ServeFramework framework;
    private final boolean serveHandler;

    private GenerationOptions(Builder builder) {
        if (builder.retries < 0) {
            throw new IllegalArgumentException("retries must not be negative: " + builder.retries);
        }
        this.production = builder.production;
        this.serviceName = builder.serviceName;
        this.triggerEvent = builder.triggerEvent;
        this.retries = builder.retries;
        this.timeout = builder.timeout;
        this.throttle = builder.throttle;
        this.cancelOn = builder.cancelOn;
        this.functionConfig =
                Collections.unmodifiableMap(new LinkedHashMap<>(builder.functionConfig));
        this.typedEvents = builder.typedEvents;
        this.framework = builder.framework;
        this.serveHandler = builder.serveHandler;
    }

    public static GenerationOptions defaults() {
        return DEFAULTS;
    }

    public boolean isProduction() {
        return production;
    }

    /// @return client id override, or null to derive it from the workflow
    public String getServiceName() {
        return serviceName;
    }

    /// @return trigger event override, or null to derive it from the workflow
    public String getTriggerEvent() {
        return triggerEvent;
    }

    public int getRetries() {
        return retries;
    }

    public String getTimeout() {
        return timeout;
    }

    public Throttle getThrottle() {
        return throttle;
    }

    public CancelOn getCancelOn() {
        return cancelOn;
    }

    /// @return extra entries for the function configuration, never null
    public Map<String, Object> getFunctionConfig() {
        return functionConfig;
    }

    public boolean isTypedEvents() {
        return typedEvents;
    }

    /// @return serve framework, or null if none is selected
    public ServeFramework getFramework() {
        return framework;
    }

    public boolean isServeHandler() {
        return serveHandler;
    }

    /// @return `true` if a serve entrypoint is appended
    public boolean emitsServeHandler() {
        return serveHandler && framework != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link GenerationOptions}.
    public static final class Builder {
        private boolean production;
        private String serviceName;
        private String triggerEvent;
        private int retries = DEFAULT_RETRIES;
        private String timeout;
        private Throttle throttle;
        private CancelOn cancelOn;
        private Map<String, Object> functionConfig = new LinkedHashMap<>();
        private boolean typedEvents;
        private ServeFramework framework;
        private boolean serveHandler;

        private Builder() {}

        /// Omits the header comment and per-node markers.
        ///
        /// @param production `true` for compact output
        /// @return this builder for chaining
        public Builder production(boolean production) {
            this.production = production;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder triggerEvent(String triggerEvent) {
            this.triggerEvent = triggerEvent;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder timeout(String timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder throttle(Throttle throttle) {
            this.throttle = throttle;
            return this;
        }

        public Builder cancelOn(CancelOn cancelOn) {
            this.cancelOn = cancelOn;
            return this;
        }

        /// Adds extra function configuration entries.
        ///
        /// Values are rendered as JSON. The keys `id` and `retries` are ignored.
        ///
        /// @param functionConfig entries in emission order, not null
        /// @return this builder for chaining
        public Builder functionConfig(Map<String, Object> functionConfig) {
            this.functionConfig = new LinkedHashMap<>(functionConfig);
            return this;
        }

        public Builder typedEvents(boolean typedEvents) {
            this.typedEvents = typedEvents;
            return this;
        }

        public Builder framework(ServeFramework framework) {
            this.framework = framework;
            return this;
        }

        public Builder serveHandler(boolean serveHandler) {
            this.serveHandler = serveHandler;
            return this;
        }

        public GenerationOptions build() {
            return new GenerationOptions(this);
        }
    }
}

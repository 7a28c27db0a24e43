package io.weft.core.validation;

import java.util.Objects;

/// Options for a single {@link WorkflowValidator#validate} call.
///
/// ### Default Values
/// - `strictMode`: `false` (type issues are warnings unless the workflow sets
///   `strictTypes`)
/// - `mode`: {@link ValidationMode#STRICT}
/// - `docsBaseUrl`: {@value #DEFAULT_DOCS_BASE_URL}
///
/// @implNote Immutable and thread-safe.
public final class ValidationOptions {

    public static final String DEFAULT_DOCS_BASE_URL = "https://weft.dev/docs/reference";

    private static final ValidationOptions DEFAULTS = builder().build();

    private final boolean strictMode;
    private final ValidationMode mode;
    private final String docsBaseUrl;

    private ValidationOptions(Builder builder) {
        this.strictMode = builder.strictMode;
        this.mode = Objects.requireNonNull(builder.mode, "Validation mode required");
        this.docsBaseUrl = Objects.requireNonNull(builder.docsBaseUrl, "Docs base URL required");
    }

    /// @return options with every default applied, never null
    public static ValidationOptions defaults() {
        return DEFAULTS;
    }

    /// @return options for draft validation, never null
    public static ValidationOptions draft() {
        return builder().mode(ValidationMode.DRAFT).build();
    }

    public boolean isStrictMode() {
        return strictMode;
    }

    public ValidationMode getMode() {
        return mode;
    }

    public boolean isDraft() {
        return mode == ValidationMode.DRAFT;
    }

    public String getDocsBaseUrl() {
        return docsBaseUrl;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link ValidationOptions}.
    public static final class Builder {
        private boolean strictMode;
        private ValidationMode mode = ValidationMode.STRICT;
        private String docsBaseUrl = DEFAULT_DOCS_BASE_URL;

        private Builder() {}

        /// Promotes type-compatibility warnings to errors for every workflow.
        ///
        /// @param strictMode `true` to treat type issues as errors
        /// @return this builder for chaining
        public Builder strictMode(boolean strictMode) {
            this.strictMode = strictMode;
            return this;
        }

        public Builder mode(ValidationMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder docsBaseUrl(String docsBaseUrl) {
            this.docsBaseUrl = docsBaseUrl;
            return this;
        }

        public ValidationOptions build() {
            return new ValidationOptions(this);
        }
    }
}

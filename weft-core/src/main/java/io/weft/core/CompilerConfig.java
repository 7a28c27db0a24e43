package io.weft.core;

import io.weft.core.generator.GenerationOptions;
import io.weft.core.generator.ServeFramework;
import io.weft.core.validation.ValidationMode;
import io.weft.core.validation.ValidationOptions;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/// Configuration for {@link WeftCompiler}: validation options plus generation options.
///
/// ### Default Values
/// - `validationOptions`: {@link ValidationOptions#defaults()}
/// - `generationOptions`: {@link GenerationOptions#defaults()}
///
/// ### Property keys
/// {@link #fromProperties(Properties)} reads:
/// - `weft.validation.mode`: `strict` or `draft`
/// - `weft.validation.strictTypes`: `true` to treat type issues as errors
/// - `weft.validation.docsBaseUrl`
/// - `weft.generation.production`, `weft.generation.serviceName`,
///   `weft.generation.triggerEvent`, `weft.generation.retries`,
///   `weft.generation.timeout`, `weft.generation.typedEvents`
/// - `weft.generation.framework`: `next`, `express`, `hono`, `fastify` or `remix`;
///   setting it also enables the serve entrypoint
///
/// @implNote Immutable and thread-safe.
///
/// @see WeftCompiler#create(CompilerConfig)
public final class CompilerConfig {

    public static final String PREFIX = "weft.";

    private static final CompilerConfig DEFAULTS = builder().build();

    private final ValidationOptions validationOptions;
    private final GenerationOptions generationOptions;

    private CompilerConfig(Builder builder) {
        this.validationOptions =
                Objects.requireNonNull(builder.validationOptions, "Validation options required");
        this.generationOptions =
                Objects.requireNonNull(builder.generationOptions, "Generation options required");
    }

    public static CompilerConfig defaults() {
        return DEFAULTS;
    }

    /// Builds a configuration from `weft.*` properties. Missing keys keep their
    /// defaults; unrelated keys are ignored.
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws IllegalArgumentException if a value cannot be parsed
    public static CompilerConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");

        ValidationOptions.Builder validation = ValidationOptions.builder();
        String mode = properties.getProperty(PREFIX + "validation.mode");
        if (mode != null) {
            validation.mode(ValidationMode.valueOf(mode.trim().toUpperCase(Locale.ROOT)));
        }
        validation.strictMode(flag(properties, "validation.strictTypes"));
        String docsBaseUrl = properties.getProperty(PREFIX + "validation.docsBaseUrl");
        if (docsBaseUrl != null) {
            validation.docsBaseUrl(docsBaseUrl.trim());
        }

        GenerationOptions.Builder generation = GenerationOptions.builder();
        generation.production(flag(properties, "generation.production"));
        generation.typedEvents(flag(properties, "generation.typedEvents"));
        generation.serviceName(properties.getProperty(PREFIX + "generation.serviceName"));
        generation.triggerEvent(properties.getProperty(PREFIX + "generation.triggerEvent"));
        generation.timeout(properties.getProperty(PREFIX + "generation.timeout"));
        String retries = properties.getProperty(PREFIX + "generation.retries");
        if (retries != null) {
            try {
                generation.retries(Integer.parseInt(retries.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid weft.generation.retries: " + retries, e);
            }
        }
        String framework = properties.getProperty(PREFIX + "generation.framework");
        if (framework != null) {
            generation.framework(ServeFramework.fromName(framework.trim())).serveHandler(true);
        }

        return builder().validationOptions(validation.build()).generationOptions(generation.build()).build();
    }

    private static boolean flag(Properties properties, String key) {
        return Boolean.parseBoolean(properties.getProperty(PREFIX + key, "false").trim());
    }

    public ValidationOptions getValidationOptions() {
        return validationOptions;
    }

    public GenerationOptions getGenerationOptions() {
        return generationOptions;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link CompilerConfig}.
    public static final class Builder {
        private ValidationOptions validationOptions = ValidationOptions.defaults();
        private GenerationOptions generationOptions = GenerationOptions.defaults();

        private Builder() {}

        public Builder validationOptions(ValidationOptions validationOptions) {
            this.validationOptions = validationOptions;
            return this;
        }

        public Builder generationOptions(GenerationOptions generationOptions) {
            this.generationOptions = generationOptions;
            return this;
        }

        public CompilerConfig build() {
            return new CompilerConfig(this);
        }
    }
}

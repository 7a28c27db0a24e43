package io.weft.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.weft.core.generator.GenerationOptions;
import io.weft.core.generator.ServeFramework;
import io.weft.core.validation.ValidationMode;
import io.weft.core.validation.ValidationOptions;
import java.util.Properties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CompilerConfig")
class CompilerConfigTest {

    @Test
    void shouldKeepDefaultsForEmptyProperties() {
        CompilerConfig config = CompilerConfig.fromProperties(new Properties());

        ValidationOptions validation = config.getValidationOptions();
        GenerationOptions generation = config.getGenerationOptions();
        assertThat(validation.getMode()).isEqualTo(ValidationMode.STRICT);
        assertThat(validation.isStrictMode()).isFalse();
        assertThat(validation.getDocsBaseUrl()).isEqualTo(ValidationOptions.DEFAULT_DOCS_BASE_URL);
        assertThat(generation.getRetries()).isEqualTo(GenerationOptions.DEFAULT_RETRIES);
        assertThat(generation.isProduction()).isFalse();
        assertThat(generation.emitsServeHandler()).isFalse();
    }

    @Test
    @DisplayName("reads every weft.* key and ignores unrelated ones")
    void shouldReadAllKeys() {
        // Given
        Properties properties = new Properties();
        properties.setProperty("weft.validation.mode", " draft ");
        properties.setProperty("weft.validation.strictTypes", "true");
        properties.setProperty("weft.validation.docsBaseUrl", "https://docs.example.com");
        properties.setProperty("weft.generation.production", "TRUE");
        properties.setProperty("weft.generation.typedEvents", "true");
        properties.setProperty("weft.generation.serviceName", "billing");
        properties.setProperty("weft.generation.triggerEvent", "billing/run");
        properties.setProperty("weft.generation.timeout", "30m");
        properties.setProperty("weft.generation.retries", "7");
        properties.setProperty("weft.generation.framework", "Hono");
        properties.setProperty("other.key", "ignored");

        // When
        CompilerConfig config = CompilerConfig.fromProperties(properties);

        // Then
        ValidationOptions validation = config.getValidationOptions();
        assertThat(validation.isDraft()).isTrue();
        assertThat(validation.isStrictMode()).isTrue();
        assertThat(validation.getDocsBaseUrl()).isEqualTo("https://docs.example.com");

        GenerationOptions generation = config.getGenerationOptions();
        assertThat(generation.isProduction()).isTrue();
        assertThat(generation.isTypedEvents()).isTrue();
        assertThat(generation.getServiceName()).isEqualTo("billing");
        assertThat(generation.getTriggerEvent()).isEqualTo("billing/run");
        assertThat(generation.getTimeout()).isEqualTo("30m");
        assertThat(generation.getRetries()).isEqualTo(7);
        assertThat(generation.getFramework()).isEqualTo(ServeFramework.HONO);
        assertThat(generation.emitsServeHandler()).isTrue();
    }

    @Test
    void shouldRejectNonNumericRetries() {
        Properties properties = new Properties();
        properties.setProperty("weft.generation.retries", "many");

        assertThatThrownBy(() -> CompilerConfig.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid weft.generation.retries: many")
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    void shouldRejectUnknownValidationMode() {
        Properties properties = new Properties();
        properties.setProperty("weft.validation.mode", "lenient");

        assertThatThrownBy(() -> CompilerConfig.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectMissingOptions() {
        CompilerConfig.Builder builder = CompilerConfig.builder().generationOptions(null);

        assertThatThrownBy(builder::build)
                .isInstanceOf(NullPointerException.class)
                .hasMessage("Generation options required");
    }
}

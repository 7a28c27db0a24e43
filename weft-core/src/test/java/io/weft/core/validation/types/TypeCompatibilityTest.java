package io.weft.core.validation.types;

import static org.assertj.core.api.Assertions.assertThat;

import io.weft.core.workflow.port.DataType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("TypeCompatibility")
class TypeCompatibilityTest {

    @ParameterizedTest(name = "{0} -> {1} is {2}")
    @CsvSource({
        "NUMBER, STRING, SAFE",
        "BOOLEAN, STRING, SAFE",
        "STRING, NUMBER, LOSSY",
        "STRING, BOOLEAN, LOSSY",
        "OBJECT, STRING, LOSSY",
        "ARRAY, STRING, LOSSY",
        "NUMBER, BOOLEAN, UNUSUAL",
        "BOOLEAN, NUMBER, UNUSUAL",
        "STRING, OBJECT, UNUSUAL",
        "STRING, ARRAY, UNUSUAL"
    })
    void shouldClassifyListedConversions(DataType from, DataType to, CoercionKind kind) {
        assertThat(TypeCompatibility.lookup(from, to))
                .hasValueSatisfying(c -> assertThat(c.kind()).isEqualTo(kind));
    }

    @Test
    void shouldExplainLossyStringToNumber() {
        assertThat(TypeCompatibility.lookup(DataType.STRING, DataType.NUMBER))
                .hasValueSatisfying(c -> assertThat(c.reason()).startsWith("May result in NaN"));
    }

    @Test
    void shouldNotListUnrelatedPairs() {
        assertThat(TypeCompatibility.lookup(DataType.OBJECT, DataType.NUMBER)).isEmpty();
        assertThat(TypeCompatibility.lookup(DataType.ARRAY, DataType.OBJECT)).isEmpty();
    }

    @Test
    void shouldTreatEqualAnyAndSafePairsAsAssignable() {
        assertThat(TypeCompatibility.isAssignable(DataType.STRING, DataType.STRING)).isTrue();
        assertThat(TypeCompatibility.isAssignable(DataType.ANY, DataType.NUMBER)).isTrue();
        assertThat(TypeCompatibility.isAssignable(DataType.NUMBER, DataType.STRING)).isTrue();
        assertThat(TypeCompatibility.isAssignable(DataType.STRING, DataType.NUMBER)).isFalse();
    }
}

package io.weft.core.workflow.connection;

import io.weft.core.workflow.port.DataType;
import java.util.Locale;

/// Explicit conversion applied to the value travelling over a connection.
public enum CoerceType {
    STRING(DataType.STRING),
    NUMBER(DataType.NUMBER),
    BOOLEAN(DataType.BOOLEAN),
    /// Serializes the value to a JSON string.
    JSON(DataType.STRING),
    /// Parses a JSON string into an object.
    OBJECT(DataType.OBJECT);

    private final DataType produces;

    CoerceType(DataType produces) {
        this.produces = produces;
    }

    /// Returns the data type the coercion yields.
    ///
    /// @return produced data type, never null
    public DataType produces() {
        return produces;
    }

    /// Returns the keyword used in diagnostics, e.g. `as number`.
    ///
    /// @return lowercase keyword, never null
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Suggests the coercion that produces the given target type.
    ///
    /// @param target data type expected by the target port, not null
    /// @return coercion keyword, or the lowercase type name when no coercion produces it
    public static String suggestFor(DataType target) {
        return switch (target) {
            case STRING -> STRING.keyword();
            case NUMBER -> NUMBER.keyword();
            case BOOLEAN -> BOOLEAN.keyword();
            case OBJECT -> OBJECT.keyword();
            default -> target.name().toLowerCase(Locale.ROOT);
        };
    }
}

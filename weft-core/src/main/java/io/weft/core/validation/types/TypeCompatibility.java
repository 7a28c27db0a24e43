package io.weft.core.validation.types;

import io.weft.core.workflow.port.DataType;
import java.util.List;
import java.util.Optional;

/// Fixed table of implicit conversions between distinct data types.
///
/// Pairs missing from the table are plain mismatches. Same-type, `ANY` and
/// `STEP` pairs are decided by the caller before the table is consulted.
public final class TypeCompatibility {

    private static final List<Coercion> TABLE =
            List.of(
                    new Coercion(DataType.NUMBER, DataType.STRING, CoercionKind.SAFE, null),
                    new Coercion(DataType.BOOLEAN, DataType.STRING, CoercionKind.SAFE, null),
                    new Coercion(
                            DataType.STRING,
                            DataType.NUMBER,
                            CoercionKind.LOSSY,
                            "May result in NaN if string is not a valid number"),
                    new Coercion(
                            DataType.STRING,
                            DataType.BOOLEAN,
                            CoercionKind.LOSSY,
                            "Will use JavaScript truthy/falsy conversion"),
                    new Coercion(
                            DataType.OBJECT,
                            DataType.STRING,
                            CoercionKind.LOSSY,
                            "Will use JSON.stringify()"),
                    new Coercion(
                            DataType.ARRAY,
                            DataType.STRING,
                            CoercionKind.LOSSY,
                            "Will use JSON.stringify()"),
                    new Coercion(
                            DataType.NUMBER,
                            DataType.BOOLEAN,
                            CoercionKind.UNUSUAL,
                            "Will use JavaScript truthy/falsy conversion (0 = false, non-zero = true)"),
                    new Coercion(
                            DataType.BOOLEAN,
                            DataType.NUMBER,
                            CoercionKind.UNUSUAL,
                            "Will convert false to 0, true to 1"),
                    new Coercion(
                            DataType.STRING,
                            DataType.OBJECT,
                            CoercionKind.UNUSUAL,
                            "May fail if string is not valid JSON"),
                    new Coercion(
                            DataType.STRING,
                            DataType.ARRAY,
                            CoercionKind.UNUSUAL,
                            "May fail if string is not valid JSON array"));

    private TypeCompatibility() {}

    /// Looks up the implicit conversion from one data type to another.
    ///
    /// @param from source data type, not null
    /// @param to target data type, not null
    /// @return the table entry, or empty for an unlisted pair
    public static Optional<Coercion> lookup(DataType from, DataType to) {
        for (Coercion coercion : TABLE) {
            if (coercion.from() == from && coercion.to() == to) {
                return Optional.of(coercion);
            }
        }
        return Optional.empty();
    }

    /// Returns whether a value of one type may flow into the other without any
    /// diagnostic: equal types, either side `ANY`, or a safe conversion.
    public static boolean isAssignable(DataType from, DataType to) {
        if (from == to || from == DataType.ANY || to == DataType.ANY) {
            return true;
        }
        return lookup(from, to).map(c -> c.kind() == CoercionKind.SAFE).orElse(false);
    }
}

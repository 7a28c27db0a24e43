package io.weft.core.validation.types;

import io.weft.core.workflow.port.DataType;
import java.util.Locale;
import java.util.regex.Pattern;

/// String-level handling of free-form structural type annotations.
///
/// The core never parses these types. Two annotations are compared after
/// normalization only.
public final class StructuralTypes {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern GENERIC_ARRAY = Pattern.compile("Array<(.+?)>");
    private static final Pattern TRAILING_SEMICOLON = Pattern.compile(";(?=[}\\]])");

    private StructuralTypes() {}

    /// Normalizes a structural type for comparison.
    ///
    /// Strips whitespace, rewrites `Array<T>` to `T[]`, drops `;` before a closing
    /// brace or bracket and lowercases the result.
    ///
    /// @param type structural type, not null
    /// @return normalized form, never null
    public static String normalize(String type) {
        String result = WHITESPACE.matcher(type).replaceAll("");
        result = GENERIC_ARRAY.matcher(result).replaceAll("$1[]");
        result = TRAILING_SEMICOLON.matcher(result).replaceAll("");
        return result.toLowerCase(Locale.ROOT);
    }

    /// Returns whether a value annotated `source` may flow into `target`.
    ///
    /// Compatible when both normalize to the same string, when either side is
    /// `any`, or for `number`/`boolean` flowing into `string`.
    ///
    /// @param source source annotation, not null
    /// @param target target annotation, not null
    /// @return `true` if no structural warning is needed
    public static boolean isCompatible(String source, String target) {
        String s = normalize(source);
        String t = normalize(target);
        if (s.equals(t) || s.equals("any") || t.equals("any")) {
            return true;
        }
        return t.equals("string") && (s.equals("number") || s.equals("boolean"));
    }

    /// Formats a port type for messages: `tsType (TYPE)` or just `TYPE`.
    ///
    /// @param dataType data type, not null
    /// @param tsType structural type, may be null
    /// @return display string, never null
    public static String format(DataType dataType, String tsType) {
        return tsType != null && !tsType.isEmpty() ? tsType + " (" + dataType + ")" : dataType.name();
    }
}

package io.weft.core.util;

import java.util.Locale;
import java.util.regex.Pattern;

/// Name conversions used when emitting source text.
public final class Identifiers {

    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z])([A-Z])");
    private static final Pattern NON_KEBAB = Pattern.compile("[^a-zA-Z0-9-]");
    private static final Pattern DASH_RUN = Pattern.compile("-+");
    private static final Pattern NON_IDENTIFIER = Pattern.compile("[^a-zA-Z0-9_$]");
    private static final Pattern SCOPE_NAME = Pattern.compile("^[a-zA-Z_$][a-zA-Z0-9_$]*$");

    private Identifiers() {}

    /// Converts a name such as `processOrder` or `my workflow` to `process-order` or
    /// `my-workflow`.
    ///
    /// @param name source name, not null
    /// @return lowercase kebab-case name, never null
    public static String toKebabCase(String name) {
        String result = CAMEL_BOUNDARY.matcher(name).replaceAll("$1-$2");
        result = NON_KEBAB.matcher(result).replaceAll("-");
        result = DASH_RUN.matcher(result).replaceAll("-");
        return result.toLowerCase(Locale.ROOT);
    }

    /// Replaces characters that are illegal in a script identifier with `_`.
    ///
    /// @param name source name, not null
    /// @return valid identifier, never null
    public static String toValidIdentifier(String name) {
        String result = NON_IDENTIFIER.matcher(name).replaceAll("_");
        if (!result.isEmpty() && Character.isDigit(result.charAt(0))) {
            result = "_" + result;
        }
        return result;
    }

    /// @return `true` if the name is usable as a scope name
    public static boolean isValidScopeName(String name) {
        return name != null && SCOPE_NAME.matcher(name).matches();
    }
}

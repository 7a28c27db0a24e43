package io.weft.core.generator;

import java.util.Locale;

/// HTTP framework adapters for the optional serve entrypoint.
public enum ServeFramework {
    NEXT("inngest/next", "export const { GET, POST, PUT } = serve({"),
    EXPRESS("inngest/express", "export const handler = serve({"),
    HONO("inngest/hono", "export const handler = serve({"),
    FASTIFY("inngest/fastify", "export const handler = serve({"),
    REMIX("inngest/remix", "export const handler = serve({");

    private final String importPath;
    private final String exportLine;

    ServeFramework(String importPath, String exportLine) {
        this.importPath = importPath;
        this.exportLine = exportLine;
    }

    /// @return module the `serve` function is imported from
    public String importPath() {
        return importPath;
    }

    /// @return opening line of the exported serve call
    public String exportLine() {
        return exportLine;
    }

    /// @return lowercase framework name, e.g. `next`
    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Parses a framework name case-insensitively.
    ///
    /// @param name framework name such as `hono`, not null
    /// @return the framework, never null
    /// @throws IllegalArgumentException if the name is unknown
    public static ServeFramework fromName(String name) {
        for (ServeFramework framework : values()) {
            if (framework.name().equalsIgnoreCase(name)) {
                return framework;
            }
        }
        throw new IllegalArgumentException("Unknown serve framework: " + name);
    }
}

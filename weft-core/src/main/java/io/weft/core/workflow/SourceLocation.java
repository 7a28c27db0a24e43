package io.weft.core.workflow;

/// Position of a declaration in the front-end's source file.
///
/// @param file source file path, may be null when unknown
/// @param line 1-based line number
/// @param column 1-based column number
public record SourceLocation(String file, int line, int column) {

    @Override
    public String toString() {
        return (file != null ? file : "<unknown>") + ":" + line + ":" + column;
    }
}

package io.weft.core.validation;

/// Stable identifiers for every diagnostic the validator emits.
///
/// The enum constant name is the wire code. Codes with a documentation page carry
/// the page path relative to the configured documentation base URL.
public enum DiagnosticCode {
    // Node types
    UNKNOWN_NODE_TYPE("concepts#node-registration"),
    INFERRED_NODE_TYPE("node-conversion"),
    STUB_NODE("model-driven#stub-nodes"),

    // Structure
    MISSING_WORKFLOW_NAME,
    MISSING_FUNCTION_NAME,
    DUPLICATE_NODE_NAME,
    DUPLICATE_INSTANCE_ID,
    RESERVED_NODE_NAME,
    RESERVED_INSTANCE_ID,

    // References
    UNKNOWN_SOURCE_NODE,
    UNKNOWN_TARGET_NODE,
    UNKNOWN_SOURCE_PORT("concepts#port-architecture"),
    UNKNOWN_TARGET_PORT("concepts#port-architecture"),
    DUPLICATE_CONNECTION("concepts#connections"),
    UNDEFINED_NODE,

    // Types
    STEP_PORT_TYPE_MISMATCH,
    COERCE_ON_FUNCTION_PORT("compilation#type-coercion"),
    REDUNDANT_COERCE("compilation#type-coercion"),
    OBJECT_TYPE_MISMATCH,
    COERCE_TYPE_MISMATCH("compilation#type-coercion"),
    LOSSY_TYPE_COERCION,
    UNUSUAL_TYPE_COERCION,
    TYPE_MISMATCH("compilation#type-compatibility"),
    TYPE_INCOMPATIBLE("compilation#type-compatibility"),

    // Inputs and usage
    MISSING_REQUIRED_INPUT,
    UNUSED_NODE,
    NO_START_CONNECTIONS,
    NO_EXIT_CONNECTIONS,
    INVALID_EXIT_PORT_TYPE,
    UNUSED_OUTPUT_PORT,
    UNREACHABLE_EXIT_PORT,
    MULTIPLE_EXIT_CONNECTIONS,
    MULTIPLE_CONNECTIONS_TO_INPUT,

    // Topology
    CYCLE_DETECTED,

    // Declarations
    INVALID_COLOR,
    INVALID_PORT_CONFIG_REF,
    INVALID_SCOPE_NAME,

    // Scopes
    SCOPE_INCONSISTENT,
    SCOPE_WRONG_SCOPE_NAME,
    SCOPE_EMPTY,
    SCOPE_UNKNOWN_PORT,
    SCOPE_CONNECTION_OUTSIDE,
    SCOPE_PORT_TYPE_MISMATCH,
    SCOPE_MISSING_REQUIRED_INPUT,
    SCOPE_UNUSED_INPUT,
    SCOPE_ORPHANED_CHILD;

    private final String docPath;

    DiagnosticCode() {
        this(null);
    }

    DiagnosticCode(String docPath) {
        this.docPath = docPath;
    }

    /// Returns the documentation page for this code.
    ///
    /// @param baseUrl documentation base URL without trailing slash, not null
    /// @return absolute URL, or null if the code has no page
    public String docUrl(String baseUrl) {
        return docPath == null ? null : baseUrl + "/" + docPath;
    }
}

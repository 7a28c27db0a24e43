package io.weft.core.workflow.port;

/// Data type tag carried by every port.
///
/// The tag is supplied by the front-end; the compiler never derives it from host
/// language types. A free-form structural type string may accompany it on
/// {@link PortDefinition#getTsType()}.
public enum DataType {
    /// Control-flow only. Connects exclusively to other STEP ports.
    STEP,
    STRING,
    NUMBER,
    BOOLEAN,
    OBJECT,
    ARRAY,
    FUNCTION,
    /// Compatible with every other data type.
    ANY
}

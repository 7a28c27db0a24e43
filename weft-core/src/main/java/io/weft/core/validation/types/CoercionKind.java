package io.weft.core.validation.types;

/// Classification of an implicit conversion between two data types.
public enum CoercionKind {
    /// Always succeeds without losing information.
    SAFE,
    /// Succeeds but may lose or distort information.
    LOSSY,
    /// Legal at runtime but rarely intended.
    UNUSUAL
}

package io.weft.core.validation.types;

import io.weft.core.workflow.port.DataType;

/// One entry of the implicit conversion table.
///
/// @param from source data type, not null
/// @param to target data type, not null
/// @param kind risk classification, not null
/// @param reason runtime risk, null for safe conversions
public record Coercion(DataType from, DataType to, CoercionKind kind, String reason) {}

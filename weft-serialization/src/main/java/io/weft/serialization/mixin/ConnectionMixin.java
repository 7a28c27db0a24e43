package io.weft.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/// Hides the derived `scoped` and `selfLoop` flags of `Connection`.
@JsonIgnoreProperties(value = {"scoped", "selfLoop"}, ignoreUnknown = true)
public abstract class ConnectionMixin {}

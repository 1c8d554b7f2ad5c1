package io.colabel.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Jackson mixin for `LabelRequest.Builder`: JSON field names map directly to builder methods.
///
/// @see LabelRequestMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class LabelRequestBuilderMixin {}

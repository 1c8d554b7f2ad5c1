package io.colabel.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Jackson mixin for `ColumnDescriptor.Builder`: JSON field names map directly to builder methods.
///
/// @see ColumnDescriptorMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class ColumnDescriptorBuilderMixin {}

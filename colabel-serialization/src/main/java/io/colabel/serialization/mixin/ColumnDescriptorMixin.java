package io.colabel.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.colabel.core.context.ColumnDescriptor;

/// Jackson mixin that binds `ColumnDescriptor` deserialization to its builder.
///
/// @see ColumnDescriptorBuilderMixin
/// @see io.colabel.serialization.ColabelJacksonModule
@JsonDeserialize(builder = ColumnDescriptor.Builder.class)
public abstract class ColumnDescriptorMixin {}

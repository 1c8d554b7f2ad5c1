package io.colabel.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.colabel.core.LabelRequest;

/// Jackson mixin that binds `LabelRequest` deserialization to its builder.
///
/// @see LabelRequestBuilderMixin
/// @see io.colabel.serialization.ColabelJacksonModule
@JsonDeserialize(builder = LabelRequest.Builder.class)
public abstract class LabelRequestMixin {}

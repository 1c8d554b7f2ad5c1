package io.colabel.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.colabel.core.LabelRequest;
import io.colabel.core.context.ColumnDescriptor;
import io.colabel.core.value.Value;
import io.colabel.serialization.mixin.ColumnDescriptorBuilderMixin;
import io.colabel.serialization.mixin.ColumnDescriptorMixin;
import io.colabel.serialization.mixin.LabelRequestBuilderMixin;
import io.colabel.serialization.mixin.LabelRequestMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all colabel serialization configuration in one place.
///
/// **Custom serializer** (sealed hierarchy written as plain JSON, no type discriminator):
/// - `Value` - {@link ValueSerializer}
///
/// **Mixin/builder pairs** (immutable builder-pattern types, bound via reflection):
/// - `ColumnDescriptor` + `ColumnDescriptor.Builder`
/// - `LabelRequest` + `LabelRequest.Builder`
///
/// @see LabelRequestSerializer for the convenience factory API
public class ColabelJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3165742985529387301L;

    public ColabelJacksonModule() {
        super("ColabelJacksonModule");

        addSerializer(Value.class, new ValueSerializer());
    }

    /// Applies mixin annotations to builder-pattern types.
    ///
    /// Each `*Mixin` carries `@JsonDeserialize(builder = ...)` on the domain type and each
    /// `*BuilderMixin` carries `@JsonPOJOBuilder(withPrefix = "")` on its builder.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(ColumnDescriptor.class, ColumnDescriptorMixin.class);
        context.setMixInAnnotations(
                ColumnDescriptor.Builder.class, ColumnDescriptorBuilderMixin.class);

        context.setMixInAnnotations(LabelRequest.class, LabelRequestMixin.class);
        context.setMixInAnnotations(LabelRequest.Builder.class, LabelRequestBuilderMixin.class);
    }
}

package io.colabel.core;

import io.colabel.core.context.ContextBuilder;
import io.colabel.core.context.LabelContext;
import io.colabel.core.naming.NameTransformer;
import io.colabel.core.render.RenderListener;
import io.colabel.core.template.DirectiveTemplateRenderer;
import io.colabel.core.template.TemplateRenderer;
import io.colabel.core.value.StructuredValueWriter;
import java.util.Map;
import java.util.Objects;

/// Entry point for rendering column labels.
///
/// Wires a {@link ContextBuilder}, a {@link NameTransformer} and a {@link TemplateRenderer}
/// from one {@link ColabelConfig}.
///
/// ### Usage
/// {@snippet :
/// LabelEngine engine = LabelEngine.builder()
///     .config(ColabelConfig.builder().locale(Locale.GERMANY).build())
///     .build();
/// String label = engine.renderColumnLabel(request);
/// }
///
/// ### Failure policy
/// Rendering never throws for template content. Problems are reported to the
/// {@link RenderListener} passed to each call and the affected text stays literal.
///
/// @implNote Thread-safe once built. The engine works on a copy of the configuration taken
/// when it is built, so later changes to the caller's {@link ColabelConfig} have no effect.
public final class LabelEngine {

    private final ColabelConfig config;
    private final NameTransformer nameTransformer;
    private final TemplateRenderer renderer;

    private LabelEngine(Builder builder) {
        this.config = builder.config != null ? builder.config.copy() : new ColabelConfig();
        this.nameTransformer =
                builder.nameTransformer != null
                        ? builder.nameTransformer
                        : NameTransformer.defaults();
        StructuredValueWriter writer =
                builder.structuredValueWriter != null
                        ? builder.structuredValueWriter
                        : StructuredValueWriter.discover();
        this.renderer = new DirectiveTemplateRenderer(config, writer);
    }

    /// Creates an engine with default configuration.
    ///
    /// @return new engine, never null
    public static LabelEngine create() {
        return builder().build();
    }

    /// Renders a template against a ready-made context.
    ///
    /// @param template the template, may be null (renders as empty)
    /// @param context the values, not null
    /// @return rendered text, never null
    public String render(String template, LabelContext context) {
        return render(template, context, RenderListener.NOOP);
    }

    /// Renders a template against a ready-made context, reporting problems to `listener`.
    ///
    /// @param template the template, may be null (renders as empty)
    /// @param context the values, not null
    /// @param listener render event receiver, not null
    /// @return rendered text, never null
    public String render(String template, LabelContext context, RenderListener listener) {
        return renderer.render(template, context, listener);
    }

    /// Renders a template against plain Java values.
    ///
    /// @param template the template, may be null (renders as empty)
    /// @param values the values by name, not null
    /// @return rendered text, never null
    public String render(String template, Map<String, ?> values) {
        return render(template, LabelContext.of(values));
    }

    /// Builds the context a request would be rendered against.
    ///
    /// @param request the request, not null
    /// @param listener receives auxiliary collision events, not null
    /// @return new context, never null
    public LabelContext buildContext(LabelRequest request, RenderListener listener) {
        Objects.requireNonNull(request, "request");
        return contextBuilder(request)
                .build(
                        request.getColumn(),
                        request.getRows(),
                        request.getAuxiliary(),
                        request.getMetrics(),
                        listener);
    }

    /// Renders the label of a request.
    ///
    /// @param request the request, not null
    /// @return rendered label, never null
    public String renderColumnLabel(LabelRequest request) {
        return renderColumnLabel(request, RenderListener.NOOP);
    }

    /// Renders the label of a request, reporting problems to `listener`.
    ///
    /// The result is trimmed when {@link ColabelConfig#isTrimResult()} is set.
    ///
    /// @param request the request, not null
    /// @param listener render event receiver, not null
    /// @return rendered label, never null
    public String renderColumnLabel(LabelRequest request, RenderListener listener) {
        return renderColumnLabel(request.getTemplate(), request, listener);
    }

    /// Renders `template` against the context of a request, ignoring the request's own
    /// template.
    ///
    /// @param template the template, may be null (renders as empty)
    /// @param request supplies column, rows, auxiliary values and metrics, not null
    /// @param listener render event receiver, not null
    /// @return rendered label, never null
    public String renderColumnLabel(
            String template, LabelRequest request, RenderListener listener) {
        LabelContext context = buildContext(request, listener);
        String label = renderer.render(template, context, listener);
        return config.isTrimResult() ? label.strip() : label;
    }

    private ContextBuilder contextBuilder(LabelRequest request) {
        return new ContextBuilder(config, nameTransformer.withLabels(request.getLabels()));
    }

    /// Returns a copy of the settings this engine was built with.
    ///
    /// @return new configuration, never null
    public ColabelConfig getConfig() {
        return config.copy();
    }

    public NameTransformer getNameTransformer() {
        return nameTransformer;
    }

    public TemplateRenderer getRenderer() {
        return renderer;
    }

    /// Creates a new engine builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link LabelEngine}.
    ///
    /// All fields are optional. The structured value writer defaults to
    /// {@link StructuredValueWriter#discover()}.
    public static final class Builder {
        private ColabelConfig config;
        private NameTransformer nameTransformer;
        private StructuredValueWriter structuredValueWriter;

        private Builder() {}

        public Builder config(ColabelConfig config) {
            this.config = config;
            return this;
        }

        public Builder nameTransformer(NameTransformer nameTransformer) {
            this.nameTransformer = nameTransformer;
            return this;
        }

        public Builder structuredValueWriter(StructuredValueWriter structuredValueWriter) {
            this.structuredValueWriter = structuredValueWriter;
            return this;
        }

        /// Builds the engine.
        ///
        /// @return new engine, never null
        public LabelEngine build() {
            return new LabelEngine(this);
        }
    }
}

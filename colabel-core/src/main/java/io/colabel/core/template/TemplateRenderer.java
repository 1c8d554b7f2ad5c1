package io.colabel.core.template;

import io.colabel.core.context.LabelContext;
import io.colabel.core.render.RenderListener;

/// Renders a label template against a context. Never throws; never returns null.
public interface TemplateRenderer {

    String render(String template, LabelContext context, RenderListener listener);

    default String render(String template, LabelContext context) {
        return render(template, context, RenderListener.NOOP);
    }
}

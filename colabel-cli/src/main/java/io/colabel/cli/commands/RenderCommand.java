package io.colabel.cli.commands;

import io.colabel.cli.render.VerboseRenderListener;
import io.colabel.core.ColabelConfig;
import io.colabel.core.LabelEngine;
import io.colabel.core.LabelRequest;
import io.colabel.core.render.LoggingRenderListener;
import io.colabel.core.render.RenderListener;
import java.util.Locale;
import picocli.CommandLine;

/// CLI command that prints the rendered label of a request.
///
/// ### Usage
/// ```bash
/// colabel render <request.json> [-c <config.properties>] [--template <t>] [--locale <tag>]
///                [--include-metrics] [-v]
/// ```
///
/// With `--verbose` every render event is echoed to stderr; otherwise events go to
/// `java.util.logging`.
@CommandLine.Command(name = "render", description = "Render the label of a request")
class RenderCommand extends RequestCommand {

    @CommandLine.Option(
            names = {"-t", "--template"},
            description = "Template to use instead of the request's template")
    private String template;

    @CommandLine.Option(
            names = {"-l", "--locale"},
            description = "Locale for number formatting, e.g. de-DE")
    private String locale;

    @CommandLine.Option(
            names = {"--include-metrics"},
            description = "Add metrics and metric_count to the context")
    private boolean includeMetrics;

    @CommandLine.Option(
            names = {"-v", "--verbose"},
            description = "Print render events to stderr")
    private boolean verbose;

    @Override
    protected int execute() {
        try {
            LabelRequest request = loadRequest();
            LabelEngine engine = createEngine();
            RenderListener listener =
                    verbose ? new VerboseRenderListener(System.err) : new LoggingRenderListener();

            String effectiveTemplate = template != null ? template : request.getTemplate();
            System.out.println(engine.renderColumnLabel(effectiveTemplate, request, listener));
            return SUCCESS;
        } catch (Exception e) {
            System.err.println(" [FAIL] Render failed: " + e.getMessage());
            return FAILURE;
        }
    }

    @Override
    protected void customize(ColabelConfig config) {
        if (locale != null && !locale.isBlank()) {
            Locale parsed = Locale.forLanguageTag(locale.trim());
            if (parsed.getLanguage().isEmpty()) {
                throw new IllegalArgumentException("Unknown locale: " + locale);
            }
            config.setLocale(parsed);
        }
        if (includeMetrics) {
            config.setIncludeMetrics(true);
        }
    }
}

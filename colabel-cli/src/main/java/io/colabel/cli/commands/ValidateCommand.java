package io.colabel.cli.commands;

import io.colabel.core.LabelEngine;
import io.colabel.core.LabelRequest;
import io.colabel.core.render.CollectingRenderListener;
import io.colabel.core.render.RenderDiagnostic;
import picocli.CommandLine;

/// CLI command that renders a request and reports every problem found on the way.
///
/// Reports:
/// - placeholders without a context value
/// - `if` tags without `endif`
/// - conditions in no supported form, or failing to evaluate
/// - auxiliary values colliding with built-in keys
///
/// Warnings do not change the exit code; only an unreadable request does.
///
/// ### Usage
/// ```bash
/// colabel validate <request.json> [-c <config.properties>]
/// ```
@CommandLine.Command(name = "validate", description = "Check a label request")
class ValidateCommand extends RequestCommand {

    @Override
    protected int execute() {
        try {
            LabelRequest request = loadRequest();
            LabelEngine engine = createEngine();
            CollectingRenderListener listener = new CollectingRenderListener();
            String label = engine.renderColumnLabel(request, listener);

            if (listener.hasDiagnostics()) {
                for (RenderDiagnostic diagnostic : listener.getDiagnostics()) {
                    System.out.println(" [WARN] " + diagnostic);
                }
            } else {
                System.out.println(" [OK] Template is valid!");
            }
            System.out.println("   Column: " + request.getColumn().getKey());
            System.out.println("   Rows: " + request.getRows().size());
            System.out.println("   Label: " + label);
            return SUCCESS;
        } catch (Exception e) {
            System.err.println(" [FAIL] Validation failed: " + e.getMessage());
            return FAILURE;
        }
    }
}

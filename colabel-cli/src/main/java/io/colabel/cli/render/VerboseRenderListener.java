package io.colabel.cli.render;

import io.colabel.core.render.RenderListener;
import java.io.PrintStream;
import java.util.Objects;

/// Render listener that prints every render event to a terminal stream.
///
/// ### Output Format
/// ```
///   * block [is_metric] -> branch 0
///   * {{row_count}} -> "1,234"
///   ! {{unknown}} not in context
/// ```
///
/// @implNote **Not thread-safe**. Output may interleave if shared between render calls.
public class VerboseRenderListener implements RenderListener {

    private final PrintStream out;

    /// @param out output stream for printing (typically System.err), not null
    public VerboseRenderListener(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void onBlockResolved(String firstCondition, int branchIndex) {
        String target = branchIndex < 0 ? "no branch" : "branch " + branchIndex;
        out.printf("  * block [%s] -> %s%n", firstCondition, target);
    }

    @Override
    public void onUnterminatedBlock(int offset) {
        out.printf("  ! block at offset %d has no endif%n", offset);
    }

    @Override
    public void onMalformedCondition(String condition) {
        out.printf("  ! unsupported condition [%s], treated as false%n", condition);
    }

    @Override
    public void onConditionError(String condition, RuntimeException error) {
        out.printf("  ! condition [%s] failed: %s%n", condition, error.getMessage());
    }

    @Override
    public void onPlaceholderResolved(String name, String text) {
        out.printf("  * {{%s}} -> \"%s\"%n", name, text);
    }

    @Override
    public void onUnresolvedPlaceholder(String name) {
        out.printf("  ! {{%s}} not in context%n", name);
    }

    @Override
    public void onAuxiliaryCollision(String name, boolean dropped) {
        out.printf(
                "  ! auxiliary '%s' collides with a built-in key (%s)%n",
                name, dropped ? "dropped" : "replaces built-in");
    }

    @Override
    public void onRenderFailure(String source, RuntimeException error) {
        out.printf("  ! kept [%s] verbatim: %s%n", source, error.getMessage());
    }
}

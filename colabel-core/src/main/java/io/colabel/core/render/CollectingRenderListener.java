package io.colabel.core.render;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Render listener that records problems as {@link RenderDiagnostic}s.
///
/// Used to validate a template against a context without looking at the output.
///
/// @implNote **Not thread-safe**. Use one instance per render call.
public class CollectingRenderListener implements RenderListener {

    private final List<RenderDiagnostic> diagnostics = new ArrayList<>();

    @Override
    public void onUnterminatedBlock(int offset) {
        add(RenderDiagnostic.Kind.UNTERMINATED_BLOCK, "offset " + offset);
    }

    @Override
    public void onMalformedCondition(String condition) {
        add(RenderDiagnostic.Kind.MALFORMED_CONDITION, condition);
    }

    @Override
    public void onConditionError(String condition, RuntimeException error) {
        add(RenderDiagnostic.Kind.CONDITION_ERROR, condition + " (" + error.getMessage() + ")");
    }

    @Override
    public void onUnresolvedPlaceholder(String name) {
        add(RenderDiagnostic.Kind.UNRESOLVED_PLACEHOLDER, name);
    }

    @Override
    public void onAuxiliaryCollision(String name, boolean dropped) {
        add(RenderDiagnostic.Kind.AUXILIARY_COLLISION, name);
    }

    @Override
    public void onRenderFailure(String source, RuntimeException error) {
        add(RenderDiagnostic.Kind.RENDER_FAILURE, source);
    }

    private void add(RenderDiagnostic.Kind kind, String detail) {
        diagnostics.add(new RenderDiagnostic(kind, detail));
    }

    /// Returns the recorded diagnostics in the order they occurred.
    ///
    /// @return unmodifiable view, never null
    public List<RenderDiagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /// Returns whether any problem was recorded.
    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}

package io.colabel.core.render;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CollectingRenderListener")
class CollectingRenderListenerTest {

    @Test
    @DisplayName("records problems in order and ignores resolution events")
    void shouldRecordProblems() {
        CollectingRenderListener listener = new CollectingRenderListener();

        listener.onPlaceholderResolved("a", "1");
        listener.onBlockResolved("x", 0);
        listener.onUnterminatedBlock(7);
        listener.onAuxiliaryCollision("row_count", true);
        listener.onConditionError("x", new IllegalStateException("boom"));

        assertThat(listener.hasDiagnostics()).isTrue();
        assertThat(listener.getDiagnostics())
                .extracting(RenderDiagnostic::toString)
                .containsExactly(
                        "UNTERMINATED_BLOCK: offset 7",
                        "AUXILIARY_COLLISION: row_count",
                        "CONDITION_ERROR: x (boom)");
    }

    @Test
    @DisplayName("starts empty")
    void shouldStartEmpty() {
        assertThat(new CollectingRenderListener().hasDiagnostics()).isFalse();
    }
}

package io.colabel.core.render;

import java.util.Objects;

/// A problem noticed while rendering a label.
///
/// @param kind what went wrong, not null
/// @param detail the affected name, condition or offset, not null
public record RenderDiagnostic(Kind kind, String detail) {

    public RenderDiagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(detail, "detail");
    }

    public enum Kind {
        UNTERMINATED_BLOCK,
        MALFORMED_CONDITION,
        CONDITION_ERROR,
        UNRESOLVED_PLACEHOLDER,
        AUXILIARY_COLLISION,
        RENDER_FAILURE
    }

    @Override
    public String toString() {
        return kind + ": " + detail;
    }
}

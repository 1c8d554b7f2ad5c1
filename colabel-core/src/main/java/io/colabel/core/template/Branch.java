package io.colabel.core.template;

import java.util.List;
import java.util.Objects;

/// One branch of a conditional block.
///
/// @param condition condition text of the `if` / `elif` tag, or null for `else`
/// @param body the branch body with surrounding whitespace trimmed
/// @param nodes the body split into literals and placeholders; nested directives stay literal
public record Branch(String condition, String body, List<TemplateNode> nodes) {

    public Branch {
        Objects.requireNonNull(body, "body");
        nodes = List.copyOf(nodes);
    }

    public boolean isElse() {
        return condition == null;
    }
}

package io.colabel.core.template;

import java.util.List;
import java.util.Objects;

/// One node of a parsed label template.
///
/// ### Permitted Implementations
/// - {@link Literal} - text copied to the output unchanged
/// - {@link Placeholder} - a `{{ name }}` marker
/// - {@link ConditionalBlock} - an `if … endif` span with its branches
///
/// Every node remembers the exact template text it was parsed from ({@link #source()}), so
/// anything that cannot be rendered can be put back verbatim.
///
/// @see TemplateParser
public sealed interface TemplateNode
        permits TemplateNode.Literal, TemplateNode.Placeholder, TemplateNode.ConditionalBlock {

    /// Returns the template text this node was parsed from.
    ///
    /// @return source text, never null
    String source();

    record Literal(String text) implements TemplateNode {

        public Literal {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String source() {
            return text;
        }
    }

    /// @param name the trimmed name between the braces
    /// @param source the marker as written, e.g. `{{ row_count }}`
    record Placeholder(String name, String source) implements TemplateNode {

        public Placeholder {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(source, "source");
        }
    }

    /// @param branches branches in template order; only the last may be an `else` branch
    /// that is reachable
    /// @param source the whole span from `{% if` to the closing `%}` of `endif`
    record ConditionalBlock(List<Branch> branches, String source) implements TemplateNode {

        public ConditionalBlock {
            branches = List.copyOf(branches);
            Objects.requireNonNull(source, "source");
            if (branches.isEmpty()) {
                throw new IllegalArgumentException("A conditional block needs an if branch");
            }
        }

        /// Returns the condition of the opening `if` tag.
        public String firstCondition() {
            return branches.get(0).condition();
        }
    }
}

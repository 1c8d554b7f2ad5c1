package io.colabel.core.template;

import java.util.ArrayList;
import java.util.List;

/// Splits text into {@link TemplateNode.Literal} and {@link TemplateNode.Placeholder} nodes.
///
/// A placeholder is the innermost `{{ … }}` pair: in `{{{x}}}` the placeholder is `{{x}}`
/// and the outer braces are literal. Whitespace around the name is ignored. Unclosed `{{`
/// stays literal.
///
/// @implNote Single forward pass; each character is examined a bounded number of times.
public final class PlaceholderScanner {

    private static final String OPEN = "{{";
    private static final String CLOSE = "}}";

    private PlaceholderScanner() {}

    /// Scans text for placeholders.
    ///
    /// @param text the text, not null
    /// @return nodes in text order, never null
    public static List<TemplateNode> scan(String text) {
        List<TemplateNode> nodes = new ArrayList<>();
        int literalStart = 0;
        int pos = 0;

        while (pos < text.length()) {
            int open = text.indexOf(OPEN, pos);
            if (open < 0) {
                break;
            }
            int close = text.indexOf(CLOSE, open + OPEN.length());
            if (close < 0) {
                break;
            }
            int innerOpen = text.lastIndexOf(OPEN, close - OPEN.length());
            if (innerOpen < open) {
                innerOpen = open;
            }

            if (innerOpen > literalStart) {
                nodes.add(new TemplateNode.Literal(text.substring(literalStart, innerOpen)));
            }
            String name = text.substring(innerOpen + OPEN.length(), close).strip();
            nodes.add(
                    new TemplateNode.Placeholder(
                            name, text.substring(innerOpen, close + CLOSE.length())));
            pos = literalStart = close + CLOSE.length();
        }

        if (literalStart < text.length()) {
            nodes.add(new TemplateNode.Literal(text.substring(literalStart)));
        }
        return nodes;
    }
}

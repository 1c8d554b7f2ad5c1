package io.colabel.core.template;

import io.colabel.core.render.RenderListener;
import java.util.ArrayList;
import java.util.List;

/// Parses a label template into {@link TemplateNode}s.
///
/// ### Grammar
/// ```
/// {% if <condition> %} body ({% elif <condition> %} body)* ({% else %} body)? {% endif %}
/// ```
/// Blocks are top-level only. Inside a block an `if` tag does not open a nested block: it
/// stays literal body text and the block ends at the first `endif`. Only the first `else`
/// of a block is a branch marker; a later `else` is body text. Branch bodies are trimmed.
///
/// ### Malformed input
/// - `elif`, `else` or `endif` outside a block stays literal text
/// - an `if` without a later `endif` is reported once and everything from it to the end of
///   the template stays literal text
/// - a tag whose condition is empty or contains `%` or `}` is not a tag
///
/// @implNote Single forward scan over `{%` markers; no regular expressions and no
/// backtracking. Stateless and thread-safe.
public final class TemplateParser {

    private static final String TAG_OPEN = "{%";
    private static final String TAG_CLOSE = "%}";

    /// Parses a template.
    ///
    /// @param template the template, not null
    /// @param listener receives unterminated-block events, not null
    /// @return nodes in template order, never null
    public List<TemplateNode> parse(String template, RenderListener listener) {
        List<TemplateNode> nodes = new ArrayList<>();
        TagScanner scanner = new TagScanner(template);
        int literalStart = 0;
        int pos = 0;

        while (true) {
            Tag open = scanner.next(pos);
            if (open == null) {
                break;
            }
            if (open.kind() != TagKind.IF) {
                pos = open.end();
                continue;
            }

            List<Tag> markers = new ArrayList<>();
            Tag endif = null;
            boolean elseSeen = false;
            int inner = open.end();
            Tag tag;
            while ((tag = scanner.next(inner)) != null) {
                if (tag.kind() == TagKind.ENDIF) {
                    endif = tag;
                    break;
                }
                if (tag.kind() == TagKind.ELIF) {
                    markers.add(tag);
                } else if (tag.kind() == TagKind.ELSE && !elseSeen) {
                    markers.add(tag);
                    elseSeen = true;
                }
                inner = tag.end();
            }

            if (endif == null) {
                // no endif after this if, so none after any later if either
                listener.onUnterminatedBlock(open.start());
                break;
            }

            addText(nodes, template.substring(literalStart, open.start()));
            nodes.add(block(template, open, markers, endif));
            pos = literalStart = endif.end();
        }

        addText(nodes, template.substring(literalStart));
        return nodes;
    }

    private static TemplateNode.ConditionalBlock block(
            String template, Tag open, List<Tag> markers, Tag endif) {
        List<Branch> branches = new ArrayList<>(markers.size() + 1);
        int firstEnd = markers.isEmpty() ? endif.start() : markers.get(0).start();
        branches.add(branch(open.condition(), template.substring(open.end(), firstEnd)));

        for (int i = 0; i < markers.size(); i++) {
            Tag marker = markers.get(i);
            int end = i + 1 < markers.size() ? markers.get(i + 1).start() : endif.start();
            String condition = marker.kind() == TagKind.ELSE ? null : marker.condition();
            branches.add(branch(condition, template.substring(marker.end(), end)));
        }
        return new TemplateNode.ConditionalBlock(
                branches, template.substring(open.start(), endif.end()));
    }

    private static Branch branch(String condition, String rawBody) {
        String body = rawBody.strip();
        return new Branch(condition, body, PlaceholderScanner.scan(body));
    }

    private static void addText(List<TemplateNode> nodes, String text) {
        if (!text.isEmpty()) {
            nodes.addAll(PlaceholderScanner.scan(text));
        }
    }

    enum TagKind {
        IF,
        ELIF,
        ELSE,
        ENDIF
    }

    /// A recognized directive tag spanning `[start, end)`.
    record Tag(TagKind kind, String condition, int start, int end) {}

    /// Finds directive tags left to right.
    ///
    /// The position of the last `%}` found is cached, so a run of `{%` markers sharing one
    /// closing marker is not rescanned, and only the last marker of such a run is classified.
    private static final class TagScanner {
        private final String template;
        private int cachedClose = -1;

        TagScanner(String template) {
            this.template = template;
        }

        /// Returns the first recognized tag starting at or after `from`, or null.
        Tag next(int from) {
            int pos = from;
            while (true) {
                int open = template.indexOf(TAG_OPEN, pos);
                if (open < 0) {
                    return null;
                }
                int contentStart = open + TAG_OPEN.length();
                int close =
                        cachedClose >= contentStart
                                ? cachedClose
                                : template.indexOf(TAG_CLOSE, contentStart);
                if (close < 0) {
                    return null;
                }
                cachedClose = close;

                // tag content never contains '%', so a later opening marker wins
                int nextOpen = template.indexOf(TAG_OPEN, contentStart);
                if (nextOpen >= 0 && nextOpen < close) {
                    pos = nextOpen;
                    continue;
                }

                Tag tag = classify(template.substring(contentStart, close), open, close);
                if (tag != null) {
                    return tag;
                }
                pos = contentStart;
            }
        }

        private static Tag classify(String rawContent, int open, int close) {
            String content = rawContent.strip();
            int end = close + TAG_CLOSE.length();
            switch (content) {
                case "else":
                    return new Tag(TagKind.ELSE, null, open, end);
                case "endif":
                    return new Tag(TagKind.ENDIF, null, open, end);
                default:
                    break;
            }
            String condition = conditionAfter(content, "if");
            if (condition != null) {
                return new Tag(TagKind.IF, condition, open, end);
            }
            condition = conditionAfter(content, "elif");
            if (condition != null) {
                return new Tag(TagKind.ELIF, condition, open, end);
            }
            return null;
        }

        /// Returns the condition of `<keyword> <condition>`, or null when `content` is not
        /// of that shape.
        private static String conditionAfter(String content, String keyword) {
            if (!content.startsWith(keyword)
                    || content.length() <= keyword.length()
                    || !Character.isWhitespace(content.charAt(keyword.length()))) {
                return null;
            }
            String condition = content.substring(keyword.length()).strip();
            if (condition.isEmpty()
                    || condition.indexOf('%') >= 0
                    || condition.indexOf('}') >= 0) {
                return null;
            }
            return condition;
        }
    }
}

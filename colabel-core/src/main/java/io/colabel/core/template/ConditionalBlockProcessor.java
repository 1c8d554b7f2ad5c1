package io.colabel.core.template;

import io.colabel.core.condition.ConditionEvaluator;
import io.colabel.core.context.LabelContext;
import io.colabel.core.render.RenderListener;
import io.colabel.core.value.ValueFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Reduces every conditional block of a template to the body of its chosen branch.
///
/// Branches are tried top to bottom: the first `if` / `elif` whose condition holds wins,
/// otherwise the `else` branch, otherwise the block produces nothing. Placeholders inside
/// the chosen body are left for the {@link VariableInterpolator}.
///
/// @implNote Stateless and thread-safe.
public final class ConditionalBlockProcessor {

    private final TemplateParser parser;
    private final ConditionEvaluator evaluator;

    public ConditionalBlockProcessor(TemplateParser parser, ConditionEvaluator evaluator) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    /// Resolves all blocks of a template and returns the intermediate text.
    ///
    /// Placeholders are kept exactly as written.
    ///
    /// @param template the template, not null
    /// @param context the render context, not null
    /// @param formatter the per-render formatter, not null
    /// @param listener receives parse and condition events, not null
    /// @return the template with every block replaced by its chosen body, never null
    public String process(
            String template,
            LabelContext context,
            ValueFormatter formatter,
            RenderListener listener) {
        List<TemplateNode> reduced =
                reduce(parser.parse(template, listener), context, formatter, listener);
        StringBuilder result = new StringBuilder(template.length());
        for (TemplateNode node : reduced) {
            result.append(node.source());
        }
        return result.toString();
    }

    /// Replaces each {@link TemplateNode.ConditionalBlock} by the nodes of its chosen branch.
    ///
    /// @param nodes parsed template nodes, not null
    /// @param context the render context, not null
    /// @param formatter the per-render formatter, not null
    /// @param listener receives condition and resolution events, not null
    /// @return literal and placeholder nodes only, never null
    public List<TemplateNode> reduce(
            List<TemplateNode> nodes,
            LabelContext context,
            ValueFormatter formatter,
            RenderListener listener) {
        List<TemplateNode> reduced = new ArrayList<>(nodes.size());
        for (TemplateNode node : nodes) {
            if (node instanceof TemplateNode.ConditionalBlock block) {
                select(block, context, formatter, listener)
                        .ifPresent(branch -> reduced.addAll(branch.nodes()));
            } else {
                reduced.add(node);
            }
        }
        return reduced;
    }

    /// Chooses the branch of a block.
    ///
    /// @return the chosen branch, or empty when no condition holds and there is no `else`
    public Optional<Branch> select(
            TemplateNode.ConditionalBlock block,
            LabelContext context,
            ValueFormatter formatter,
            RenderListener listener) {
        List<Branch> branches = block.branches();
        for (int i = 0; i < branches.size(); i++) {
            Branch branch = branches.get(i);
            if (branch.isElse()
                    || evaluator.evaluate(branch.condition(), context, formatter, listener)) {
                listener.onBlockResolved(block.firstCondition(), i);
                return Optional.of(branch);
            }
        }
        listener.onBlockResolved(block.firstCondition(), -1);
        return Optional.empty();
    }
}

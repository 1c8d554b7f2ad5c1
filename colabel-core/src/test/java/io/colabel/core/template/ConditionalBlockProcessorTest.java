package io.colabel.core.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import io.colabel.core.condition.ConditionEvaluator;
import io.colabel.core.condition.ConditionParser;
import io.colabel.core.context.LabelContext;
import io.colabel.core.render.RenderListener;
import io.colabel.core.value.FallbackStructuredValueWriter;
import io.colabel.core.value.ValueFormatter;
import java.util.Locale;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConditionalBlockProcessor")
class ConditionalBlockProcessorTest {

    private static final String GRADES =
            "{% if score >= 90 %}A{% elif score >= 80 %}B{% else %}C{% endif %}";

    private ConditionalBlockProcessor processor;
    private ValueFormatter formatter;
    private RenderListener listener;

    @BeforeEach
    void setUp() {
        processor =
                new ConditionalBlockProcessor(
                        new TemplateParser(), new ConditionEvaluator(new ConditionParser(true)));
        formatter = new ValueFormatter(Locale.US, 3, FallbackStructuredValueWriter.INSTANCE);
        listener = mock(RenderListener.class);
    }

    private String process(String template, Map<String, ?> values) {
        return processor.process(template, LabelContext.of(values), formatter, listener);
    }

    @Test
    @DisplayName("takes the first branch whose condition holds")
    void shouldTakeFirstTrueBranch() {
        assertThat(process(GRADES, Map.of("score", 95))).isEqualTo("A");
        assertThat(process(GRADES, Map.of("score", 85))).isEqualTo("B");
        verify(listener).onBlockResolved("score >= 90", 0);
        verify(listener).onBlockResolved("score >= 90", 1);
    }

    @Test
    @DisplayName("falls back to the else branch")
    void shouldFallBackToElse() {
        assertThat(process(GRADES, Map.of("score", 10))).isEqualTo("C");
        verify(listener).onBlockResolved("score >= 90", 2);
    }

    @Test
    @DisplayName("produces nothing when no branch matches and there is no else")
    void shouldProduceNothingWithoutElse() {
        assertThat(process("[{% if flag %}on{% endif %}]", Map.of())).isEqualTo("[]");
        verify(listener).onBlockResolved("flag", -1);
    }

    @Test
    @DisplayName("keeps placeholders of the chosen body for interpolation")
    void shouldKeepPlaceholders() {
        String template =
                "{% if row_count == '0' %}No data{% else %}{{ row_count }} rows{% endif %}";

        assertThat(process(template, Map.of("row_count", 5))).isEqualTo("{{ row_count }} rows");
    }

    @Test
    @DisplayName("an elif after the else branch is never reached")
    void shouldNotReachElifAfterElse() {
        String template = "{% if a %}A{% else %}B{% elif b %}C{% endif %}";

        assertThat(process(template, Map.of("b", true))).isEqualTo("B");
    }

    @Test
    @DisplayName("a malformed condition counts as false")
    void shouldTreatMalformedAsFalse() {
        String template = "{% if a and b %}both{% else %}not both{% endif %}";

        assertThat(process(template, Map.of("a", true, "b", true))).isEqualTo("not both");
        verify(listener).onMalformedCondition("a and b");
    }

    @Test
    @DisplayName("text outside blocks is unchanged")
    void shouldKeepOuterText() {
        assertThat(process("  pre {% if x %}X{% endif %} post  ", Map.of("x", 1)))
                .isEqualTo("  pre X post  ");
    }
}

package io.colabel.core;

import static org.assertj.core.api.Assertions.assertThat;

import io.colabel.core.context.AuxiliaryPrecedence;
import java.util.Locale;
import java.util.Properties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ColabelConfig")
class ColabelConfigTest {

    @Test
    @DisplayName("has documented defaults")
    void shouldHaveDefaults() {
        ColabelConfig config = new ColabelConfig();

        assertThat(config.getLocale()).isEqualTo(Locale.US);
        assertThat(config.getMaxFractionDigits()).isEqualTo(3);
        assertThat(config.isIncludeMetrics()).isFalse();
        assertThat(config.getAuxiliaryPrecedence())
                .isEqualTo(AuxiliaryPrecedence.RESERVE_BUILT_INS);
        assertThat(config.isTrimResult()).isTrue();
        assertThat(config.isRelationalConditions()).isTrue();
    }

    @Test
    @DisplayName("reads every property")
    void shouldReadProperties() {
        Properties properties = new Properties();
        properties.setProperty(ColabelConfig.LOCALE_PROPERTY, "de-DE");
        properties.setProperty(ColabelConfig.MAX_FRACTION_DIGITS_PROPERTY, " 1 ");
        properties.setProperty(ColabelConfig.INCLUDE_METRICS_PROPERTY, "TRUE");
        properties.setProperty(ColabelConfig.AUXILIARY_PRECEDENCE_PROPERTY, "auxiliary_wins");
        properties.setProperty(ColabelConfig.TRIM_RESULT_PROPERTY, "false");
        properties.setProperty(ColabelConfig.RELATIONAL_CONDITIONS_PROPERTY, "false");

        ColabelConfig config = ColabelConfig.fromProperties(properties);

        assertThat(config.getLocale()).isEqualTo(Locale.GERMANY);
        assertThat(config.getMaxFractionDigits()).isEqualTo(1);
        assertThat(config.isIncludeMetrics()).isTrue();
        assertThat(config.getAuxiliaryPrecedence()).isEqualTo(AuxiliaryPrecedence.AUXILIARY_WINS);
        assertThat(config.isTrimResult()).isFalse();
        assertThat(config.isRelationalConditions()).isFalse();
    }

    @Test
    @DisplayName("ignores malformed values and keeps defaults")
    void shouldIgnoreMalformedValues() {
        Properties properties = new Properties();
        properties.setProperty(ColabelConfig.MAX_FRACTION_DIGITS_PROPERTY, "many");
        properties.setProperty(ColabelConfig.AUXILIARY_PRECEDENCE_PROPERTY, "sometimes");
        properties.setProperty(ColabelConfig.TRIM_RESULT_PROPERTY, "maybe");

        ColabelConfig config = ColabelConfig.fromProperties(properties);

        assertThat(config.getMaxFractionDigits()).isEqualTo(3);
        assertThat(config.getAuxiliaryPrecedence())
                .isEqualTo(AuxiliaryPrecedence.RESERVE_BUILT_INS);
        assertThat(config.isTrimResult()).isTrue();
    }

    @Test
    @DisplayName("builder sets every option")
    void shouldBuild() {
        ColabelConfig config =
                ColabelConfig.builder()
                        .locale(Locale.FRANCE)
                        .maxFractionDigits(0)
                        .includeMetrics(true)
                        .trimResult(false)
                        .build();

        assertThat(config.getLocale()).isEqualTo(Locale.FRANCE);
        assertThat(config.getMaxFractionDigits()).isZero();
        assertThat(config.isIncludeMetrics()).isTrue();
        assertThat(config.isTrimResult()).isFalse();
    }
}

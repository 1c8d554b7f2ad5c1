package io.colabel.core;

import io.colabel.core.context.AuxiliaryPrecedence;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Logger;

/// Configuration options for label rendering.
///
/// Controls number formatting, which optional keys the context builder adds, how auxiliary
/// values collide with built-in keys, and which condition forms the evaluator accepts.
/// Use the {@link Builder} for fluent configuration, {@link #fromProperties(Properties)} for
/// file-based configuration, or construct directly with setters.
///
/// ### Default Values
/// - `locale`: `Locale.US`
/// - `maxFractionDigits`: `3`
/// - `includeMetrics`: `false`
/// - `auxiliaryPrecedence`: {@link AuxiliaryPrecedence#RESERVE_BUILT_INS}
/// - `trimResult`: `true`
/// - `relationalConditions`: `true`
///
/// ### Property Keys
/// | Key | Type |
/// |---|---|
/// | `colabel.locale` | BCP 47 language tag, e.g. `de-DE` |
/// | `colabel.max-fraction-digits` | non-negative integer |
/// | `colabel.include-metrics` | `true` / `false` |
/// | `colabel.auxiliary-precedence` | `RESERVE_BUILT_INS` / `AUXILIARY_WINS` |
/// | `colabel.trim-result` | `true` / `false` |
/// | `colabel.relational-conditions` | `true` / `false` |
///
/// @implNote **Not thread-safe**. This is a mutable configuration object intended to be
/// configured before passing to {@link LabelEngine}. Do not modify after engine creation.
///
/// @see LabelEngine.Builder#config(ColabelConfig)
public class ColabelConfig {

    private static final Logger logger = Logger.getLogger(ColabelConfig.class.getName());

    public static final String LOCALE_PROPERTY = "colabel.locale";
    public static final String MAX_FRACTION_DIGITS_PROPERTY = "colabel.max-fraction-digits";
    public static final String INCLUDE_METRICS_PROPERTY = "colabel.include-metrics";
    public static final String AUXILIARY_PRECEDENCE_PROPERTY = "colabel.auxiliary-precedence";
    public static final String TRIM_RESULT_PROPERTY = "colabel.trim-result";
    public static final String RELATIONAL_CONDITIONS_PROPERTY = "colabel.relational-conditions";

    private Locale locale = Locale.US;
    private int maxFractionDigits = 3;
    private boolean includeMetrics = false;
    private AuxiliaryPrecedence auxiliaryPrecedence = AuxiliaryPrecedence.RESERVE_BUILT_INS;
    private boolean trimResult = true;
    private boolean relationalConditions = true;

    /// Creates a configuration with default values.
    public ColabelConfig() {}

    /// Reads a configuration from properties.
    ///
    /// Missing keys keep their defaults. Malformed values are logged at `WARNING` and
    /// ignored; this method never throws for bad input.
    ///
    /// @param properties source properties, not null
    /// @return a new configuration, never null
    public static ColabelConfig fromProperties(Properties properties) {
        ColabelConfig config = new ColabelConfig();

        String locale = properties.getProperty(LOCALE_PROPERTY);
        if (locale != null && !locale.isBlank()) {
            Locale parsed = Locale.forLanguageTag(locale.trim());
            if (parsed.getLanguage().isEmpty()) {
                logger.warning("Ignoring unknown locale '" + locale + "'");
            } else {
                config.setLocale(parsed);
            }
        }

        String digits = properties.getProperty(MAX_FRACTION_DIGITS_PROPERTY);
        if (digits != null && !digits.isBlank()) {
            try {
                int value = Integer.parseInt(digits.trim());
                if (value < 0) {
                    logger.warning("Ignoring negative " + MAX_FRACTION_DIGITS_PROPERTY);
                } else {
                    config.setMaxFractionDigits(value);
                }
            } catch (NumberFormatException e) {
                logger.warning(
                        "Ignoring malformed " + MAX_FRACTION_DIGITS_PROPERTY + ": " + digits);
            }
        }

        String precedence = properties.getProperty(AUXILIARY_PRECEDENCE_PROPERTY);
        if (precedence != null && !precedence.isBlank()) {
            try {
                config.setAuxiliaryPrecedence(
                        AuxiliaryPrecedence.valueOf(precedence.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                logger.warning("Ignoring unknown auxiliary precedence '" + precedence + "'");
            }
        }

        config.setIncludeMetrics(
                readBoolean(properties, INCLUDE_METRICS_PROPERTY, config.isIncludeMetrics()));
        config.setTrimResult(readBoolean(properties, TRIM_RESULT_PROPERTY, config.isTrimResult()));
        config.setRelationalConditions(
                readBoolean(
                        properties,
                        RELATIONAL_CONDITIONS_PROPERTY,
                        config.isRelationalConditions()));
        return config;
    }

    private static boolean readBoolean(Properties properties, String key, boolean fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String normalized = value.trim();
        if ("true".equalsIgnoreCase(normalized)) {
            return true;
        }
        if ("false".equalsIgnoreCase(normalized)) {
            return false;
        }
        logger.warning("Ignoring malformed boolean " + key + ": " + value);
        return fallback;
    }

    /// Returns the locale used for number grouping and decimal symbols.
    ///
    /// @return the locale, never null
    public Locale getLocale() {
        return locale;
    }

    /// Sets the locale used for number grouping and decimal symbols.
    ///
    /// @param locale the locale, not null
    public void setLocale(Locale locale) {
        this.locale = Objects.requireNonNull(locale, "locale");
    }

    /// Returns the maximum number of fraction digits of formatted numbers.
    public int getMaxFractionDigits() {
        return maxFractionDigits;
    }

    /// Sets the maximum number of fraction digits of formatted numbers.
    ///
    /// @param maxFractionDigits fraction digits, must not be negative
    public void setMaxFractionDigits(int maxFractionDigits) {
        if (maxFractionDigits < 0) {
            throw new IllegalArgumentException("Max fraction digits cannot be negative");
        }
        this.maxFractionDigits = maxFractionDigits;
    }

    /// Returns whether `metrics` and `metric_count` are added to the context.
    public boolean isIncludeMetrics() {
        return includeMetrics;
    }

    public void setIncludeMetrics(boolean includeMetrics) {
        this.includeMetrics = includeMetrics;
    }

    /// Returns the collision policy for auxiliary values.
    ///
    /// @return the policy, never null
    public AuxiliaryPrecedence getAuxiliaryPrecedence() {
        return auxiliaryPrecedence;
    }

    /// Sets the collision policy for auxiliary values.
    ///
    /// @param auxiliaryPrecedence the policy, not null
    public void setAuxiliaryPrecedence(AuxiliaryPrecedence auxiliaryPrecedence) {
        this.auxiliaryPrecedence =
                Objects.requireNonNull(auxiliaryPrecedence, "auxiliaryPrecedence");
    }

    /// Returns whether {@link LabelEngine#renderColumnLabel} trims its result.
    public boolean isTrimResult() {
        return trimResult;
    }

    public void setTrimResult(boolean trimResult) {
        this.trimResult = trimResult;
    }

    /// Returns whether numeric and relational condition forms (`==` with a number, `!=`,
    /// `>`, `>=`, `<`, `<=`) are recognized.
    public boolean isRelationalConditions() {
        return relationalConditions;
    }

    public void setRelationalConditions(boolean relationalConditions) {
        this.relationalConditions = relationalConditions;
    }

    /// Returns an independent copy of this configuration.
    ///
    /// @return new configuration with the same settings, never null
    public ColabelConfig copy() {
        ColabelConfig copy = new ColabelConfig();
        copy.locale = locale;
        copy.maxFractionDigits = maxFractionDigits;
        copy.includeMetrics = includeMetrics;
        copy.auxiliaryPrecedence = auxiliaryPrecedence;
        copy.trimResult = trimResult;
        copy.relationalConditions = relationalConditions;
        return copy;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link ColabelConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final ColabelConfig config = new ColabelConfig();

        public Builder locale(Locale locale) {
            config.setLocale(locale);
            return this;
        }

        public Builder maxFractionDigits(int maxFractionDigits) {
            config.setMaxFractionDigits(maxFractionDigits);
            return this;
        }

        public Builder includeMetrics(boolean includeMetrics) {
            config.includeMetrics = includeMetrics;
            return this;
        }

        public Builder auxiliaryPrecedence(AuxiliaryPrecedence auxiliaryPrecedence) {
            config.setAuxiliaryPrecedence(auxiliaryPrecedence);
            return this;
        }

        public Builder trimResult(boolean trimResult) {
            config.trimResult = trimResult;
            return this;
        }

        public Builder relationalConditions(boolean relationalConditions) {
            config.relationalConditions = relationalConditions;
            return this;
        }

        /// Builds and returns the configured {@link ColabelConfig} instance.
        ///
        /// @return the configured instance, never null
        public ColabelConfig build() {
            return config;
        }
    }
}

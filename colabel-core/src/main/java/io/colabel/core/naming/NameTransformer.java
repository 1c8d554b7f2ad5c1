package io.colabel.core.naming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Turns raw field identifiers into human-friendly label fragments.
///
/// Identifiers of the form `FUNC(field)` with `FUNC` one of `SUM`, `COUNT`, `AVG`, `MAX`,
/// `MIN` (case-insensitive) become `<prefix word> <field label>`; any other identifier is
/// looked up directly. Identifiers without a table entry are returned unchanged.
///
/// ### Example
/// ```
/// sell_in          → Sell In
/// SUM(sell_in)     → Total Sell In
/// max(anio_id)     → Máximo Año
/// MEDIAN(sell_in)  → MEDIAN(sell_in)
/// ```
///
/// @implNote Immutable and thread-safe.
public final class NameTransformer {

    private static final Pattern AGGREGATE_PATTERN =
            Pattern.compile("^(SUM|COUNT|AVG|MAX|MIN)\\((.*)\\)$", Pattern.CASE_INSENSITIVE);

    private static final Map<String, String> DEFAULT_LABELS = defaultLabels();

    private static final Map<String, String> PREFIX_WORDS =
            Map.of(
                    "SUM", "Total",
                    "COUNT", "Cantidad",
                    "AVG", "Promedio",
                    "MAX", "Máximo",
                    "MIN", "Mínimo");

    private static final NameTransformer DEFAULTS = new NameTransformer(DEFAULT_LABELS);

    private final Map<String, String> labels;

    private NameTransformer(Map<String, String> labels) {
        this.labels = labels;
    }

    private static Map<String, String> defaultLabels() {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("jefe_marca", "Jefe Marca");
        labels.put("sell_in", "Sell In");
        labels.put("anio_id", "Año");
        labels.put("mes_id", "Mes");
        labels.put("fecha", "Fecha");
        return Collections.unmodifiableMap(labels);
    }

    /// Returns the transformer with the built-in label table.
    ///
    /// @return shared instance, never null
    public static NameTransformer defaults() {
        return DEFAULTS;
    }

    /// Returns a transformer whose table is this one's plus the given entries.
    ///
    /// Entries in `extra` override existing ones with the same identifier. Entries with a null
    /// identifier or label are ignored.
    ///
    /// @param extra identifier to label entries, not null (may be empty)
    /// @return a new transformer, or this one when `extra` is empty
    public NameTransformer withLabels(Map<String, String> extra) {
        Objects.requireNonNull(extra, "extra");
        if (extra.isEmpty()) {
            return this;
        }
        Map<String, String> merged = new LinkedHashMap<>(labels);
        extra.forEach(
                (identifier, label) -> {
                    if (identifier != null && label != null) {
                        merged.put(identifier, label);
                    }
                });
        return new NameTransformer(Collections.unmodifiableMap(merged));
    }

    /// Transforms an identifier into a display fragment.
    ///
    /// @param identifier raw identifier, may be null
    /// @return display fragment; empty for null input, never null
    public String transform(String identifier) {
        if (identifier == null) {
            return "";
        }
        Matcher matcher = AGGREGATE_PATTERN.matcher(identifier);
        if (matcher.matches()) {
            String function = matcher.group(1).toUpperCase(Locale.ROOT);
            String field = matcher.group(2);
            return PREFIX_WORDS.get(function) + " " + label(field);
        }
        return label(identifier);
    }

    /// Returns the table label of a plain identifier.
    ///
    /// @param identifier identifier, not null
    /// @return the label, or `identifier` when the table has no entry
    public String label(String identifier) {
        return labels.getOrDefault(identifier, identifier);
    }

    /// Returns the label table.
    ///
    /// @return unmodifiable map, never null
    public Map<String, String> getLabels() {
        return labels;
    }
}

package io.colabel.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.colabel.core.LabelRequest;

/// Utility class for reading and writing label requests as JSON.
///
/// ### Format
/// ```json
/// {
///   "template": "{{column_name}} ({{row_count}} rows)",
///   "column": {"key": "sales", "label": "SUM(sell_in)", "dataType": "NUMERIC"},
///   "rows": [{"sales": 10}, {"sales": 999}],
///   "auxiliary": {"region": "North"},
///   "metrics": ["sales"],
///   "labels": {"sales": "Ventas"}
/// }
/// ```
/// Only `column.key` is required.
///
/// @implNote Thread-safe. A new `ObjectMapper` is created per call via `createMapper()`.
/// For high-throughput scenarios, cache the mapper.
///
/// @see ColabelJacksonModule for the registered type handlers
public final class LabelRequestSerializer {

    private LabelRequestSerializer() {}

    /// Serializes a request to pretty-printed JSON.
    ///
    /// @param request the request to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(LabelRequest request) {
        try {
            return createMapper().writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize label request: " + e.getMessage(), e);
        }
    }

    /// Deserializes a request from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized request, never null
    /// @throws IllegalArgumentException if the JSON is malformed or the column key is missing
    public static LabelRequest fromJson(String json) {
        try {
            return createMapper().readValue(json, LabelRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize label request: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for label requests.
    ///
    /// Registers:
    /// - `ColabelJacksonModule` for builder binding and `Value` output
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new ColabelJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}

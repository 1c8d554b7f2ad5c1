package io.colabel.core.value;

import java.util.ServiceLoader;
import java.util.logging.Logger;

/// Writes record and list values as compact single-line text.
///
/// The core module has no serialization library of its own. Implementations are discovered
/// with {@link ServiceLoader}; the `colabel-serialization` module registers a Jackson-based
/// JSON writer. Without a registered provider, {@link FallbackStructuredValueWriter} is used.
///
/// @implNote Implementations must be stateless and thread-safe; a single instance is shared
/// by every render call of an engine.
///
/// @see ValueFormatter
public interface StructuredValueWriter {

    /// Writes a record value.
    ///
    /// @param record the record, not null
    /// @return compact text, never null
    String writeRecord(RecordValue record);

    /// Writes a list value.
    ///
    /// @param list the list, not null
    /// @return compact text, never null
    String writeList(ListValue list);

    /// Returns the first writer registered through `META-INF/services`, or the fallback.
    ///
    /// @return a writer, never null
    static StructuredValueWriter discover() {
        Logger logger = Logger.getLogger(StructuredValueWriter.class.getName());
        for (StructuredValueWriter writer : ServiceLoader.load(StructuredValueWriter.class)) {
            logger.fine("Discovered structured value writer: " + writer.getClass().getName());
            return writer;
        }
        logger.fine("No structured value writer registered, using fallback");
        return FallbackStructuredValueWriter.INSTANCE;
    }
}

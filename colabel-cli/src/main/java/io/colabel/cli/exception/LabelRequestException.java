package io.colabel.cli.exception;

import java.io.Serial;

/// Thrown when a label request or its configuration cannot be loaded.
///
/// Common causes:
/// - Request or config file not found or unreadable
/// - Malformed JSON
/// - Missing `column.key`
///
/// @see io.colabel.cli.commands.RequestCommand
public class LabelRequestException extends Exception {

    @Serial private static final long serialVersionUID = 4402718850377196541L;

    /// Creates an exception with the specified detail message and cause.
    ///
    /// @param message description of why the request could not be loaded, not null
    /// @param cause the underlying failure, may be null
    public LabelRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}

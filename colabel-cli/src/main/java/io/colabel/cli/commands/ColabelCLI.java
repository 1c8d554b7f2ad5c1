package io.colabel.cli.commands;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/// Main entry point for the colabel CLI application.
///
/// Registers all available subcommands:
/// - `render` - Render the label of a JSON label request
/// - `validate` - Report unresolved placeholders, unterminated blocks and bad conditions
/// - `names` - Show how identifiers are turned into display names
///
/// @see RenderCommand
/// @see ValidateCommand
/// @see NamesCommand
@Command(
        name = "colabel",
        description = "Column label template renderer",
        mixinStandardHelpOptions = true,
        version = "colabel 0.1.0",
        subcommands = {RenderCommand.class, ValidateCommand.class, NamesCommand.class})
public class ColabelCLI {

    public static void main(String[] args) {
        System.exit(new CommandLine(new ColabelCLI()).execute(args));
    }
}

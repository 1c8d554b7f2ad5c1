package io.colabel.cli.commands;

import io.colabel.cli.exception.LabelRequestException;
import io.colabel.core.ColabelConfig;
import io.colabel.core.LabelEngine;
import io.colabel.core.LabelRequest;
import io.colabel.serialization.LabelRequestSerializer;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// Base class for commands that work on a JSON label request file.
///
/// ### Configuration Resolution
/// 1. Command options (e.g. `--locale`), applied by subclasses in {@link #customize}
/// 2. Properties file given with `-c` / `--config`
/// 3. {@link ColabelConfig} defaults
///
/// @implNote Subclasses must be package-private and annotated with `@Command`.
/// @see RenderCommand
/// @see ValidateCommand
public abstract class RequestCommand extends ColabelCommand {

    @Parameters(index = "0", description = "Label request JSON file")
    protected Path requestFile;

    @Option(
            names = {"-c", "--config"},
            description = "Properties file with colabel.* settings")
    protected Path configFile;

    /// Reads and parses the request file.
    ///
    /// @return parsed request, never null
    /// @throws LabelRequestException if the file cannot be read or is not a valid request
    protected LabelRequest loadRequest() throws LabelRequestException {
        String json;
        try {
            json = Files.readString(requestFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LabelRequestException("Cannot read " + requestFile + ": " + e, e);
        }
        try {
            return LabelRequestSerializer.fromJson(json);
        } catch (IllegalArgumentException e) {
            throw new LabelRequestException(e.getMessage(), e);
        }
    }

    /// Builds the effective configuration.
    ///
    /// @return new configuration, never null
    /// @throws LabelRequestException if the config file cannot be read
    protected ColabelConfig loadConfig() throws LabelRequestException {
        ColabelConfig config;
        if (configFile == null) {
            config = new ColabelConfig();
        } else {
            Properties properties = new Properties();
            try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
                properties.load(reader);
            } catch (IOException e) {
                throw new LabelRequestException("Cannot read " + configFile + ": " + e, e);
            }
            config = ColabelConfig.fromProperties(properties);
        }
        customize(config);
        return config;
    }

    /// Creates an engine from the effective configuration.
    ///
    /// @return new engine, never null
    /// @throws LabelRequestException if the config file cannot be read
    protected LabelEngine createEngine() throws LabelRequestException {
        return LabelEngine.builder().config(loadConfig()).build();
    }

    /// Applies command options on top of the loaded configuration.
    ///
    /// @param config configuration to modify, not null
    protected void customize(ColabelConfig config) {}
}

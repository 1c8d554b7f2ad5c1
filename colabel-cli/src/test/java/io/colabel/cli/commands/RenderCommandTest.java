package io.colabel.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("render command")
class RenderCommandTest extends BaseCommandTest {

    @Test
    @DisplayName("prints the rendered label")
    void shouldPrintLabel() throws Exception {
        Path request = writeFile("request.json", SALES_REQUEST);

        int exitCode = run("render", request.toString());

        assertThat(exitCode).isZero();
        assertThat(out().strip()).isEqualTo("Total Sell In [10 - 999]");
    }

    @Test
    @DisplayName("renders an override template")
    void shouldUseTemplateOption() throws Exception {
        Path request = writeFile("request.json", SALES_REQUEST);

        int exitCode = run("render", request.toString(), "--template", "{{sum}} / {{count}}");

        assertThat(exitCode).isZero();
        assertThat(out().strip()).isEqualTo("1,059 / 3");
    }

    @Test
    @DisplayName("formats numbers for the requested locale")
    void shouldUseLocaleOption() throws Exception {
        Path request = writeFile("request.json", SALES_REQUEST);

        run("render", request.toString(), "-t", "{{sum}}", "--locale", "de-DE");

        assertThat(out().strip()).isEqualTo("1.059");
    }

    @Test
    @DisplayName("adds metrics on request")
    void shouldIncludeMetrics() throws Exception {
        Path request = writeFile("request.json", SALES_REQUEST);

        run("render", request.toString(), "-t", "{{metric_count}}");
        run("render", request.toString(), "-t", "{{metric_count}}", "--include-metrics");

        assertThat(out().lines()).containsExactly("{{metric_count}}", "2");
    }

    @Test
    @DisplayName("reads settings from a properties file")
    void shouldReadConfigFile() throws Exception {
        Path request = writeFile("request.json", SALES_REQUEST);
        Path config =
                writeFile(
                        "colabel.properties",
                        "colabel.max-fraction-digits=1\ncolabel.trim-result=false\n");

        run("render", request.toString(), "-c", config.toString(), "-t", " {{avg}} ");

        assertThat(out()).isEqualTo(" 353 " + System.lineSeparator());
    }

    @Test
    @DisplayName("echoes render events with --verbose")
    void shouldPrintEventsWhenVerbose() throws Exception {
        Path request = writeFile("request.json", SALES_REQUEST);

        run("render", request.toString(), "-v", "-t", "{% if is_metric %}m{% endif %}{{nope}}");

        assertThat(err()).contains("block [is_metric] -> no branch").contains("{{nope}}");
    }

    @Test
    @DisplayName("fails with exit code 1 for a missing file")
    void shouldFailForMissingFile() {
        int exitCode = run("render", tempDir.resolve("missing.json").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err()).contains(" [FAIL] Render failed: Cannot read");
    }

    @Test
    @DisplayName("fails for an invalid request")
    void shouldFailForInvalidRequest() throws Exception {
        Path request = writeFile("request.json", "{\"template\": \"x\"}");

        int exitCode = run("render", request.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err()).contains("[FAIL]");
    }

    @Test
    @DisplayName("fails for an unknown locale")
    void shouldFailForUnknownLocale() throws Exception {
        Path request = writeFile("request.json", SALES_REQUEST);

        int exitCode = run("render", request.toString(), "--locale", "!!");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err()).contains("Unknown locale");
    }
}

package com.linkgraph.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.linkgraph.cli.CliRunner.resource;
import static com.linkgraph.cli.CliRunner.run;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DiffCommand}.
 */
class DiffCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void diff_reportsMissingAndRetypedColumns() {
        CliRunner.Result result = run("diff", resource("/schemas/expected.json"), resource("/schemas/actual.json"));

        assertThat(result.exitCode()).isZero();
        assertThat(result.output())
            .contains("missing   Phone")
            .contains("type      Email: expected string, actual text")
            .contains("default   Email: expected 'n/a', actual 'unknown'")
            .contains("Incompatible")
            .doesNotContain("CreatedAt");
    }

    @Test
    void diff_failOnBreaking_returnsTwo() {
        CliRunner.Result result = run("diff", resource("/schemas/expected.json"), resource("/schemas/actual.json"),
            "--fail-on-breaking");

        assertThat(result.exitCode()).isEqualTo(2);
    }

    @Test
    void diff_identicalSchemas_reportsNoDifferences() {
        CliRunner.Result result = run("diff", resource("/schemas/expected.json"), resource("/schemas/expected.json"),
            "--fail-on-breaking");

        assertThat(result.exitCode()).isZero();
        assertThat(result.output()).contains("No differences");
    }

    @Test
    void diff_invalidJson_failsWithOne() throws IOException {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{not json");

        CliRunner.Result result = run("diff", broken.toString(), resource("/schemas/actual.json"));

        assertThat(result.exitCode()).isEqualTo(1);
    }
}

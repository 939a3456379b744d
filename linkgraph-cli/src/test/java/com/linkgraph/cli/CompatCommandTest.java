package com.linkgraph.cli;

import org.junit.jupiter.api.Test;

import static com.linkgraph.cli.CliRunner.run;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CompatCommand} and {@link ListCommand}.
 */
class CompatCommandTest {

    @Test
    void compat_allowedConversion_exitsZero() {
        CliRunner.Result result = run("compat", "number", "string");

        assertThat(result.exitCode()).isZero();
        assertThat(result.output()).contains("number -> string: compatible");
    }

    @Test
    void compat_reverseDirection_exitsOne() {
        CliRunner.Result result = run("compat", "string", "number");

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.output()).contains("string -> number: incompatible");
    }

    @Test
    void list_kinds_printsEveryKind() {
        CliRunner.Result result = run("list", "kinds");

        assertThat(result.exitCode()).isZero();
        assertThat(result.output()).contains("TRIGGER", "DATA_SOURCE", "CONDITIONAL");
    }

    @Test
    void list_types_printsConversionTable() {
        CliRunner.Result result = run("list", "types");

        assertThat(result.exitCode()).isZero();
        assertThat(result.output()).contains("boolean -> number, string", "number -> string");
    }

    @Test
    void list_unknownType_exitsOne() {
        assertThat(run("list", "widgets").exitCode()).isEqualTo(1);
    }

    @Test
    void root_withoutCommand_printsBanner() {
        CliRunner.Result result = run("-v");

        assertThat(result.exitCode()).isZero();
        assertThat(result.output()).contains("linkgraph --help");
    }
}

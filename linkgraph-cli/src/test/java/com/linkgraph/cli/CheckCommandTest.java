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
 * Tests for {@link CheckCommand}.
 */
class CheckCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void check_workflow_reportsEdgesAndRefusal() {
        CliRunner.Result result = run("check", resource("/diagrams/workflow.yaml"));

        assertThat(result.exitCode()).isZero();
        assertThat(result.output())
            .contains("Nodes: 4, edges: 2, refused: 1")
            .contains("Load -> Shape  NORMAL")
            .contains("Shape -> Publish  NORMAL")
            .contains("refused Load -> Sum  INCOMPATIBLE_TYPES");
    }

    @Test
    void check_strictWithRefusal_failsWithTwo() {
        CliRunner.Result result = run("check", resource("/diagrams/workflow.yaml"), "--strict");

        assertThat(result.exitCode()).isEqualTo(2);
    }

    @Test
    void check_erd_flagsUndeclaredRelationship() {
        CliRunner.Result result = run("check", resource("/diagrams/erd.yaml"));

        assertThat(result.exitCode()).isZero();
        assertThat(result.output())
            .contains("Orders.CustomerId -> Customer.Id  NORMAL")
            .contains("Orders.ProductId -> Product.Id  WARNING  No key relationship between Orders.ProductId and Product.Id");
    }

    @Test
    void check_pipeline_infersJoinSchema() {
        CliRunner.Result result = run("check", resource("/diagrams/pipeline.json"), "--schemas", "--strict");

        assertThat(result.exitCode()).isZero();
        assertThat(result.output())
            .contains("Nodes: 4, edges: 3, refused: 0")
            .contains("Join -> Report  NORMAL")
            .contains("Join: [Id:int, Country:string, CustomerId:int, Total:decimal]")
            .contains("Report: -");
    }

    @Test
    void check_unknownNode_failsWithOne() {
        CliRunner.Result result = run("check", resource("/diagrams/broken.yaml"));

        assertThat(result.exitCode()).isEqualTo(1);
    }

    @Test
    void check_selfConnection_failsWithOne() throws IOException {
        Path diagram = tempDir.resolve("self.yaml");
        Files.writeString(diagram, """
            nodes:
              - { name: A, inputs: [any], outputs: [any] }
            connections:
              - { from: A, to: A }
            """);

        CliRunner.Result result = run("check", diagram.toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.output()).doesNotContain("Nodes:");
    }

    @Test
    void check_missingFile_failsWithOne() {
        CliRunner.Result result = run("check", tempDir.resolve("nope.yaml").toString());

        assertThat(result.exitCode()).isEqualTo(1);
    }

    @Test
    void check_configDisallowingPair_refusesConnection() throws IOException {
        Path config = tempDir.resolve("linkgraph.yaml");
        Files.writeString(config, """
            disallowedKindPairs:
              - source: TRANSFORM
                target: OUTPUT
            """);

        CliRunner.Result result = run("check", resource("/diagrams/workflow.yaml"), "--config", config.toString());

        assertThat(result.output()).contains("refused Shape -> Publish  DISALLOWED_NODE_KINDS");
    }
}

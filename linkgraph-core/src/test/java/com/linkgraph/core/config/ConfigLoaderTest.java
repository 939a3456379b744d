package com.linkgraph.core.config;

import com.linkgraph.core.model.NodeKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            propertyKeys:
              outputSchema: "Out"
              entityName: "Table"

            warningColor: "#FFC107"
            animateAutomationEdges: false

            disallowedKindPairs:
              - source: TRIGGER
                target: OUTPUT

            dataFlowColors:
              string: "#111111"
            """);

        EngineConfig config = ConfigLoader.load(configFile);

        assertThat(config.propertyKeys().outputSchema()).isEqualTo("Out");
        assertThat(config.propertyKeys().entityName()).isEqualTo("Table");
        assertThat(config.propertyKeys().expectedSchema()).isEqualTo("ExpectedSchema");
        assertThat(config.warningColor()).isEqualTo("#FFC107");
        assertThat(config.animateAutomationEdges()).isFalse();
        assertThat(config.disallowedKindPairs())
            .containsExactly(new EngineConfig.KindPair(NodeKind.TRIGGER, NodeKind.OUTPUT));
        assertThat(config.dataFlowColorFor("String")).isEqualTo("#111111");
        assertThat(config.dataFlowColorFor("number")).isEqualTo(EngineConfig.DEFAULT_DATA_FLOW_COLOR);
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            warningColor: "#FF0000"
            """);

        EngineConfig config = ConfigLoader.load(configFile);

        assertThat(config.warningColor()).isEqualTo("#FF0000");
        assertThat(config.propertyKeys()).isEqualTo(EngineConfig.PropertyKeys.defaults());
        assertThat(config.animateAutomationEdges()).isTrue();
        assertThat(config.disallowedKindPairs()).containsExactlyInAnyOrder(
            new EngineConfig.KindPair(NodeKind.TRIGGER, NodeKind.TRIGGER),
            new EngineConfig.KindPair(NodeKind.DATA_SOURCE, NodeKind.DATA_SOURCE));
    }

    @Test
    void load_missingFile_returnsDefaults() {
        EngineConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(EngineConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            warningColor: [unclosed
              - broken: {
            """);

        EngineConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(EngineConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        EngineConfig config = ConfigLoader.load(tempDir);

        assertThat(config).isEqualTo(EngineConfig.defaults());
    }

    @Test
    void defaults_dataFlowColors_matchTypeTable() {
        EngineConfig config = EngineConfig.defaults();

        assertThat(config.warningColor()).isEqualTo("#FF9800");
        assertThat(config.dataFlowColorFor("string")).isEqualTo("#008000");
        assertThat(config.dataFlowColorFor("number")).isEqualTo("#0000FF");
        assertThat(config.dataFlowColorFor("binary")).isEqualTo("#808080");
        assertThat(config.dataFlowColorFor("any")).isEqualTo("#00FFFF");
        assertThat(config.dataFlowColorFor(null)).isEqualTo("#00FFFF");
    }
}

package com.linkgraph.cli.diagram;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads diagram files. YAML and JSON are both accepted, since JSON is valid YAML.
 */
public final class DiagramLoader {

    private static final Logger log = LoggerFactory.getLogger(DiagramLoader.class);

    private static final ObjectMapper MAPPER = YAMLMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    private DiagramLoader() {
        // Utility class
    }

    /**
     * Loads a diagram file.
     *
     * @param path YAML or JSON file
     * @return parsed diagram
     * @throws DiagramException if the file is missing, unreadable or malformed
     */
    public static DiagramFile load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new DiagramException("Diagram file not found: " + path);
        }
        try {
            log.debug("Loading diagram from: {}", path);
            DiagramFile diagram = MAPPER.readValue(path.toFile(), DiagramFile.class);
            if (diagram == null) {
                throw new DiagramException("Diagram file is empty: " + path);
            }
            return diagram;
        } catch (IOException e) {
            throw new DiagramException("Failed to parse diagram file " + path + ": " + e.getMessage(), e);
        }
    }
}

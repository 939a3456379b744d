package com.linkgraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.linkgraph.core.model.NodeKind;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Settings of the connection engine.
 *
 * <p>Loaded from {@code linkgraph.yaml}. Every section is optional; missing sections fall back
 * to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * propertyKeys:
 *   outputSchema: OutputSchema
 *   expectedSchema: ExpectedSchema
 *
 * warningColor: "#FF9800"
 * animateAutomationEdges: true
 *
 * disallowedKindPairs:
 *   - source: TRIGGER
 *     target: TRIGGER
 *
 * dataFlowColors:
 *   string: "#008000"
 * }</pre>
 *
 * @param propertyKeys names of the well-known node property keys
 * @param warningColor indicator color used for semantic warnings
 * @param animateAutomationEdges whether new automation edges show animated data flow
 * @param disallowedKindPairs automation kind pairs that may not be connected
 * @param dataFlowColors data flow color per output port type tag
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
    @JsonProperty("propertyKeys") PropertyKeys propertyKeys,
    @JsonProperty("warningColor") String warningColor,
    @JsonProperty("animateAutomationEdges") Boolean animateAutomationEdges,
    @JsonProperty("disallowedKindPairs") List<KindPair> disallowedKindPairs,
    @JsonProperty("dataFlowColors") Map<String, String> dataFlowColors
) {
    /** Amber */
    public static final String DEFAULT_WARNING_COLOR = "#FF9800";

    /** Cyan, for {@code any} and unknown types */
    public static final String DEFAULT_DATA_FLOW_COLOR = "#00FFFF";

    private static final Map<String, String> DEFAULT_DATA_FLOW_COLORS = Map.of(
        "string", "#008000",
        "number", "#0000FF",
        "boolean", "#FFA500",
        "object", "#800080",
        "array", "#FF0000",
        "file", "#A52A2A",
        "image", "#FFC0CB",
        "binary", "#808080"
    );

    /**
     * Compact constructor filling unset sections with defaults.
     */
    public EngineConfig {
        if (propertyKeys == null) {
            propertyKeys = PropertyKeys.defaults();
        }
        if (warningColor == null || warningColor.isBlank()) {
            warningColor = DEFAULT_WARNING_COLOR;
        }
        if (animateAutomationEdges == null) {
            animateAutomationEdges = Boolean.TRUE;
        }
        disallowedKindPairs = disallowedKindPairs == null
            ? List.of(new KindPair(NodeKind.TRIGGER, NodeKind.TRIGGER), new KindPair(NodeKind.DATA_SOURCE, NodeKind.DATA_SOURCE))
            : List.copyOf(disallowedKindPairs);
        dataFlowColors = dataFlowColors == null ? DEFAULT_DATA_FLOW_COLORS : Map.copyOf(dataFlowColors);
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static EngineConfig defaults() {
        return new EngineConfig(null, null, null, null, null);
    }

    /**
     * Returns the data flow color for a port type tag.
     *
     * @param dataType type tag, may be null
     * @return configured color, or cyan for unknown types
     */
    public String dataFlowColorFor(String dataType) {
        if (dataType == null) {
            return DEFAULT_DATA_FLOW_COLOR;
        }
        return dataFlowColors.getOrDefault(dataType.trim().toLowerCase(Locale.ROOT), DEFAULT_DATA_FLOW_COLOR);
    }

    /**
     * Names of the node properties the engine reads and writes.
     *
     * @param outputSchema property holding a node's output schema
     * @param expectedSchema property holding the schema a sink expects
     * @param columns property holding an entity's columns
     * @param foreignKeys property holding an entity's declared foreign keys
     * @param entityName property holding an entity's name
     * @param kind property holding a transform's kind (e.g. {@code Join})
     * @param joinKeyLeft property holding the left join key column
     * @param joinKeyRight property holding the right join key column
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PropertyKeys(
        @JsonProperty("outputSchema") String outputSchema,
        @JsonProperty("expectedSchema") String expectedSchema,
        @JsonProperty("columns") String columns,
        @JsonProperty("foreignKeys") String foreignKeys,
        @JsonProperty("entityName") String entityName,
        @JsonProperty("kind") String kind,
        @JsonProperty("joinKeyLeft") String joinKeyLeft,
        @JsonProperty("joinKeyRight") String joinKeyRight
    ) {
        public PropertyKeys {
            outputSchema = orDefault(outputSchema, "OutputSchema");
            expectedSchema = orDefault(expectedSchema, "ExpectedSchema");
            columns = orDefault(columns, "Columns");
            foreignKeys = orDefault(foreignKeys, "ForeignKeys");
            entityName = orDefault(entityName, "EntityName");
            kind = orDefault(kind, "Kind");
            joinKeyLeft = orDefault(joinKeyLeft, "JoinKeyLeft");
            joinKeyRight = orDefault(joinKeyRight, "JoinKeyRight");
        }

        public static PropertyKeys defaults() {
            return new PropertyKeys(null, null, null, null, null, null, null, null);
        }

        private static String orDefault(String value, String fallback) {
            return value == null || value.isBlank() ? fallback : value;
        }
    }

    /**
     * Ordered pair of automation node kinds (source kind, target kind).
     *
     * @param source kind of the source node
     * @param target kind of the target node
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record KindPair(
        @JsonProperty("source") NodeKind source,
        @JsonProperty("target") NodeKind target
    ) {}
}

package com.linkgraph.core.schema;

import com.linkgraph.core.config.EngineConfig.PropertyKeys;
import com.linkgraph.core.graph.DiagramNode;
import com.linkgraph.core.model.ColumnDefinition;
import com.linkgraph.core.model.ColumnSchema;
import com.linkgraph.core.model.ForeignKeyDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed view over the well-known metadata properties of a node.
 *
 * <p>Hosts may store schemas and foreign keys either as typed values ({@link ColumnSchema},
 * lists of {@link ColumnDefinition} or {@link ForeignKeyDefinition}) or as their serialized JSON
 * text. Text is decoded here, at the boundary; a payload that cannot be decoded reads as
 * absent, and {@link #declares} tells it apart from a missing one.
 */
public final class NodeMetadata {

    private static final Logger log = LoggerFactory.getLogger(NodeMetadata.class);

    private final PropertyKeys keys;

    public NodeMetadata(PropertyKeys keys) {
        this.keys = Objects.requireNonNull(keys, "keys must not be null");
    }

    public PropertyKeys keys() {
        return keys;
    }

    public Optional<ColumnSchema> outputSchema(DiagramNode node) {
        return schema(node, keys.outputSchema());
    }

    public Optional<ColumnSchema> expectedSchema(DiagramNode node) {
        return schema(node, keys.expectedSchema());
    }

    /**
     * Returns true if the node carries a non-blank value under {@code key}, decodable or not.
     *
     * @param node node to read
     * @param key property key
     * @return true if a value is present
     */
    public boolean declares(DiagramNode node, String key) {
        return node.properties().value(key)
            .map(value -> !(value instanceof CharSequence text) || !text.toString().isBlank())
            .orElse(false);
    }

    /**
     * Returns the entity columns of a node, empty when it declares none.
     *
     * @param node entity node
     * @return declared columns
     */
    public ColumnSchema columns(DiagramNode node) {
        return schema(node, keys.columns()).orElse(ColumnSchema.empty());
    }

    /**
     * Reads a schema-valued property.
     *
     * @param node node to read
     * @param key property key
     * @return decoded schema, empty if absent, blank or undecodable
     */
    public Optional<ColumnSchema> schema(DiagramNode node, String key) {
        Optional<Object> raw = node.properties().value(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        Object value = raw.get();
        if (value instanceof ColumnSchema schema) {
            return Optional.of(schema);
        }
        if (value instanceof List<?> list) {
            return Optional.of(new ColumnSchema(list.stream()
                .filter(ColumnDefinition.class::isInstance)
                .map(ColumnDefinition.class::cast)
                .toList()));
        }
        String text = value.toString();
        if (text.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(SchemaCodec.decodeSchema(text));
        } catch (SchemaFormatException e) {
            log.debug("Ignoring undecodable {} on node {}: {}", key, node.name(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Returns the foreign keys a node declares.
     *
     * @param node entity node
     * @return declared foreign keys, empty if none or undecodable
     */
    public List<ForeignKeyDefinition> foreignKeys(DiagramNode node) {
        Optional<Object> raw = node.properties().value(keys.foreignKeys());
        if (raw.isEmpty()) {
            return List.of();
        }
        Object value = raw.get();
        if (value instanceof List<?> list) {
            return list.stream()
                .filter(ForeignKeyDefinition.class::isInstance)
                .map(ForeignKeyDefinition.class::cast)
                .toList();
        }
        try {
            return SchemaCodec.decodeForeignKeys(value.toString());
        } catch (SchemaFormatException e) {
            log.debug("Ignoring undecodable {} on node {}: {}", keys.foreignKeys(), node.name(), e.getMessage());
            return List.of();
        }
    }

    /**
     * Returns the entity name of a node: its entity-name property, else its display name.
     *
     * @param node entity node
     * @return entity name, never null
     */
    public String entityName(DiagramNode node) {
        return node.properties().text(keys.entityName())
            .orElse(node.name() == null ? "" : node.name());
    }

    public Optional<String> kind(DiagramNode node) {
        return node.properties().text(keys.kind());
    }

    public Optional<String> joinKeyLeft(DiagramNode node) {
        return node.properties().text(keys.joinKeyLeft());
    }

    public Optional<String> joinKeyRight(DiagramNode node) {
        return node.properties().text(keys.joinKeyRight());
    }

    /**
     * Stores an inferred output schema on a node. A property the host declared as text receives
     * the JSON form; otherwise the typed schema is stored.
     *
     * @param node node to update
     * @param schema schema to store
     */
    public void storeOutputSchema(DiagramNode node, ColumnSchema schema) {
        boolean textual = node.properties().find(keys.outputSchema())
            .map(p -> p.type() == String.class)
            .orElse(false);
        node.properties().set(keys.outputSchema(), textual ? SchemaCodec.encodeSchema(schema) : schema);
    }
}

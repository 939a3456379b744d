package com.linkgraph.core.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linkgraph.core.model.ColumnDefinition;
import com.linkgraph.core.model.ColumnSchema;
import com.linkgraph.core.model.ForeignKeyDefinition;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts column schemas and foreign key lists to and from their portable JSON form.
 *
 * <p>A schema is a JSON array of
 * {@code {"name", "dataType", "isPrimaryKey", "isForeignKey", "isNullable"}} objects (plus an
 * optional {@code "id"} row identifier); a foreign key list is a JSON array of
 * {@code {"name", "columns", "referencedEntity", "referencedColumns", "onDelete", "onUpdate"}}.
 * Unknown fields are ignored.
 */
public final class SchemaCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<List<ColumnDefinition>> COLUMN_LIST = new TypeReference<>() {};
    private static final TypeReference<List<ForeignKeyDefinition>> FOREIGN_KEY_LIST = new TypeReference<>() {};

    private SchemaCodec() {
        // Utility class
    }

    /**
     * Decodes a schema.
     *
     * @param json JSON array of columns; blank text decodes to the empty schema
     * @return decoded schema
     * @throws SchemaFormatException if the text is not a valid column array
     */
    public static ColumnSchema decodeSchema(String json) {
        if (json == null || json.isBlank()) {
            return ColumnSchema.empty();
        }
        try {
            List<ColumnDefinition> columns = MAPPER.readValue(json, COLUMN_LIST);
            if (columns == null) {
                return ColumnSchema.empty();
            }
            return new ColumnSchema(columns.stream().filter(Objects::nonNull).toList());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SchemaFormatException("Invalid column schema: " + e.getMessage(), e);
        }
    }

    /**
     * Decodes a schema, returning empty instead of throwing on bad input.
     *
     * @param json JSON array of columns
     * @return decoded schema, empty if the text is blank or invalid
     */
    public static Optional<ColumnSchema> tryDecodeSchema(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(decodeSchema(json));
        } catch (SchemaFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Encodes a schema as a JSON array.
     *
     * @param schema schema to encode
     * @return JSON text
     */
    public static String encodeSchema(ColumnSchema schema) {
        try {
            return MAPPER.writeValueAsString(schema.columns());
        } catch (JsonProcessingException e) {
            throw new SchemaFormatException("Cannot encode column schema: " + e.getMessage(), e);
        }
    }

    /**
     * Decodes a foreign key list.
     *
     * @param json JSON array of foreign keys; blank text decodes to an empty list
     * @return decoded foreign keys
     * @throws SchemaFormatException if the text is not a valid foreign key array
     */
    public static List<ForeignKeyDefinition> decodeForeignKeys(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<ForeignKeyDefinition> keys = MAPPER.readValue(json, FOREIGN_KEY_LIST);
            if (keys == null) {
                return List.of();
            }
            return keys.stream().filter(Objects::nonNull).toList();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SchemaFormatException("Invalid foreign key list: " + e.getMessage(), e);
        }
    }

    /**
     * Encodes a foreign key list as a JSON array.
     *
     * @param foreignKeys keys to encode
     * @return JSON text
     */
    public static String encodeForeignKeys(List<ForeignKeyDefinition> foreignKeys) {
        try {
            return MAPPER.writeValueAsString(foreignKeys);
        } catch (JsonProcessingException e) {
            throw new SchemaFormatException("Cannot encode foreign keys: " + e.getMessage(), e);
        }
    }
}

package com.linkgraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.UUID;

/**
 * Describes a single column of an entity or of the data flowing along an edge.
 *
 * <p>The {@code id} doubles as the row identifier used by column-granular ports: a port whose
 * row id equals a column's id represents that column.
 *
 * @param id row identifier, unique within the owning node's column list (generated when absent)
 * @param name column name
 * @param dataType free-form data type tag (e.g. {@code int}, {@code string}); empty means unspecified
 * @param primaryKey whether the column is (part of) the primary key
 * @param foreignKey whether the column is flagged as a foreign key
 * @param nullable whether the column accepts nulls
 * @param defaultValue default value expression, empty when none
 * @param description optional description
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ColumnDefinition(
    @JsonProperty("id") UUID id,
    @JsonProperty("name") String name,
    @JsonProperty("dataType") String dataType,
    @JsonProperty("isPrimaryKey") boolean primaryKey,
    @JsonProperty("isForeignKey") boolean foreignKey,
    @JsonProperty("isNullable") boolean nullable,
    @JsonProperty("defaultValue") String defaultValue,
    @JsonProperty("description") String description
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public ColumnDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (dataType == null) {
            dataType = "";
        }
        if (defaultValue == null) {
            defaultValue = "";
        }
        if (description == null) {
            description = "";
        }
    }

    /**
     * Creates a nullable, non-key column with a fresh row id.
     *
     * @param name column name
     * @param dataType data type tag
     * @return column definition
     */
    public static ColumnDefinition of(String name, String dataType) {
        return new ColumnDefinition(null, name, dataType, false, false, true, "", "");
    }

    /**
     * Creates a non-nullable primary key column.
     *
     * @param name column name
     * @param dataType data type tag
     * @return column definition
     */
    public static ColumnDefinition primaryKey(String name, String dataType) {
        return new ColumnDefinition(null, name, dataType, true, false, false, "", "");
    }

    /**
     * Creates a column flagged as foreign key.
     *
     * @param name column name
     * @param dataType data type tag
     * @return column definition
     */
    public static ColumnDefinition foreignKey(String name, String dataType) {
        return new ColumnDefinition(null, name, dataType, false, true, true, "", "");
    }

    /**
     * Returns true when a data type tag is present.
     *
     * @return true if data type is specified
     */
    public boolean hasDataType() {
        return !dataType.isBlank();
    }

    /**
     * Returns true when this column's name equals the given name, ignoring case.
     *
     * @param other name to compare
     * @return true on a case-insensitive match
     */
    public boolean isNamed(String other) {
        return other != null && name.equalsIgnoreCase(other.trim());
    }
}

package com.linkgraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Foreign key constraint declared by an entity node.
 *
 * <p>{@code columns} and {@code referencedColumns} are matched positionally, so composite keys
 * keep their order.
 *
 * @param name constraint name
 * @param columns local column names forming the key
 * @param referencedEntity name of the referenced entity node
 * @param referencedColumns referenced column names, same order as {@code columns}
 * @param onDelete on-delete behavior (free form, e.g. {@code CASCADE})
 * @param onUpdate on-update behavior (free form)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ForeignKeyDefinition(
    @JsonProperty("name") String name,
    @JsonProperty("columns") List<String> columns,
    @JsonProperty("referencedEntity") String referencedEntity,
    @JsonProperty("referencedColumns") List<String> referencedColumns,
    @JsonProperty("onDelete") String onDelete,
    @JsonProperty("onUpdate") String onUpdate
) {
    /**
     * Compact constructor with defaults.
     */
    public ForeignKeyDefinition {
        if (name == null) {
            name = "";
        }
        columns = columns == null ? List.of() : List.copyOf(columns);
        if (referencedEntity == null) {
            referencedEntity = "";
        }
        referencedColumns = referencedColumns == null ? List.of() : List.copyOf(referencedColumns);
        if (onDelete == null) {
            onDelete = "";
        }
        if (onUpdate == null) {
            onUpdate = "";
        }
    }

    /**
     * Returns true if this key references the given entity and pairs {@code localColumn} with
     * {@code referencedColumn} at the same position. Names compare case-insensitively.
     *
     * @param entity referenced entity name
     * @param localColumn local column name
     * @param referencedColumn referenced column name
     * @return true on a positional match
     */
    public boolean links(String entity, String localColumn, String referencedColumn) {
        if (!referencedEntity.equalsIgnoreCase(entity)) {
            return false;
        }
        int pairs = Math.min(columns.size(), referencedColumns.size());
        for (int i = 0; i < pairs; i++) {
            if (columns.get(i).equalsIgnoreCase(localColumn)
                && referencedColumns.get(i).equalsIgnoreCase(referencedColumn)) {
                return true;
            }
        }
        return false;
    }
}

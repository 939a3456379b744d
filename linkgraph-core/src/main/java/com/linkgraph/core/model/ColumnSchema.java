package com.linkgraph.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ordered list of column descriptors describing the data carried by an edge or produced by a node.
 *
 * <p>Its portable text form is a JSON array of {@link ColumnDefinition} objects, handled by
 * {@code SchemaCodec}; in memory it is always this typed record.
 *
 * @param columns ordered columns
 */
public record ColumnSchema(List<ColumnDefinition> columns) {

    private static final ColumnSchema EMPTY = new ColumnSchema(List.of());

    /**
     * Compact constructor taking a defensive copy.
     */
    public ColumnSchema {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    /**
     * Returns the schema with no columns.
     *
     * @return empty schema
     */
    public static ColumnSchema empty() {
        return EMPTY;
    }

    /**
     * Creates a schema from the given columns.
     *
     * @param columns columns in order
     * @return schema
     */
    public static ColumnSchema of(ColumnDefinition... columns) {
        return new ColumnSchema(List.of(columns));
    }

    /**
     * Finds a column by name, ignoring case.
     *
     * @param name column name
     * @return the first matching column
     */
    public Optional<ColumnDefinition> findByName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return columns.stream().filter(c -> c.isNamed(name)).findFirst();
    }

    /**
     * Finds a column by its row identifier.
     *
     * @param rowId row identifier
     * @return the matching column
     */
    public Optional<ColumnDefinition> findByRowId(UUID rowId) {
        if (rowId == null) {
            return Optional.empty();
        }
        return columns.stream().filter(c -> rowId.equals(c.id())).findFirst();
    }

    /**
     * Returns a new schema with the given columns appended, skipping names already present.
     *
     * @param extra columns to append
     * @return combined schema
     */
    public ColumnSchema appendDistinct(List<ColumnDefinition> extra) {
        List<ColumnDefinition> merged = new ArrayList<>(columns);
        for (ColumnDefinition column : extra) {
            boolean present = merged.stream().anyMatch(c -> c.isNamed(column.name()));
            if (!present) {
                merged.add(column);
            }
        }
        return new ColumnSchema(merged);
    }

    public boolean isEmpty() {
        return columns.isEmpty();
    }

    public int size() {
        return columns.size();
    }
}

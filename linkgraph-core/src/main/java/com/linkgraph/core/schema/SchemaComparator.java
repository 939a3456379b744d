package com.linkgraph.core.schema;

import com.linkgraph.core.model.ColumnDefinition;
import com.linkgraph.core.model.ColumnSchema;
import com.linkgraph.core.model.SchemaDiff;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Compares an expected schema against the schema actually arriving on an edge.
 */
public final class SchemaComparator {

    private SchemaComparator() {
        // Utility class
    }

    /**
     * Returns true if every expected column exists in {@code actual} by case-insensitive name and,
     * where both sides specify a data type, the types match case-insensitively.
     *
     * <p>Extra columns in {@code actual} never break compatibility.
     *
     * @param expected expected schema
     * @param actual actual schema
     * @return true if compatible
     */
    public static boolean schemasCompatible(ColumnSchema expected, ColumnSchema actual) {
        for (ColumnDefinition e : expected.columns()) {
            Optional<ColumnDefinition> a = actual.findByName(e.name());
            if (a.isEmpty()) {
                return false;
            }
            if (!typesAgree(e, a.get())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Text variant of {@link #schemasCompatible(ColumnSchema, ColumnSchema)}. A payload that
     * cannot be decoded makes the pair incompatible.
     *
     * @param expectedJson expected schema as JSON
     * @param actualJson actual schema as JSON
     * @return true if both decode and are compatible
     */
    public static boolean schemasCompatible(String expectedJson, String actualJson) {
        try {
            return schemasCompatible(SchemaCodec.decodeSchema(expectedJson), SchemaCodec.decodeSchema(actualJson));
        } catch (SchemaFormatException e) {
            return false;
        }
    }

    /**
     * Computes the structured differences between two schemas.
     *
     * <p>Expected columns with a blank name are skipped. Nullability and default values are
     * compared for every column present on both sides; defaults compare case-sensitively.
     *
     * @param expected expected schema
     * @param actual actual schema
     * @return differences, empty when the schemas agree
     */
    public static SchemaDiff diff(ColumnSchema expected, ColumnSchema actual) {
        List<String> missing = new ArrayList<>();
        List<SchemaDiff.TypeDifference> types = new ArrayList<>();
        List<SchemaDiff.NullabilityDifference> nullability = new ArrayList<>();
        List<SchemaDiff.DefaultDifference> defaults = new ArrayList<>();

        for (ColumnDefinition e : expected.columns()) {
            if (e.name().isBlank()) {
                continue;
            }
            Optional<ColumnDefinition> match = actual.findByName(e.name());
            if (match.isEmpty()) {
                missing.add(e.name());
                continue;
            }
            ColumnDefinition a = match.get();
            if (!typesAgree(e, a)) {
                types.add(new SchemaDiff.TypeDifference(e.name(), e.dataType(), a.dataType()));
            }
            if (e.nullable() != a.nullable()) {
                nullability.add(new SchemaDiff.NullabilityDifference(e.name(), e.nullable(), a.nullable()));
            }
            if (!e.defaultValue().equals(a.defaultValue())) {
                defaults.add(new SchemaDiff.DefaultDifference(e.name(), e.defaultValue(), a.defaultValue()));
            }
        }
        return new SchemaDiff(missing, types, nullability, defaults);
    }

    static boolean typesAgree(ColumnDefinition left, ColumnDefinition right) {
        if (!left.hasDataType() || !right.hasDataType()) {
            return true;
        }
        return left.dataType().trim().equalsIgnoreCase(right.dataType().trim());
    }
}

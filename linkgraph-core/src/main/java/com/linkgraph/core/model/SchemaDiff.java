package com.linkgraph.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured differences between an expected and an actual schema.
 *
 * @param missingColumns expected column names absent from the actual schema
 * @param typeDifferences columns present on both sides whose data types disagree
 * @param nullabilityDifferences columns present on both sides whose nullability disagrees
 * @param defaultDifferences columns present on both sides whose default values disagree
 */
public record SchemaDiff(
    List<String> missingColumns,
    List<TypeDifference> typeDifferences,
    List<NullabilityDifference> nullabilityDifferences,
    List<DefaultDifference> defaultDifferences
) {
    public SchemaDiff {
        missingColumns = missingColumns == null ? List.of() : List.copyOf(missingColumns);
        typeDifferences = typeDifferences == null ? List.of() : List.copyOf(typeDifferences);
        nullabilityDifferences = nullabilityDifferences == null ? List.of() : List.copyOf(nullabilityDifferences);
        defaultDifferences = defaultDifferences == null ? List.of() : List.copyOf(defaultDifferences);
    }

    /**
     * Returns true if any category holds a difference.
     *
     * @return true when the schemas differ
     */
    public boolean hasDifferences() {
        return !missingColumns.isEmpty() || !typeDifferences.isEmpty()
            || !nullabilityDifferences.isEmpty() || !defaultDifferences.isEmpty();
    }

    /**
     * Returns true if the differences break name/type compatibility. Nullability and default
     * differences alone do not.
     *
     * @return true when a column is missing or typed differently
     */
    public boolean breaksCompatibility() {
        return !missingColumns.isEmpty() || !typeDifferences.isEmpty();
    }

    /**
     * Renders a one-line summary, e.g. {@code missing [Email]; type Id: int != string}.
     *
     * @return summary text, empty when there are no differences
     */
    public String summary() {
        List<String> parts = new ArrayList<>();
        if (!missingColumns.isEmpty()) {
            parts.add("missing " + missingColumns);
        }
        for (TypeDifference d : typeDifferences) {
            parts.add("type " + d.column() + ": " + d.expectedType() + " != " + d.actualType());
        }
        for (NullabilityDifference d : nullabilityDifferences) {
            parts.add("nullable " + d.column() + ": " + d.expectedNullable() + " != " + d.actualNullable());
        }
        for (DefaultDifference d : defaultDifferences) {
            parts.add("default " + d.column() + ": '" + d.expectedDefault() + "' != '" + d.actualDefault() + "'");
        }
        return String.join("; ", parts);
    }

    /**
     * A data type disagreement.
     *
     * @param column column name
     * @param expectedType expected data type
     * @param actualType actual data type
     */
    public record TypeDifference(String column, String expectedType, String actualType) {}

    /**
     * A nullability disagreement.
     *
     * @param column column name
     * @param expectedNullable expected nullability
     * @param actualNullable actual nullability
     */
    public record NullabilityDifference(String column, boolean expectedNullable, boolean actualNullable) {}

    /**
     * A default value disagreement. An empty string stands for "no default".
     *
     * @param column column name
     * @param expectedDefault expected default expression
     * @param actualDefault actual default expression
     */
    public record DefaultDifference(String column, String expectedDefault, String actualDefault) {}
}

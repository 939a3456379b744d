package com.linkgraph.core.schema;

import com.linkgraph.core.model.ColumnDefinition;
import com.linkgraph.core.model.ColumnSchema;
import com.linkgraph.core.model.SchemaDiff;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SchemaComparator}.
 */
class SchemaComparatorTest {

    private static final ColumnSchema EXPECTED = ColumnSchema.of(
        ColumnDefinition.of("Id", "int"),
        ColumnDefinition.of("Email", "string"));

    @Test
    void schemasCompatible_sameColumnsDifferentCase_returnsTrue() {
        ColumnSchema actual = ColumnSchema.of(ColumnDefinition.of("ID", "INT"), ColumnDefinition.of("email", "String"));

        assertThat(SchemaComparator.schemasCompatible(EXPECTED, actual)).isTrue();
    }

    @Test
    void schemasCompatible_extraActualColumn_staysCompatible() {
        ColumnSchema actual = ColumnSchema.of(
            ColumnDefinition.of("Id", "int"),
            ColumnDefinition.of("Email", "string"),
            ColumnDefinition.of("CreatedAt", "datetime"));

        assertThat(SchemaComparator.schemasCompatible(EXPECTED, actual)).isTrue();
    }

    @Test
    void schemasCompatible_unspecifiedType_matchesAnyType() {
        ColumnSchema actual = ColumnSchema.of(ColumnDefinition.of("Id", ""), ColumnDefinition.of("Email", "string"));

        assertThat(SchemaComparator.schemasCompatible(EXPECTED, actual)).isTrue();
    }

    @Test
    void schemasCompatible_missingColumn_returnsFalse() {
        ColumnSchema actual = ColumnSchema.of(ColumnDefinition.of("Id", "int"));

        assertThat(SchemaComparator.schemasCompatible(EXPECTED, actual)).isFalse();
    }

    @Test
    void schemasCompatible_typeMismatch_returnsFalse() {
        ColumnSchema actual = ColumnSchema.of(ColumnDefinition.of("Id", "string"), ColumnDefinition.of("Email", "string"));

        assertThat(SchemaComparator.schemasCompatible(EXPECTED, actual)).isFalse();
    }

    @Test
    void schemasCompatible_undecodableText_returnsFalse() {
        assertThat(SchemaComparator.schemasCompatible("[{\"name\":\"Id\"}]", "not json")).isFalse();
        assertThat(SchemaComparator.schemasCompatible("[{\"name\":\"Id\"}]", "[{\"name\":\"id\"}]")).isTrue();
    }

    @Test
    void diff_reportsEveryCategory() {
        ColumnSchema expected = ColumnSchema.of(
            ColumnDefinition.primaryKey("Id", "int"),
            ColumnDefinition.of("Email", "string"),
            ColumnDefinition.of("Phone", "string"));
        ColumnSchema actual = ColumnSchema.of(
            ColumnDefinition.of("Id", "int"),
            ColumnDefinition.of("Email", "text"));

        SchemaDiff diff = SchemaComparator.diff(expected, actual);

        assertThat(diff.missingColumns()).containsExactly("Phone");
        assertThat(diff.typeDifferences())
            .containsExactly(new SchemaDiff.TypeDifference("Email", "string", "text"));
        assertThat(diff.nullabilityDifferences())
            .containsExactly(new SchemaDiff.NullabilityDifference("Id", false, true));
        assertThat(diff.breaksCompatibility()).isTrue();
        assertThat(diff.summary()).isEqualTo("missing [Phone]; type Email: string != text; nullable Id: false != true");
    }

    @Test
    void diff_nullabilityOnly_doesNotBreakCompatibility() {
        ColumnSchema expected = ColumnSchema.of(ColumnDefinition.primaryKey("Id", "int"));
        ColumnSchema actual = ColumnSchema.of(ColumnDefinition.of("Id", "int"));

        SchemaDiff diff = SchemaComparator.diff(expected, actual);

        assertThat(diff.hasDifferences()).isTrue();
        assertThat(diff.breaksCompatibility()).isFalse();
        assertThat(SchemaComparator.schemasCompatible(expected, actual)).isTrue();
    }

    @Test
    void diff_defaultValues_reportedWhenEitherSideHasOne() {
        ColumnSchema expected = ColumnSchema.of(
            new ColumnDefinition(null, "Status", "string", false, false, true, "new", ""),
            new ColumnDefinition(null, "Region", "string", false, false, true, "EU", ""),
            ColumnDefinition.of("Note", "string"));
        ColumnSchema actual = ColumnSchema.of(
            new ColumnDefinition(null, "Status", "string", false, false, true, "open", ""),
            ColumnDefinition.of("Region", "string"),
            ColumnDefinition.of("Note", "string"));

        SchemaDiff diff = SchemaComparator.diff(expected, actual);

        assertThat(diff.defaultDifferences()).containsExactly(
            new SchemaDiff.DefaultDifference("Status", "new", "open"),
            new SchemaDiff.DefaultDifference("Region", "EU", ""));
        assertThat(diff.hasDifferences()).isTrue();
        assertThat(diff.breaksCompatibility()).isFalse();
        assertThat(diff.summary()).isEqualTo("default Status: 'new' != 'open'; default Region: 'EU' != ''");
    }

    @Test
    void diff_defaultValues_compareCaseSensitively() {
        ColumnSchema expected = ColumnSchema.of(new ColumnDefinition(null, "Flag", "string", false, false, true, "Y", ""));
        ColumnSchema actual = ColumnSchema.of(new ColumnDefinition(null, "Flag", "string", false, false, true, "y", ""));

        assertThat(SchemaComparator.diff(expected, actual).defaultDifferences())
            .containsExactly(new SchemaDiff.DefaultDifference("Flag", "Y", "y"));
    }
}

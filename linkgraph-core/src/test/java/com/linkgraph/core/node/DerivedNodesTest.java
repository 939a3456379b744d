package com.linkgraph.core.node;

import com.linkgraph.core.config.EngineConfig.PropertyKeys;
import com.linkgraph.core.model.ColumnDefinition;
import com.linkgraph.core.model.ColumnSchema;
import com.linkgraph.core.schema.InferenceResult;
import com.linkgraph.core.schema.UpstreamSchemas;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the schema-deriving node kinds.
 */
class DerivedNodesTest {

    private static final ColumnSchema CUSTOMERS = ColumnSchema.of(
        ColumnDefinition.primaryKey("Id", "int"),
        ColumnDefinition.of("Country", "string"),
        ColumnDefinition.of("Name", "string"));

    private static final ColumnSchema ORDERS = ColumnSchema.of(
        ColumnDefinition.of("CustomerId", "int"),
        ColumnDefinition.of("Name", "string"),
        ColumnDefinition.of("Total", "decimal"));

    @Test
    void join_bothInputs_concatenatesDistinctColumns() {
        JoinNode join = new JoinNode("Join");

        InferenceResult result = join.inferOutputSchema(upstream(Map.of(0, CUSTOMERS, 1, ORDERS)));

        assertThat(result.schema().columns()).extracting(ColumnDefinition::name)
            .containsExactly("Id", "Country", "Name", "CustomerId", "Total");
    }

    @Test
    void join_oneInput_infersEmptySchema() {
        JoinNode join = new JoinNode("Join");

        InferenceResult result = join.inferOutputSchema(upstream(Map.of(0, CUSTOMERS)));

        assertThat(result.status()).isEqualTo(InferenceResult.Status.INFERRED);
        assertThat(result.schema().isEmpty()).isTrue();
    }

    @Test
    void join_declaresKindAndKeys() {
        JoinNode join = new JoinNode("Join").joinOn("Id", "CustomerId");

        assertThat(join.properties().text("Kind")).contains("Join");
        assertThat(join.properties().text("JoinKeyLeft")).contains("Id");
        assertThat(join.properties().text("JoinKeyRight")).contains("CustomerId");
        assertThat(join.inputPorts()).hasSize(2);
    }

    @Test
    void configuredKindKey_usedByEveryDerivedKind() {
        PropertyKeys keys = new PropertyKeys(null, null, null, null, null, "NodeType", null, null);

        assertThat(new JoinNode("J", keys).properties().text("NodeType")).contains("Join");
        assertThat(new AggregateNode("A", keys).properties().text("NodeType")).contains(AggregateNode.KIND);
        assertThat(new DerivedColumnNode("D", keys).properties().text("NodeType")).contains(DerivedColumnNode.KIND);
        assertThat(new AggregateNode("A", keys).properties().text("Kind")).isEmpty();
    }

    @Test
    void aggregate_groupByAndAggregates() {
        AggregateNode aggregate = new AggregateNode("By country")
            .groupBy("country")
            .aggregate(ColumnDefinition.of("CustomerCount", "int"));

        InferenceResult result = aggregate.inferOutputSchema(upstream(Map.of(0, CUSTOMERS)));

        assertThat(result.schema().columns()).extracting(ColumnDefinition::name)
            .containsExactly("Country", "CustomerCount");
    }

    @Test
    void aggregate_unknownGroupByColumn_fails() {
        AggregateNode aggregate = new AggregateNode("By region").groupBy("Region");

        InferenceResult result = aggregate.inferOutputSchema(upstream(Map.of(0, CUSTOMERS)));

        assertThat(result.isFailure()).isTrue();
        assertThat(result.message()).contains("Region");
    }

    @Test
    void aggregate_noInput_infersEmptySchema() {
        InferenceResult result = new AggregateNode("Empty").groupBy("Country").inferOutputSchema(upstream(Map.of()));

        assertThat(result.schema().isEmpty()).isTrue();
    }

    @Test
    void derivedColumn_appendsNewColumnsOnly() {
        DerivedColumnNode derived = new DerivedColumnNode("Derive")
            .derive(ColumnDefinition.of("Name", "string"))
            .derive(ColumnDefinition.of("NameLength", "int"));

        InferenceResult result = derived.inferOutputSchema(upstream(Map.of(0, CUSTOMERS)));

        assertThat(result.schema().columns()).extracting(ColumnDefinition::name)
            .containsExactly("Id", "Country", "Name", "NameLength");
    }

    @Test
    void derivedColumn_noInput_yieldsDerivedColumns() {
        DerivedColumnNode derived = new DerivedColumnNode("Derive").derive(ColumnDefinition.of("Now", "datetime"));

        InferenceResult result = derived.inferOutputSchema(upstream(Map.of()));

        assertThat(result.schema().columns()).extracting(ColumnDefinition::name).containsExactly("Now");
    }

    private static UpstreamSchemas upstream(Map<Integer, ColumnSchema> schemas) {
        return index -> Optional.ofNullable(schemas.get(index));
    }
}

package com.linkgraph.core.validation;

import com.linkgraph.core.config.EngineConfig;
import com.linkgraph.core.graph.Edge;
import com.linkgraph.core.model.ColumnDefinition;
import com.linkgraph.core.model.EdgePolicy;
import com.linkgraph.core.model.EdgeStatus;
import com.linkgraph.core.model.ForeignKeyDefinition;
import com.linkgraph.core.node.EntityNode;
import com.linkgraph.core.node.GenericNode;
import com.linkgraph.core.schema.NodeMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PkFkValidator}.
 */
class PkFkValidatorTest {

    private static final String AMBER = "#FF9800";

    private PkFkValidator validator;
    private EntityNode orders;
    private EntityNode customer;

    @BeforeEach
    void setUp() {
        validator = new PkFkValidator(new NodeMetadata(EngineConfig.PropertyKeys.defaults()), AMBER);
        orders = new EntityNode("Orders")
            .addColumn(ColumnDefinition.primaryKey("Id", "int"))
            .addColumn(ColumnDefinition.of("CustomerId", "int"));
        customer = new EntityNode("Customer")
            .addColumn(ColumnDefinition.of("Id", "int"))
            .addColumn(ColumnDefinition.of("Name", "string"));
    }

    @Test
    void validate_declaredForeignKey_staysNormal() {
        orders.addForeignKey(new ForeignKeyDefinition("fk1", List.of("CustomerId"), "Customer", List.of("Id"), null, null));
        Edge edge = columnEdge(orders, "CustomerId", customer, "Id");

        assertThat(validator.validate(edge)).isEqualTo(PkFkVerdict.DECLARED_FOREIGN_KEY);
        assertThat(edge.status()).isEqualTo(EdgeStatus.NORMAL);
    }

    @Test
    void validate_foreignKeyDeclaredByTarget_staysNormal() {
        orders.addForeignKey(new ForeignKeyDefinition("fk1", List.of("CustomerId"), "Customer", List.of("Id"), null, null));
        Edge edge = columnEdge(customer, "Id", orders, "CustomerId");

        assertThat(validator.validate(edge)).isEqualTo(PkFkVerdict.DECLARED_FOREIGN_KEY);
        assertThat(edge.status()).isEqualTo(EdgeStatus.NORMAL);
    }

    @Test
    void validate_legacyFlags_staysNormal() {
        EntityNode invoice = new EntityNode("Invoice")
            .addColumn(ColumnDefinition.foreignKey("OrderId", "int"));
        Edge edge = columnEdge(invoice, "OrderId", orders, "Id");

        assertThat(validator.validate(edge)).isEqualTo(PkFkVerdict.FLAGS_MATCH);
        assertThat(edge.status()).isEqualTo(EdgeStatus.NORMAL);
    }

    @Test
    void validate_noKeyRelationship_marksAmberWarning() {
        Edge edge = columnEdge(orders, "CustomerId", customer, "Id");

        assertThat(validator.validate(edge)).isEqualTo(PkFkVerdict.UNRESOLVED);
        assertThat(edge.status()).isEqualTo(EdgeStatus.WARNING);
        assertThat(edge.statusColor()).isEqualTo(AMBER);
        assertThat(edge.annotations()).singleElement().asString()
            .contains("Orders.CustomerId", "Customer.Id");
    }

    @Test
    void validate_foreignKeyToOtherEntity_marksWarning() {
        orders.addForeignKey(new ForeignKeyDefinition("fk1", List.of("CustomerId"), "Client", List.of("Id"), null, null));
        Edge edge = columnEdge(orders, "CustomerId", customer, "Id");

        assertThat(validator.validate(edge)).isEqualTo(PkFkVerdict.UNRESOLVED);
    }

    @Test
    void validate_edgeWithoutRowIds_notApplicable() {
        GenericNode a = new GenericNode("A");
        GenericNode b = new GenericNode("B");
        Edge edge = new Edge(a.addOutputPort("any"), b.addInputPort("any"), EdgePolicy.FAN_OUT);

        assertThat(validator.validate(edge)).isEqualTo(PkFkVerdict.NOT_APPLICABLE);
        assertThat(edge.status()).isEqualTo(EdgeStatus.NORMAL);
    }

    private static Edge columnEdge(EntityNode from, String fromColumn, EntityNode to, String toColumn) {
        return new Edge(from.outputPortFor(fromColumn).orElseThrow(), to.inputPortFor(toColumn).orElseThrow(),
            EdgePolicy.FAN_OUT);
    }
}

package com.linkgraph.cli.diagram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.linkgraph.core.model.ColumnDefinition;
import com.linkgraph.core.model.ForeignKeyDefinition;
import com.linkgraph.core.model.Multiplicity;
import com.linkgraph.core.model.NodeKind;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A diagram fixture: nodes to create and connections to replay, in order.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * nodes:
 *   - name: Customer
 *     type: entity
 *     columns:
 *       - { name: Id, dataType: int, isPrimaryKey: true }
 *   - name: Orders
 *     type: entity
 *     columns:
 *       - { name: CustomerId, dataType: int }
 *     foreignKeys:
 *       - { name: fk1, columns: [CustomerId], referencedEntity: Customer, referencedColumns: [Id] }
 *
 * connections:
 *   - from: Orders
 *     fromColumn: CustomerId
 *     to: Customer
 *     toColumn: Id
 *     start: ZERO_OR_MANY
 *     end: ONE_ONLY
 * }</pre>
 *
 * @param nodes node declarations
 * @param connections connections, replayed in order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DiagramFile(
    @JsonProperty("nodes") List<NodeSpec> nodes,
    @JsonProperty("connections") List<ConnectionSpec> connections
) {
    public DiagramFile {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        connections = connections == null ? List.of() : List.copyOf(connections);
    }

    /**
     * A node declaration. Fields that do not apply to the node's type are ignored.
     *
     * @param name unique node name
     * @param type node implementation, defaults to {@link NodeType#GENERIC}
     * @param kind automation kind of a workflow node, defaults to {@link NodeKind#ACTION}
     * @param entityName entity name of an entity node, defaults to {@code name}
     * @param inputs input port types of workflow and generic nodes
     * @param outputs output port types of workflow and generic nodes
     * @param columns columns of an entity node
     * @param foreignKeys foreign keys of an entity node
     * @param joinLeft left join key of a join node
     * @param joinRight right join key of a join node
     * @param groupBy group-by columns of an aggregate node
     * @param aggregates aggregate outputs of an aggregate node
     * @param derived derived columns of a derived node
     * @param properties extra node properties; structured values are stored as JSON text
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NodeSpec(
        @JsonProperty("name") String name,
        @JsonProperty("type") NodeType type,
        @JsonProperty("kind") NodeKind kind,
        @JsonProperty("entityName") String entityName,
        @JsonProperty("inputs") List<String> inputs,
        @JsonProperty("outputs") List<String> outputs,
        @JsonProperty("columns") List<ColumnDefinition> columns,
        @JsonProperty("foreignKeys") List<ForeignKeyDefinition> foreignKeys,
        @JsonProperty("joinLeft") String joinLeft,
        @JsonProperty("joinRight") String joinRight,
        @JsonProperty("groupBy") List<String> groupBy,
        @JsonProperty("aggregates") List<ColumnDefinition> aggregates,
        @JsonProperty("derived") List<ColumnDefinition> derived,
        @JsonProperty("properties") Map<String, Object> properties
    ) {
        public NodeSpec {
            Objects.requireNonNull(name, "node name must not be null");
            if (type == null) {
                type = NodeType.GENERIC;
            }
            if (kind == null) {
                kind = NodeKind.ACTION;
            }
            if (entityName == null || entityName.isBlank()) {
                entityName = name;
            }
            inputs = inputs == null ? List.of() : List.copyOf(inputs);
            outputs = outputs == null ? List.of() : List.copyOf(outputs);
            columns = columns == null ? List.of() : List.copyOf(columns);
            foreignKeys = foreignKeys == null ? List.of() : List.copyOf(foreignKeys);
            groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
            aggregates = aggregates == null ? List.of() : List.copyOf(aggregates);
            derived = derived == null ? List.of() : List.copyOf(derived);
            properties = properties == null ? Map.of() : properties;
        }
    }

    /**
     * A connection to replay. With both column names set the connection links those two entity
     * columns; otherwise the nodes are connected as a whole.
     *
     * @param from source node name
     * @param to target node name
     * @param fromColumn source column of a column-level connection
     * @param toColumn target column of a column-level connection
     * @param start multiplicity marker at the source end
     * @param end multiplicity marker at the target end
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConnectionSpec(
        @JsonProperty("from") String from,
        @JsonProperty("to") String to,
        @JsonProperty("fromColumn") String fromColumn,
        @JsonProperty("toColumn") String toColumn,
        @JsonProperty("start") Multiplicity start,
        @JsonProperty("end") Multiplicity end
    ) {
        public ConnectionSpec {
            Objects.requireNonNull(from, "connection 'from' must not be null");
            Objects.requireNonNull(to, "connection 'to' must not be null");
        }

        public boolean isColumnLevel() {
            return fromColumn != null && toColumn != null;
        }

        @Override
        public String toString() {
            return isColumnLevel() ? from + "." + fromColumn + " -> " + to + "." + toColumn : from + " -> " + to;
        }
    }
}

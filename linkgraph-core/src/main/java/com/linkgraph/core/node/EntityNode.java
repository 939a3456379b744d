package com.linkgraph.core.node;

import com.linkgraph.core.config.EngineConfig.PropertyKeys;
import com.linkgraph.core.graph.Port;
import com.linkgraph.core.model.ColumnDefinition;
import com.linkgraph.core.model.ColumnSchema;
import com.linkgraph.core.model.ForeignKeyDefinition;
import com.linkgraph.core.model.PortDirection;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ERD table. Every column gets one input and one output port whose row id is the column id, so
 * edges between columns can be checked as key relationships.
 *
 * <p>The columns and foreign keys are published through the default {@code Columns},
 * {@code ForeignKeys} and {@code EntityName} properties.
 */
public class EntityNode extends AbstractNode {

    private final PropertyKeys keys;
    private final List<ColumnDefinition> columns = new ArrayList<>();
    private final List<ForeignKeyDefinition> foreignKeys = new ArrayList<>();

    public EntityNode(String name) {
        this(name, name, PropertyKeys.defaults());
    }

    /**
     * Creates an entity whose entity name differs from its display name.
     *
     * @param name display name
     * @param entityName name foreign keys refer to
     * @param keys property keys to publish under
     */
    public EntityNode(String name, String entityName, PropertyKeys keys) {
        super(name);
        this.keys = Objects.requireNonNull(keys, "keys must not be null");
        properties().set(keys.entityName(), Objects.requireNonNull(entityName, "entityName must not be null"));
        properties().set(keys.columns(), ColumnSchema.empty());
        properties().set(keys.foreignKeys(), List.of());
    }

    /**
     * Adds a column with its pair of ports.
     *
     * @param column column to add
     * @return this entity
     */
    public EntityNode addColumn(ColumnDefinition column) {
        Objects.requireNonNull(column, "column must not be null");
        columns.add(column);
        addPort(PortDirection.INPUT, column.dataType(), column.id());
        addPort(PortDirection.OUTPUT, column.dataType(), column.id());
        properties().set(keys.columns(), new ColumnSchema(columns));
        return this;
    }

    public EntityNode addForeignKey(ForeignKeyDefinition foreignKey) {
        foreignKeys.add(Objects.requireNonNull(foreignKey, "foreignKey must not be null"));
        properties().set(keys.foreignKeys(), List.copyOf(foreignKeys));
        return this;
    }

    public ColumnSchema columns() {
        return new ColumnSchema(columns);
    }

    public Optional<Port> inputPortFor(String columnName) {
        return portFor(inputPorts(), columnName);
    }

    public Optional<Port> outputPortFor(String columnName) {
        return portFor(outputPorts(), columnName);
    }

    private Optional<Port> portFor(List<Port> ports, String columnName) {
        return columns().findByName(columnName)
            .flatMap(column -> ports.stream().filter(p -> column.id().equals(p.rowId())).findFirst());
    }
}

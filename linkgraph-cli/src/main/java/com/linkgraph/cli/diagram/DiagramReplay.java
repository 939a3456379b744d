package com.linkgraph.cli.diagram;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linkgraph.cli.diagram.DiagramFile.ConnectionSpec;
import com.linkgraph.cli.diagram.DiagramFile.NodeSpec;
import com.linkgraph.core.config.EngineConfig.PropertyKeys;
import com.linkgraph.core.engine.ConnectResult;
import com.linkgraph.core.engine.ConnectionManager;
import com.linkgraph.core.graph.DiagramNode;
import com.linkgraph.core.graph.Port;
import com.linkgraph.core.model.ColumnDefinition;
import com.linkgraph.core.model.MultiplicityPreset;
import com.linkgraph.core.node.AbstractNode;
import com.linkgraph.core.node.AggregateNode;
import com.linkgraph.core.node.DerivedColumnNode;
import com.linkgraph.core.node.EntityNode;
import com.linkgraph.core.node.GenericNode;
import com.linkgraph.core.node.JoinNode;
import com.linkgraph.core.node.WorkflowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the nodes of a diagram file and replays its connections through a
 * {@link ConnectionManager}.
 */
public class DiagramReplay {

    private static final Logger log = LoggerFactory.getLogger(DiagramReplay.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final ConnectionManager manager;
    private final Map<String, DiagramNode> nodes = new LinkedHashMap<>();
    private final List<Outcome> outcomes = new ArrayList<>();

    public DiagramReplay(ConnectionManager manager) {
        this.manager = manager;
    }

    /**
     * Result of replaying one connection.
     *
     * @param connection the declared connection
     * @param result what the engine answered
     */
    public record Outcome(ConnectionSpec connection, ConnectResult result) {}

    /**
     * Creates every node, then replays every connection in order.
     *
     * @param diagram parsed diagram file
     * @return this replay
     * @throws DiagramException if a node name repeats, a connection names an unknown node or
     *         column, or the engine rejects a connection's arguments (e.g. a node linked to itself)
     */
    public DiagramReplay run(DiagramFile diagram) {
        PropertyKeys keys = manager.config().propertyKeys();
        for (NodeSpec spec : diagram.nodes()) {
            if (nodes.containsKey(spec.name())) {
                throw new DiagramException("Duplicate node name: " + spec.name());
            }
            DiagramNode node = createNode(spec, keys);
            manager.register(node);
            nodes.put(spec.name(), node);
        }
        for (ConnectionSpec connection : diagram.connections()) {
            ConnectResult result;
            try {
                result = replay(connection);
            } catch (IllegalArgumentException e) {
                throw new DiagramException("Invalid connection " + connection + ": " + e.getMessage(), e);
            }
            outcomes.add(new Outcome(connection, result));
            log.debug("{}: {}", connection, result);
        }
        return this;
    }

    public Map<String, DiagramNode> nodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public List<Outcome> outcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    public List<Outcome> refused() {
        return outcomes.stream().filter(o -> !o.result().isConnected()).toList();
    }

    /**
     * Describes a port for display: {@code Node.Column} for entity column ports, else the node name.
     *
     * @param port port to describe
     * @return display text
     */
    public static String describe(Port port) {
        DiagramNode owner = port.owner();
        if (owner instanceof EntityNode entity && port.rowId() != null) {
            Optional<ColumnDefinition> column = entity.columns().findByRowId(port.rowId());
            if (column.isPresent()) {
                return owner.name() + "." + column.get().name();
            }
        }
        return owner.name();
    }

    private ConnectResult replay(ConnectionSpec connection) {
        DiagramNode from = node(connection.from());
        DiagramNode to = node(connection.to());
        MultiplicityPreset preset = new MultiplicityPreset(connection.start(), connection.end());

        if (!connection.isColumnLevel()) {
            return manager.connect(from, to, preset.isEmpty() ? null : preset);
        }
        Port output = entity(from).outputPortFor(connection.fromColumn())
            .orElseThrow(() -> new DiagramException("Unknown column: " + connection.from() + "." + connection.fromColumn()));
        Port input = entity(to).inputPortFor(connection.toColumn())
            .orElseThrow(() -> new DiagramException("Unknown column: " + connection.to() + "." + connection.toColumn()));
        manager.setNextEdgeMultiplicityPreset(preset);
        return manager.connectPorts(output, input);
    }

    private DiagramNode node(String name) {
        DiagramNode node = nodes.get(name);
        if (node == null) {
            throw new DiagramException("Unknown node: " + name);
        }
        return node;
    }

    private static EntityNode entity(DiagramNode node) {
        if (node instanceof EntityNode entity) {
            return entity;
        }
        throw new DiagramException("Column-level connection on a non-entity node: " + node.name());
    }

    private static DiagramNode createNode(NodeSpec spec, PropertyKeys keys) {
        AbstractNode node = switch (spec.type()) {
            case WORKFLOW -> withPorts(new WorkflowNode(spec.name(), spec.kind()), spec);
            case GENERIC -> withPorts(new GenericNode(spec.name()), spec);
            case ENTITY -> {
                EntityNode entity = new EntityNode(spec.name(), spec.entityName(), keys);
                spec.columns().forEach(entity::addColumn);
                spec.foreignKeys().forEach(entity::addForeignKey);
                yield entity;
            }
            case JOIN -> {
                JoinNode join = new JoinNode(spec.name(), keys);
                if (spec.joinLeft() != null || spec.joinRight() != null) {
                    join.joinOn(spec.joinLeft(), spec.joinRight());
                }
                yield join;
            }
            case AGGREGATE -> {
                AggregateNode aggregate = new AggregateNode(spec.name(), keys).groupBy(spec.groupBy().toArray(String[]::new));
                spec.aggregates().forEach(aggregate::aggregate);
                yield aggregate;
            }
            case DERIVED -> {
                DerivedColumnNode derived = new DerivedColumnNode(spec.name(), keys);
                spec.derived().forEach(derived::derive);
                yield derived;
            }
        };
        spec.properties().forEach((key, value) -> node.properties().set(key, propertyValue(key, value)));
        return node;
    }

    private static AbstractNode withPorts(AbstractNode node, NodeSpec spec) {
        spec.inputs().forEach(node::addInputPort);
        spec.outputs().forEach(node::addOutputPort);
        return node;
    }

    /**
     * Scalars are stored as they are; lists and maps become JSON text, the portable form hosts
     * persist schemas in.
     */
    private static Object propertyValue(String key, Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new DiagramException("Cannot serialize property " + key + ": " + e.getMessage(), e);
        }
    }
}

package com.linkgraph.core.node;

import com.linkgraph.core.graph.DiagramNode;
import com.linkgraph.core.graph.NodeProperties;
import com.linkgraph.core.graph.Port;
import com.linkgraph.core.model.PortDirection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Base class for in-process node implementations: identity, ordered port lists and a property
 * bag.
 */
public abstract class AbstractNode implements DiagramNode {

    private final UUID id;
    private final String name;
    private final List<Port> inputs = new ArrayList<>();
    private final List<Port> outputs = new ArrayList<>();
    private final NodeProperties properties = new NodeProperties();

    protected AbstractNode(String name) {
        this(UUID.randomUUID(), name);
    }

    protected AbstractNode(UUID id, String name) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Appends an input port.
     *
     * @param dataType data type tag
     * @return the new port
     */
    public Port addInputPort(String dataType) {
        return addPort(PortDirection.INPUT, dataType, null);
    }

    /**
     * Appends an output port.
     *
     * @param dataType data type tag
     * @return the new port
     */
    public Port addOutputPort(String dataType) {
        return addPort(PortDirection.OUTPUT, dataType, null);
    }

    protected Port addPort(PortDirection direction, String dataType, UUID rowId) {
        Port port = new Port(this, direction, dataType, rowId);
        (direction == PortDirection.INPUT ? inputs : outputs).add(port);
        return port;
    }

    @Override
    public UUID id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<Port> inputPorts() {
        return Collections.unmodifiableList(inputs);
    }

    @Override
    public List<Port> outputPorts() {
        return Collections.unmodifiableList(outputs);
    }

    @Override
    public NodeProperties properties() {
        return properties;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}

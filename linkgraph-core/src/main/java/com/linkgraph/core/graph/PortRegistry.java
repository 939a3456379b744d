package com.linkgraph.core.graph;

import com.linkgraph.core.model.PortDirection;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Index of the nodes known to the engine and of their ports by id.
 *
 * <p>Nodes register themselves implicitly the first time they take part in a connect. Hosts that
 * add or remove ports on a node call {@link #register(DiagramNode)} again to refresh the index.
 */
public final class PortRegistry {

    private final Map<UUID, DiagramNode> nodes = new LinkedHashMap<>();
    private final Map<UUID, Port> ports = new LinkedHashMap<>();

    /**
     * Registers a node and indexes all of its ports, replacing any previous entries for it.
     *
     * @param node node to register
     */
    public void register(DiagramNode node) {
        unregister(node);
        nodes.put(node.id(), node);
        node.inputPorts().forEach(p -> ports.put(p.id(), p));
        node.outputPorts().forEach(p -> ports.put(p.id(), p));
    }

    /**
     * Removes a node and its ports from the index.
     *
     * @param node node to remove
     */
    public void unregister(DiagramNode node) {
        if (nodes.remove(node.id()) != null) {
            ports.values().removeIf(p -> p.owner() == node);
        }
    }

    public boolean isRegistered(DiagramNode node) {
        return nodes.containsKey(node.id());
    }

    public Optional<Port> findPort(UUID portId) {
        return Optional.ofNullable(ports.get(portId));
    }

    /**
     * Returns the node owning the given port.
     *
     * @param portId port id
     * @return owner node, empty if the port is unknown
     */
    public Optional<DiagramNode> ownerOf(UUID portId) {
        return findPort(portId).map(Port::owner);
    }

    public Collection<DiagramNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /**
     * Returns the first port of the given direction, regardless of availability.
     *
     * @param node node to inspect
     * @param direction port direction
     * @return first port, empty if the node has none
     */
    public static Optional<Port> firstPort(DiagramNode node, PortDirection direction) {
        return portsOf(node, direction).stream().findFirst();
    }

    /**
     * Returns the first available port of the given direction.
     *
     * @param node node to inspect
     * @param direction port direction
     * @return first available port, empty if all are consumed
     */
    public static Optional<Port> firstAvailablePort(DiagramNode node, PortDirection direction) {
        return portsOf(node, direction).stream().filter(Port::isAvailable).findFirst();
    }

    private static List<Port> portsOf(DiagramNode node, PortDirection direction) {
        return direction == PortDirection.INPUT ? node.inputPorts() : node.outputPorts();
    }
}

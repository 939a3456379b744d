package com.linkgraph.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The edge set of a diagram, in creation order, plus the port registry.
 *
 * <p>Not thread-safe: all calls must be serialized by the caller.
 */
public final class ConnectionGraph {

    private final List<Edge> edges = new ArrayList<>();
    private final PortRegistry registry = new PortRegistry();

    /**
     * Adds an edge unless it is already present.
     *
     * @param edge edge to add
     * @return true if the edge was added
     */
    public boolean add(Edge edge) {
        if (edges.contains(edge)) {
            return false;
        }
        edges.add(edge);
        return true;
    }

    /**
     * Inserts an edge at a position in creation order, used to put a removed edge back where it
     * was.
     *
     * @param index position, clamped to the current size
     * @param edge edge to insert
     * @return true if the edge was inserted
     */
    public boolean insert(int index, Edge edge) {
        if (edges.contains(edge)) {
            return false;
        }
        edges.add(Math.max(0, Math.min(index, edges.size())), edge);
        return true;
    }

    public int indexOf(Edge edge) {
        return edges.indexOf(edge);
    }

    public boolean remove(Edge edge) {
        return edges.remove(edge);
    }

    public boolean contains(Edge edge) {
        return edges.contains(edge);
    }

    public List<Edge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public PortRegistry registry() {
        return registry;
    }

    /**
     * Returns the first edge joining the two nodes in either direction.
     *
     * @param a one node
     * @param b the other node
     * @return first matching edge
     */
    public Optional<Edge> findBetween(DiagramNode a, DiagramNode b) {
        return edges.stream().filter(e -> e.links(a, b)).findFirst();
    }

    public List<Edge> edgesFrom(DiagramNode node) {
        return edges.stream().filter(e -> e.sourceNode() == node).toList();
    }

    /**
     * Returns the edges ending at a node, ordered by input port position and then by creation.
     *
     * @param node sink node
     * @return incoming edges
     */
    public List<Edge> edgesInto(DiagramNode node) {
        List<Port> inputs = node.inputPorts();
        return edges.stream()
            .filter(e -> e.targetNode() == node)
            .sorted(Comparator.comparingInt(e -> portPosition(inputs, e.target())))
            .toList();
    }

    /**
     * Builds a successor map of every node with outgoing edges, optionally leaving one edge out.
     *
     * @param excluded edge to skip, or null
     * @return source node to target nodes, in edge order
     */
    public Map<DiagramNode, List<DiagramNode>> adjacency(Edge excluded) {
        Map<DiagramNode, List<DiagramNode>> successors = new HashMap<>();
        for (Edge edge : edges) {
            if (edge != excluded) {
                successors.computeIfAbsent(edge.sourceNode(), n -> new ArrayList<>()).add(edge.targetNode());
            }
        }
        return successors;
    }

    public int size() {
        return edges.size();
    }

    private static int portPosition(List<Port> ports, Port port) {
        int index = ports.indexOf(port);
        return index < 0 ? Integer.MAX_VALUE : index;
    }
}

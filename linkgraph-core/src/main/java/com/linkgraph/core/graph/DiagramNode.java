package com.linkgraph.core.graph;

import java.util.List;
import java.util.UUID;

/**
 * A diagram component as seen by the connection engine.
 *
 * <p>Nodes are created and destroyed by the host diagram. The engine only reads their ports and
 * properties, flips port availability and writes derived properties such as an inferred output
 * schema.
 */
public interface DiagramNode {

    /**
     * Returns the stable identity of this node.
     *
     * @return node id
     */
    UUID id();

    /**
     * Returns the display name; also the fallback entity name for foreign key matching.
     *
     * @return node name
     */
    String name();

    /**
     * Returns the input ports in declaration order.
     *
     * @return input ports
     */
    List<Port> inputPorts();

    /**
     * Returns the output ports in declaration order.
     *
     * @return output ports
     */
    List<Port> outputPorts();

    /**
     * Returns the node's property bag.
     *
     * @return properties, never null
     */
    NodeProperties properties();
}

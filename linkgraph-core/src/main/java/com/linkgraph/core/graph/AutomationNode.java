package com.linkgraph.core.graph;

import com.linkgraph.core.model.NodeKind;

/**
 * Marks a node as part of the automation family.
 *
 * <p>Edges between two automation nodes consume their ports (one edge per port), must join
 * type-compatible ports, must respect the disallowed kind pairs and must keep the automation
 * graph acyclic.
 */
public interface AutomationNode extends DiagramNode {

    /**
     * Returns the kind of this automation node.
     *
     * @return node kind
     */
    NodeKind kind();
}

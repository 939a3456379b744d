package com.linkgraph.core.node;

import java.util.UUID;

/**
 * Plain diagram node with no extra semantics. Connected through the generic path, so its ports
 * fan out freely.
 */
public class GenericNode extends AbstractNode {

    public GenericNode(String name) {
        super(name);
    }

    public GenericNode(UUID id, String name) {
        super(id, name);
    }
}

package com.linkgraph.core.node;

import com.linkgraph.core.graph.AutomationNode;
import com.linkgraph.core.model.NodeKind;

import java.util.Objects;
import java.util.UUID;

/**
 * Automation workflow step. Its ports are single-use and the graph of workflow nodes stays
 * acyclic.
 */
public class WorkflowNode extends AbstractNode implements AutomationNode {

    private final NodeKind kind;

    public WorkflowNode(String name, NodeKind kind) {
        super(name);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public WorkflowNode(UUID id, String name, NodeKind kind) {
        super(id, name);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    @Override
    public NodeKind kind() {
        return kind;
    }
}

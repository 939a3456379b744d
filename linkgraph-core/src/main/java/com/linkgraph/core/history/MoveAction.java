package com.linkgraph.core.history;

import com.linkgraph.core.graph.ConnectionGraph;
import com.linkgraph.core.graph.DiagramNode;
import com.linkgraph.core.graph.Edge;
import com.linkgraph.core.graph.Port;
import com.linkgraph.core.graph.PortState;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Re-attachment of an edge to different ports.
 */
public final class MoveAction extends HistoryAction {

    private final Port oldSource;
    private final Port oldTarget;
    private final Port newSource;
    private final Port newTarget;

    public MoveAction(ConnectionGraph graph, Edge edge, Port oldSource, Port oldTarget,
                      List<PortState> before, List<PortState> after, Consumer<DiagramNode> refresher) {
        super(graph, edge, before, after, refresher);
        this.oldSource = Objects.requireNonNull(oldSource, "oldSource must not be null");
        this.oldTarget = Objects.requireNonNull(oldTarget, "oldTarget must not be null");
        this.newSource = edge.source();
        this.newTarget = edge.target();
    }

    @Override
    public String description() {
        return "Move " + oldSource + " -> " + oldTarget + " to " + newSource + " -> " + newTarget;
    }

    @Override
    protected void revert() {
        edge.rebind(oldSource, oldTarget);
    }

    @Override
    protected void reapply() {
        edge.rebind(newSource, newTarget);
    }
}

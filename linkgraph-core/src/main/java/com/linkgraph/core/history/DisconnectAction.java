package com.linkgraph.core.history;

import com.linkgraph.core.graph.ConnectionGraph;
import com.linkgraph.core.graph.DiagramNode;
import com.linkgraph.core.graph.Edge;
import com.linkgraph.core.graph.PortState;

import java.util.List;
import java.util.function.Consumer;

/**
 * Removal of an edge. Undo puts the same edge object back at its old position, so its schema,
 * status and labels come back with it.
 */
public final class DisconnectAction extends HistoryAction {

    private final int position;

    public DisconnectAction(ConnectionGraph graph, Edge edge, int position, List<PortState> before,
                            List<PortState> after, Consumer<DiagramNode> refresher) {
        super(graph, edge, before, after, refresher);
        this.position = position;
    }

    @Override
    public String description() {
        return "Disconnect " + edge.sourceNode().name() + " -> " + edge.targetNode().name();
    }

    @Override
    protected void revert() {
        graph.insert(position, edge);
    }

    @Override
    protected void reapply() {
        graph.remove(edge);
    }
}

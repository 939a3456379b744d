package com.linkgraph.core.history;

import com.linkgraph.core.graph.ConnectionGraph;
import com.linkgraph.core.graph.DiagramNode;
import com.linkgraph.core.graph.Edge;
import com.linkgraph.core.graph.PortState;

import java.util.List;
import java.util.function.Consumer;

/**
 * Creation of an edge. Undo removes the edge and frees its ports again.
 */
public final class ConnectAction extends HistoryAction {

    public ConnectAction(ConnectionGraph graph, Edge edge, List<PortState> before, List<PortState> after,
                         Consumer<DiagramNode> refresher) {
        super(graph, edge, before, after, refresher);
    }

    @Override
    public String description() {
        return "Connect " + edge.sourceNode().name() + " -> " + edge.targetNode().name();
    }

    @Override
    protected void revert() {
        graph.remove(edge);
    }

    @Override
    protected void reapply() {
        graph.add(edge);
    }
}

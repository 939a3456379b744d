package com.linkgraph.core.history;

import com.linkgraph.core.graph.ConnectionGraph;
import com.linkgraph.core.graph.DiagramNode;
import com.linkgraph.core.graph.Edge;
import com.linkgraph.core.graph.PortState;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * One recorded graph mutation.
 *
 * <p>An action is created already applied. It can be undone once and, after that, redone once;
 * the cycle may then repeat. Port states are captured before and after the mutation so both
 * directions restore availability and links exactly. The affected nodes are handed to the
 * refresher afterwards so derived schemas follow the restored graph.
 */
public abstract class HistoryAction {

    protected final ConnectionGraph graph;
    protected final Edge edge;
    private final List<PortState> before;
    private final List<PortState> after;
    private final Consumer<DiagramNode> refresher;

    private boolean undone;

    protected HistoryAction(ConnectionGraph graph, Edge edge, List<PortState> before, List<PortState> after,
                            Consumer<DiagramNode> refresher) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.edge = Objects.requireNonNull(edge, "edge must not be null");
        this.before = List.copyOf(before);
        this.after = List.copyOf(after);
        this.refresher = Objects.requireNonNull(refresher, "refresher must not be null");
    }

    /**
     * Reverses the mutation.
     *
     * @throws IllegalStateException if the action is already undone
     */
    public final void undo() {
        if (undone) {
            throw new IllegalStateException("Action already undone: " + description());
        }
        revert();
        before.forEach(PortState::restore);
        undone = true;
        refreshAffected();
    }

    /**
     * Re-applies an undone mutation.
     *
     * @throws IllegalStateException if the action is not undone
     */
    public final void redo() {
        if (!undone) {
            throw new IllegalStateException("Action is not undone: " + description());
        }
        reapply();
        after.forEach(PortState::restore);
        undone = false;
        refreshAffected();
    }

    public boolean isUndone() {
        return undone;
    }

    public Edge edge() {
        return edge;
    }

    /**
     * Returns a short human-readable description, e.g. for an undo menu entry.
     *
     * @return description
     */
    public abstract String description();

    /** Puts the graph structure back to its pre-mutation shape. Port states are restored afterwards. */
    protected abstract void revert();

    /** Applies the mutation's structural change again. Port states are restored afterwards. */
    protected abstract void reapply();

    /**
     * Returns the nodes whose derived schemas may change when this action flips.
     *
     * @return affected nodes, without duplicates
     */
    protected Set<DiagramNode> affectedNodes() {
        Set<DiagramNode> nodes = new LinkedHashSet<>();
        before.forEach(s -> nodes.add(s.port().owner()));
        after.forEach(s -> nodes.add(s.port().owner()));
        return nodes;
    }

    private void refreshAffected() {
        affectedNodes().forEach(refresher);
    }

    @Override
    public String toString() {
        return description() + (undone ? " (undone)" : "");
    }
}

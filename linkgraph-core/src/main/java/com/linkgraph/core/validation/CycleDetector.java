package com.linkgraph.core.validation;

import com.linkgraph.core.graph.ConnectionGraph;
import com.linkgraph.core.graph.DiagramNode;
import com.linkgraph.core.graph.Edge;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Depth-first reachability checks over the current edge set.
 *
 * <p>The edge set is only read. Each check builds the successor map once and is O(V+E). The
 * walks are iterative, so long chains do not grow the call stack.
 */
public class CycleDetector {

    private final ConnectionGraph graph;

    public CycleDetector(ConnectionGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
    }

    /**
     * Returns true if adding an edge {@code source -> target} would close a loop, i.e. if
     * {@code source} is already reachable from {@code target}.
     *
     * @param source proposed edge source
     * @param target proposed edge target
     * @return true if the edge would create a cycle
     */
    public boolean wouldCreateCycle(DiagramNode source, DiagramNode target) {
        return wouldCreateCycle(source, target, null);
    }

    /**
     * Same as {@link #wouldCreateCycle(DiagramNode, DiagramNode)}, ignoring one existing edge.
     * Used when that edge is about to be re-attached.
     *
     * @param source proposed edge source
     * @param target proposed edge target
     * @param ignored edge left out of the walk, or null
     * @return true if the edge would create a cycle
     */
    public boolean wouldCreateCycle(DiagramNode source, DiagramNode target, Edge ignored) {
        if (source == target) {
            return true;
        }
        Map<DiagramNode, List<DiagramNode>> successors = graph.adjacency(ignored);
        Set<DiagramNode> visited = new HashSet<>();
        Deque<DiagramNode> pending = new ArrayDeque<>();
        pending.push(target);
        visited.add(target);
        while (!pending.isEmpty()) {
            DiagramNode current = pending.pop();
            if (current == source) {
                return true;
            }
            for (DiagramNode next : successors.getOrDefault(current, List.of())) {
                if (visited.add(next)) {
                    pending.push(next);
                }
            }
        }
        return false;
    }

    /**
     * Returns true if the current edge set already contains a directed cycle.
     *
     * @return true if some node can reach itself
     */
    public boolean hasCycle() {
        Map<DiagramNode, List<DiagramNode>> successors = graph.adjacency(null);
        Set<DiagramNode> done = new HashSet<>();
        Set<DiagramNode> onStack = new HashSet<>();
        for (DiagramNode start : successors.keySet()) {
            if (!done.contains(start) && loopsFrom(start, successors, done, onStack)) {
                return true;
            }
        }
        return false;
    }

    private static boolean loopsFrom(DiagramNode start, Map<DiagramNode, List<DiagramNode>> successors,
                                     Set<DiagramNode> done, Set<DiagramNode> onStack) {
        Deque<DiagramNode> path = new ArrayDeque<>();
        Deque<Iterator<DiagramNode>> cursors = new ArrayDeque<>();
        path.push(start);
        cursors.push(successors.getOrDefault(start, List.of()).iterator());
        onStack.add(start);
        while (!path.isEmpty()) {
            Iterator<DiagramNode> cursor = cursors.peek();
            if (cursor.hasNext()) {
                DiagramNode next = cursor.next();
                if (onStack.contains(next)) {
                    return true;
                }
                if (!done.contains(next)) {
                    path.push(next);
                    cursors.push(successors.getOrDefault(next, List.of()).iterator());
                    onStack.add(next);
                }
            } else {
                DiagramNode finished = path.pop();
                cursors.pop();
                onStack.remove(finished);
                done.add(finished);
            }
        }
        return false;
    }
}

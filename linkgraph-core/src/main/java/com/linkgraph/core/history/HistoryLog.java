package com.linkgraph.core.history;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Undo and redo stacks of graph mutations.
 *
 * <p>Recording a new action discards everything that could have been redone. Actions are never
 * merged.
 */
public class HistoryLog {

    private static final Logger log = LoggerFactory.getLogger(HistoryLog.class);

    private final Deque<HistoryAction> undoStack = new ArrayDeque<>();
    private final Deque<HistoryAction> redoStack = new ArrayDeque<>();
    private final List<HistoryListener> listeners = new ArrayList<>();

    /**
     * Records an applied action.
     *
     * @param action the action, not undone
     */
    public void record(HistoryAction action) {
        Objects.requireNonNull(action, "action must not be null");
        undoStack.push(action);
        redoStack.clear();
        log.debug("Recorded {}", action.description());
        fireChanged();
    }

    /**
     * Undoes the most recent action.
     *
     * @return the undone action, empty if there was nothing to undo
     */
    public Optional<HistoryAction> undo() {
        if (undoStack.isEmpty()) {
            return Optional.empty();
        }
        HistoryAction action = undoStack.pop();
        action.undo();
        redoStack.push(action);
        log.debug("Undid {}", action.description());
        fireChanged();
        return Optional.of(action);
    }

    /**
     * Redoes the most recently undone action.
     *
     * @return the redone action, empty if there was nothing to redo
     */
    public Optional<HistoryAction> redo() {
        if (redoStack.isEmpty()) {
            return Optional.empty();
        }
        HistoryAction action = redoStack.pop();
        action.redo();
        undoStack.push(action);
        log.debug("Redid {}", action.description());
        fireChanged();
        return Optional.of(action);
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public int undoCount() {
        return undoStack.size();
    }

    public int redoCount() {
        return redoStack.size();
    }

    /**
     * Forgets all recorded actions. The graph itself is left as it is.
     */
    public void clear() {
        undoStack.clear();
        redoStack.clear();
        fireChanged();
    }

    public void addListener(HistoryListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(HistoryListener listener) {
        listeners.remove(listener);
    }

    private void fireChanged() {
        for (HistoryListener listener : List.copyOf(listeners)) {
            listener.historyChanged(this);
        }
    }
}

package com.linkgraph.core.history;

/**
 * Notified whenever the undo or redo stack changes.
 */
@FunctionalInterface
public interface HistoryListener {

    void historyChanged(HistoryLog history);
}

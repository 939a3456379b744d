package com.linkgraph.core.graph;

import java.util.Objects;

/**
 * Snapshot of a port's availability and link, used to reverse mutations exactly.
 *
 * @param port the captured port
 * @param available availability at capture time
 * @param connectedTo linked port at capture time, may be null
 */
public record PortState(Port port, boolean available, Port connectedTo) {

    public PortState {
        Objects.requireNonNull(port, "port must not be null");
    }

    /**
     * Captures the current state of a port.
     *
     * @param port port to capture
     * @return snapshot
     */
    public static PortState capture(Port port) {
        return new PortState(port, port.isAvailable(), port.connectedTo());
    }

    /**
     * Writes the captured state back to the port.
     */
    public void restore() {
        port.restore(available, connectedTo);
    }
}

package com.linkgraph.core.graph;

import com.linkgraph.core.model.PortDirection;

import java.util.Objects;
import java.util.UUID;

/**
 * Typed attachment point on a node.
 *
 * <p>A port starts out available. Automation edges mark both of their ports unavailable and
 * link them to each other; generic edges leave them untouched.
 */
public final class Port {

    private final UUID id;
    private final DiagramNode owner;
    private final PortDirection direction;
    private final String dataType;
    private final UUID rowId;

    private boolean available = true;
    private Port connectedTo;

    /**
     * Creates a port with a fresh id.
     *
     * @param owner owning node
     * @param direction input or output
     * @param dataType data type tag, e.g. {@code string} or {@code any}
     * @param rowId column row id for column-granular ports, or null
     */
    public Port(DiagramNode owner, PortDirection direction, String dataType, UUID rowId) {
        this(UUID.randomUUID(), owner, direction, dataType, rowId);
    }

    /**
     * Creates a port with a known id.
     *
     * @param id port id
     * @param owner owning node
     * @param direction input or output
     * @param dataType data type tag
     * @param rowId column row id, or null
     */
    public Port(UUID id, DiagramNode owner, PortDirection direction, String dataType, UUID rowId) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.owner = Objects.requireNonNull(owner, "owner must not be null");
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.dataType = dataType == null || dataType.isBlank() ? "any" : dataType.trim();
        this.rowId = rowId;
    }

    public UUID id() {
        return id;
    }

    public DiagramNode owner() {
        return owner;
    }

    public PortDirection direction() {
        return direction;
    }

    public String dataType() {
        return dataType;
    }

    public UUID rowId() {
        return rowId;
    }

    public boolean isAvailable() {
        return available;
    }

    public Port connectedTo() {
        return connectedTo;
    }

    /**
     * Consumes this port for an edge ending at {@code other}.
     *
     * @param other the port at the far end of the edge
     */
    public void bind(Port other) {
        this.available = false;
        this.connectedTo = other;
    }

    /**
     * Frees this port.
     */
    public void release() {
        this.available = true;
        this.connectedTo = null;
    }

    /**
     * Restores a previously captured state.
     *
     * @param wasAvailable availability to restore
     * @param link linked port to restore, may be null
     */
    void restore(boolean wasAvailable, Port link) {
        this.available = wasAvailable;
        this.connectedTo = link;
    }

    @Override
    public String toString() {
        return owner.name() + "." + direction.name().toLowerCase() + "[" + dataType + "]";
    }
}

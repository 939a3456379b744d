package com.linkgraph.core.model;

/**
 * Direction of a port relative to its owning node.
 */
public enum PortDirection {
    /** Receives data; the target end of an edge */
    INPUT,

    /** Emits data; the source end of an edge */
    OUTPUT;

    /**
     * Returns the direction an edge's other endpoint must have.
     *
     * @return opposite direction
     */
    public PortDirection opposite() {
        return this == INPUT ? OUTPUT : INPUT;
    }
}

package com.linkgraph.core.engine;

/**
 * Outcome of a connect request. Every value other than {@link #CONNECTED} is a structural
 * rejection: no edge was created and nothing was recorded.
 */
public enum ConnectResult {
    CONNECTED,

    /** An automation node has no free port of the needed direction */
    NO_AVAILABLE_PORT,

    /** The selected ports do not run output to input */
    DIRECTION_MISMATCH,

    /** The output port type cannot feed the input port type */
    INCOMPATIBLE_TYPES,

    /** The pair of automation node kinds is on the disallowed list */
    DISALLOWED_NODE_KINDS,

    /** The edge would close a loop */
    WOULD_CREATE_CYCLE,

    /** The two automation nodes are already joined */
    ALREADY_CONNECTED,

    /** A generic node has no port of the needed direction at all */
    NO_PORTS;

    public boolean isConnected() {
        return this == CONNECTED;
    }
}

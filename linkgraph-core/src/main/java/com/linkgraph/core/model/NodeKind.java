package com.linkgraph.core.model;

/**
 * Kinds of automation (workflow) nodes.
 */
public enum NodeKind {
    /** Starts execution on an event or schedule */
    TRIGGER,

    /** Performs an operation */
    ACTION,

    /** Evaluates logic and branches */
    CONDITION,

    /** Retrieves or provides data */
    DATA_SOURCE,

    /** Modifies or reshapes data */
    TRANSFORM,

    /** Sends data to an external system */
    OUTPUT,

    /** Conditional routing */
    CONDITIONAL
}

package com.linkgraph.core.model;

/**
 * Port-usage policy an edge was created under.
 */
public enum EdgePolicy {
    /** Automation edges: both ports are consumed while the edge exists */
    SINGLE_USE,

    /** Generic edges: ports stay available, any number of edges may share them */
    FAN_OUT
}

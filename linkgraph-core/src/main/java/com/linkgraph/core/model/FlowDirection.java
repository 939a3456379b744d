package com.linkgraph.core.model;

/**
 * Direction in which data is shown to flow along an edge.
 */
public enum FlowDirection {
    NONE,
    FORWARD,
    BACKWARD,
    BIDIRECTIONAL
}

package com.linkgraph.core.model;

/**
 * Validation status annotated on an edge.
 */
public enum EdgeStatus {
    /** No problem detected */
    NORMAL,

    /** Semantic problem (schema mismatch, unresolved key pair); the edge still exists */
    WARNING,

    /** Hard error reported by the host */
    ERROR
}

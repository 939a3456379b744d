package com.linkgraph.core.model;

/**
 * ERD cardinality marker drawn at one end of an edge.
 */
public enum Multiplicity {
    UNSPECIFIED,
    /** circle + bar */
    ZERO_OR_ONE,
    /** double bar */
    ONE_ONLY,
    /** bar + crow's foot */
    ONE_OR_MANY,
    /** circle + crow's foot */
    ZERO_OR_MANY,
    /** crow's foot only */
    MANY,
    /** single bar */
    ONE
}

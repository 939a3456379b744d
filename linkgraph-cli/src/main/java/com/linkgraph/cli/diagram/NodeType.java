package com.linkgraph.cli.diagram;

/**
 * Node implementations a diagram file can instantiate.
 */
public enum NodeType {
    /** Automation step with single-use ports */
    WORKFLOW,
    /** Plain node with fan-out ports */
    GENERIC,
    /** ERD table with one port pair per column */
    ENTITY,
    /** Two-input join */
    JOIN,
    /** Group-by aggregate */
    AGGREGATE,
    /** Derived column transform */
    DERIVED
}

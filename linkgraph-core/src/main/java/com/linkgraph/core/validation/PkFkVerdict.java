package com.linkgraph.core.validation;

/**
 * Result of checking a column-level edge against primary/foreign key metadata.
 */
public enum PkFkVerdict {
    /** The edge does not link two known columns */
    NOT_APPLICABLE,

    /** One column is flagged primary key and the other foreign key */
    FLAGS_MATCH,

    /** A declared foreign key pairs the two columns */
    DECLARED_FOREIGN_KEY,

    /** Neither rule holds; the edge was flagged with a warning */
    UNRESOLVED
}

package com.linkgraph.core.schema;

import com.linkgraph.core.model.ColumnSchema;

import java.util.Optional;

/**
 * Looks up the schema arriving on a node's inputs.
 *
 * <p>Input {@code i} is the edge on the node's input port {@code i}. Extra edges sharing a port
 * take the indexes of unwired ports first, in creation order, then follow the last port.
 */
@FunctionalInterface
public interface UpstreamSchemas {

    /**
     * Returns the schema carried by the edge feeding input {@code index}.
     *
     * @param index zero-based input index
     * @return schema, empty if there is no such edge or it carries no schema
     */
    Optional<ColumnSchema> schemaAt(int index);
}

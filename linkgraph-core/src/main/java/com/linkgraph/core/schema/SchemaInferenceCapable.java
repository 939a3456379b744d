package com.linkgraph.core.schema;

/**
 * Capability of node kinds whose output schema is derived from their upstream edges
 * (joins, aggregates, derived-column transforms).
 *
 * <p>The connection engine calls {@link #inferOutputSchema(UpstreamSchemas)} after every
 * connect, disconnect or move touching the node, and on demand. When the result carries a
 * schema, the engine stores it as the node's output schema.
 */
public interface SchemaInferenceCapable {

    /**
     * Recomputes this node's output schema from its upstream schemas.
     *
     * <p>Implementations report problems through {@link InferenceResult#failed(String)} rather
     * than by throwing.
     *
     * @param upstream lookup for the schema arriving on each input
     * @return inference outcome
     */
    InferenceResult inferOutputSchema(UpstreamSchemas upstream);
}

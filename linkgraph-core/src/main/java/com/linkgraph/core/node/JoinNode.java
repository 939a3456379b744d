package com.linkgraph.core.node;

import com.linkgraph.core.config.EngineConfig.PropertyKeys;
import com.linkgraph.core.model.ColumnSchema;
import com.linkgraph.core.schema.InferenceResult;
import com.linkgraph.core.schema.SchemaInferenceCapable;
import com.linkgraph.core.schema.SchemaPropagator;
import com.linkgraph.core.schema.UpstreamSchemas;

import java.util.Optional;

/**
 * Joins two upstream tables. Input 0 is the left side, input 1 the right side.
 *
 * <p>The output schema is the left schema followed by those right columns whose names do not
 * already appear on the left. It is empty until both sides are connected.
 */
public class JoinNode extends AbstractNode implements SchemaInferenceCapable {

    private final PropertyKeys keys;

    public JoinNode(String name) {
        this(name, PropertyKeys.defaults());
    }

    public JoinNode(String name, PropertyKeys keys) {
        super(name);
        this.keys = keys;
        properties().set(keys.kind(), SchemaPropagator.JOIN_KIND);
        addInputPort("any");
        addInputPort("any");
        addOutputPort("any");
    }

    /**
     * Sets the join key columns.
     *
     * @param left column name on the left input
     * @param right column name on the right input
     * @return this node
     */
    public JoinNode joinOn(String left, String right) {
        properties().set(keys.joinKeyLeft(), left);
        properties().set(keys.joinKeyRight(), right);
        return this;
    }

    @Override
    public InferenceResult inferOutputSchema(UpstreamSchemas upstream) {
        Optional<ColumnSchema> left = upstream.schemaAt(0);
        Optional<ColumnSchema> right = upstream.schemaAt(1);
        if (left.isEmpty() || right.isEmpty()) {
            return InferenceResult.inferred(ColumnSchema.empty());
        }
        return InferenceResult.inferred(left.get().appendDistinct(right.get().columns()));
    }
}

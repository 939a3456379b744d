package com.linkgraph.core.node;

import com.linkgraph.core.config.EngineConfig.PropertyKeys;
import com.linkgraph.core.model.ColumnDefinition;
import com.linkgraph.core.model.ColumnSchema;
import com.linkgraph.core.schema.InferenceResult;
import com.linkgraph.core.schema.SchemaInferenceCapable;
import com.linkgraph.core.schema.UpstreamSchemas;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Adds computed columns to the rows passing through it: upstream columns first, then the
 * derived columns not already present.
 */
public class DerivedColumnNode extends AbstractNode implements SchemaInferenceCapable {

    /** Kind property value */
    public static final String KIND = "DerivedColumn";

    private final List<ColumnDefinition> derived = new ArrayList<>();

    public DerivedColumnNode(String name) {
        this(name, PropertyKeys.defaults());
    }

    public DerivedColumnNode(String name, PropertyKeys keys) {
        super(name);
        properties().set(keys.kind(), KIND);
        addInputPort("any");
        addOutputPort("any");
    }

    public DerivedColumnNode derive(ColumnDefinition column) {
        derived.add(Objects.requireNonNull(column, "column must not be null"));
        return this;
    }

    @Override
    public InferenceResult inferOutputSchema(UpstreamSchemas upstream) {
        ColumnSchema base = upstream.schemaAt(0).orElse(ColumnSchema.empty());
        return InferenceResult.inferred(base.appendDistinct(derived));
    }
}

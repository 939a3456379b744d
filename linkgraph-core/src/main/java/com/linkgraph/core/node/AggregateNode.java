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
import java.util.Optional;

/**
 * Groups its single upstream input. The output schema holds the group-by columns as they appear
 * upstream, followed by the declared aggregate outputs.
 */
public class AggregateNode extends AbstractNode implements SchemaInferenceCapable {

    /** Kind property value */
    public static final String KIND = "Aggregate";

    private final List<String> groupBy = new ArrayList<>();
    private final List<ColumnDefinition> aggregates = new ArrayList<>();

    public AggregateNode(String name) {
        this(name, PropertyKeys.defaults());
    }

    public AggregateNode(String name, PropertyKeys keys) {
        super(name);
        properties().set(keys.kind(), KIND);
        addInputPort("any");
        addOutputPort("any");
    }

    public AggregateNode groupBy(String... columns) {
        groupBy.addAll(List.of(columns));
        return this;
    }

    public AggregateNode aggregate(ColumnDefinition output) {
        aggregates.add(Objects.requireNonNull(output, "output must not be null"));
        return this;
    }

    @Override
    public InferenceResult inferOutputSchema(UpstreamSchemas upstream) {
        Optional<ColumnSchema> input = upstream.schemaAt(0);
        if (input.isEmpty()) {
            return InferenceResult.inferred(ColumnSchema.empty());
        }
        List<ColumnDefinition> out = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String column : groupBy) {
            input.get().findByName(column).ifPresentOrElse(out::add, () -> missing.add(column));
        }
        if (!missing.isEmpty()) {
            return InferenceResult.failed("Group-by columns not found upstream: " + missing);
        }
        return InferenceResult.inferred(new ColumnSchema(out).appendDistinct(aggregates));
    }
}

package com.linkgraph.core.schema;

import com.linkgraph.core.graph.ConnectionGraph;
import com.linkgraph.core.graph.DiagramNode;
import com.linkgraph.core.graph.Edge;
import com.linkgraph.core.graph.Port;
import com.linkgraph.core.model.ColumnDefinition;
import com.linkgraph.core.model.ColumnSchema;
import com.linkgraph.core.model.SchemaDiff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Moves schema metadata along edges and keeps derived node schemas current.
 *
 * <p>Three jobs:
 * <ol>
 *   <li>{@link #attach} copies a declared output schema onto a new edge and checks it against
 *       the sink's expected schema;</li>
 *   <li>{@link #reinfer} dispatches to {@link SchemaInferenceCapable} nodes, stores the inferred
 *       schema and refreshes the node's outgoing edges;</li>
 *   <li>join nodes (kind {@code Join}) get their join keys checked against both upstream
 *       schemas.</li>
 * </ol>
 * Every finding is a warning on an edge; nothing here blocks a mutation.
 */
public class SchemaPropagator {

    private static final Logger log = LoggerFactory.getLogger(SchemaPropagator.class);

    /** Kind property value identifying join nodes */
    public static final String JOIN_KIND = "Join";

    private final ConnectionGraph graph;
    private final NodeMetadata metadata;
    private final String warningColor;

    public SchemaPropagator(ConnectionGraph graph, NodeMetadata metadata, String warningColor) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
        this.warningColor = Objects.requireNonNull(warningColor, "warningColor must not be null");
    }

    /**
     * Attaches schema metadata to a freshly created edge.
     *
     * <p>The edge schema is the output schema of the first of {@code producers} that declares
     * one. If one of {@code consumers} declares an expected schema, that expectation is copied
     * onto the edge and compared; a mismatch marks the edge with a warning. A declared schema
     * that cannot be decoded counts as a mismatch whenever the other side is declared too.
     *
     * @param edge new edge
     * @param producers nodes to take the output schema from, in order of preference
     * @param consumers nodes to take the expected schema from, in order of preference
     */
    public void attach(Edge edge, List<DiagramNode> producers, List<DiagramNode> consumers) {
        Optional<DiagramNode> producer = firstDeclaring(producers, metadata.keys().outputSchema());
        Optional<DiagramNode> consumer = firstDeclaring(consumers, metadata.keys().expectedSchema());
        if (producer.isEmpty()) {
            return;
        }
        Optional<ColumnSchema> output = metadata.outputSchema(producer.get());
        output.ifPresent(edge::setSchema);
        if (consumer.isEmpty()) {
            return;
        }
        Optional<ColumnSchema> expected = metadata.expectedSchema(consumer.get());
        if (output.isEmpty()) {
            markUndecodable(edge, metadata.keys().outputSchema(), producer.get());
        } else if (expected.isEmpty()) {
            markUndecodable(edge, metadata.keys().expectedSchema(), consumer.get());
        } else {
            edge.setExpectedSchema(expected.get());
            checkExpectation(edge);
        }
    }

    /**
     * Re-runs schema inference for a node.
     *
     * <p>Nodes without the capability yield {@link InferenceResult.Status#NOT_SUPPORTED}. A
     * runtime exception thrown by an implementation becomes a {@link InferenceResult.Status#FAILED}
     * result; nothing is stored in that case. Join key validation runs in every case.
     *
     * @param node node to re-infer
     * @return outcome, for the caller to log
     */
    public InferenceResult reinfer(DiagramNode node) {
        InferenceResult result = dispatch(node);
        if (result.status() == InferenceResult.Status.INFERRED) {
            ColumnSchema inferred = result.schema();
            Optional<ColumnSchema> current = metadata.outputSchema(node);
            if (current.isPresent() && current.get().equals(inferred)) {
                result = InferenceResult.unchanged();
            } else {
                metadata.storeOutputSchema(node, inferred);
                refreshOutgoing(node, inferred);
                log.debug("Inferred output schema of {} ({} columns)", node.name(), inferred.size());
            }
        }
        validateJoin(node);
        return result;
    }

    /**
     * Builds the upstream lookup for a node from the edges currently feeding it.
     *
     * <p>The edge on input port {@code i} is upstream {@code i}; an unwired port leaves its
     * index empty. Further edges sharing a port fill the empty indexes in creation order, then
     * follow after the last port.
     *
     * @param node sink node
     * @return lookup over the node's incoming edges
     */
    public UpstreamSchemas upstreamOf(DiagramNode node) {
        List<Port> inputs = node.inputPorts();
        List<Edge> slots = new ArrayList<>(Collections.nCopies(inputs.size(), (Edge) null));
        List<Edge> fanIn = new ArrayList<>();
        for (Edge edge : graph.edgesInto(node)) {
            int port = inputs.indexOf(edge.target());
            if (port >= 0 && slots.get(port) == null) {
                slots.set(port, edge);
            } else {
                fanIn.add(edge);
            }
        }
        for (Edge edge : fanIn) {
            int gap = slots.indexOf(null);
            if (gap >= 0) {
                slots.set(gap, edge);
            } else {
                slots.add(edge);
            }
        }
        return index -> {
            if (index < 0 || index >= slots.size()) {
                return Optional.empty();
            }
            return Optional.ofNullable(slots.get(index)).map(Edge::schema);
        };
    }

    private InferenceResult dispatch(DiagramNode node) {
        if (!(node instanceof SchemaInferenceCapable capable)) {
            return InferenceResult.notSupported();
        }
        try {
            InferenceResult result = capable.inferOutputSchema(upstreamOf(node));
            return result == null ? InferenceResult.unchanged() : result;
        } catch (RuntimeException e) {
            return InferenceResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void refreshOutgoing(DiagramNode node, ColumnSchema schema) {
        for (Edge edge : graph.edgesFrom(node)) {
            edge.setSchema(schema);
            if (edge.expectedSchema() != null) {
                checkExpectation(edge);
            }
        }
    }

    private void checkExpectation(Edge edge) {
        SchemaDiff diff = SchemaComparator.diff(edge.expectedSchema(), edge.schema());
        if (!SchemaComparator.schemasCompatible(edge.expectedSchema(), edge.schema())) {
            String reason = "Schema mismatch: " + diff.summary();
            edge.markWarning(warningColor, reason);
            log.warn("{} on edge {}", reason, edge);
        }
    }

    /**
     * Checks the join keys of a join node against its two upstream schemas and flags the node's
     * outgoing edges when a key is missing or the key types disagree. Skipped unless both
     * upstream schemas are known.
     */
    private void validateJoin(DiagramNode node) {
        boolean isJoin = metadata.kind(node).map(JOIN_KIND::equalsIgnoreCase).orElse(false);
        if (!isJoin) {
            return;
        }
        UpstreamSchemas upstream = upstreamOf(node);
        Optional<ColumnSchema> left = upstream.schemaAt(0);
        Optional<ColumnSchema> right = upstream.schemaAt(1);
        if (left.isEmpty() || right.isEmpty()) {
            return;
        }

        Optional<ColumnDefinition> leftKey = metadata.joinKeyLeft(node).flatMap(left.get()::findByName);
        Optional<ColumnDefinition> rightKey = metadata.joinKeyRight(node).flatMap(right.get()::findByName);

        String problem = null;
        if (leftKey.isEmpty() || rightKey.isEmpty()) {
            problem = "Join key not found: left=" + metadata.joinKeyLeft(node).orElse("<unset>")
                + ", right=" + metadata.joinKeyRight(node).orElse("<unset>");
        } else if (!SchemaComparator.typesAgree(leftKey.get(), rightKey.get())) {
            problem = "Join key types differ: " + leftKey.get().dataType() + " vs " + rightKey.get().dataType();
        }
        if (problem == null) {
            return;
        }
        for (Edge edge : graph.edgesFrom(node)) {
            edge.markWarning(warningColor, problem);
        }
        log.warn("{} on join node {}", problem, node.name());
    }

    private void markUndecodable(Edge edge, String key, DiagramNode node) {
        String reason = "Undecodable schema: " + key + " on " + node.name();
        edge.markWarning(warningColor, reason);
        log.warn("{} on edge {}", reason, edge);
    }

    private Optional<DiagramNode> firstDeclaring(List<DiagramNode> nodes, String key) {
        return nodes.stream().filter(node -> metadata.declares(node, key)).findFirst();
    }
}

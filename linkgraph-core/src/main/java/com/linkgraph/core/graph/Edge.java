package com.linkgraph.core.graph;

import com.linkgraph.core.model.ColumnSchema;
import com.linkgraph.core.model.EdgePolicy;
import com.linkgraph.core.model.EdgeStatus;
import com.linkgraph.core.model.FlowDirection;
import com.linkgraph.core.model.Multiplicity;
import com.linkgraph.core.model.MultiplicityPreset;
import com.linkgraph.core.model.PortDirection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Directed connection line from an output port to an input port on a different node.
 *
 * <p>Besides its endpoints an edge carries display annotations: status and indicator color,
 * the schema flowing along it, ERD multiplicity markers, flow direction and labels. Only the
 * engine creates, rebinds and removes edges; hosts read them and may edit labels.
 */
public final class Edge {

    private final UUID id = UUID.randomUUID();
    private final EdgePolicy policy;

    private Port source;
    private Port target;

    private EdgeStatus status = EdgeStatus.NORMAL;
    private String statusColor;
    private boolean showStatusIndicator;
    private final List<String> annotations = new ArrayList<>();

    private ColumnSchema schema;
    private ColumnSchema expectedSchema;
    private UUID sourceRowId;
    private UUID targetRowId;

    private Multiplicity startMultiplicity = Multiplicity.UNSPECIFIED;
    private Multiplicity endMultiplicity = Multiplicity.UNSPECIFIED;
    private FlowDirection flowDirection = FlowDirection.NONE;
    private boolean dataFlowAnimated;
    private String dataFlowColor;

    private String label1 = "";
    private String label2 = "";
    private String label3 = "";
    private String dataTypeLabel = "";

    /**
     * Creates an edge between two ports. Row ids are copied from the ports.
     *
     * @param source output port
     * @param target input port
     * @param policy port-usage policy
     * @throws IllegalArgumentException if the ports are on the same node or have the wrong directions
     */
    public Edge(Port source, Port target, EdgePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        checkEndpoints(source, target);
        this.source = source;
        this.target = target;
        this.sourceRowId = source.rowId();
        this.targetRowId = target.rowId();
    }

    static void checkEndpoints(Port source, Port target) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        if (source.owner() == target.owner()) {
            throw new IllegalArgumentException("Edge endpoints must be on different nodes: " + source.owner().name());
        }
        if (source.direction() != PortDirection.OUTPUT) {
            throw new IllegalArgumentException("Edge source must be an output port: " + source);
        }
        if (target.direction() != PortDirection.INPUT) {
            throw new IllegalArgumentException("Edge target must be an input port: " + target);
        }
    }

    /**
     * Moves the edge to new endpoints. Row ids follow the new ports.
     *
     * @param newSource new output port
     * @param newTarget new input port
     */
    public void rebind(Port newSource, Port newTarget) {
        checkEndpoints(newSource, newTarget);
        this.source = newSource;
        this.target = newTarget;
        this.sourceRowId = newSource.rowId();
        this.targetRowId = newTarget.rowId();
    }

    /**
     * Consumes both endpoints if this is a single-use edge.
     */
    public void bindPorts() {
        if (policy == EdgePolicy.SINGLE_USE) {
            source.bind(target);
            target.bind(source);
        }
    }

    /**
     * Frees both endpoints if this is a single-use edge.
     */
    public void releasePorts() {
        if (policy == EdgePolicy.SINGLE_USE) {
            source.release();
            target.release();
        }
    }

    /**
     * Flags the edge with a warning.
     *
     * @param color indicator color, e.g. {@code #FF9800}
     * @param reason human readable reason, appended to the annotations
     */
    public void markWarning(String color, String reason) {
        if (status != EdgeStatus.ERROR) {
            status = EdgeStatus.WARNING;
        }
        statusColor = color;
        showStatusIndicator = true;
        if (reason != null && !reason.isBlank() && !annotations.contains(reason)) {
            annotations.add(reason);
        }
    }

    /**
     * Applies ERD multiplicity markers; null ends are left unchanged.
     *
     * @param preset markers to apply
     */
    public void applyPreset(MultiplicityPreset preset) {
        if (preset == null) {
            return;
        }
        if (preset.start() != null) {
            startMultiplicity = preset.start();
        }
        if (preset.end() != null) {
            endMultiplicity = preset.end();
        }
    }

    public DiagramNode sourceNode() {
        return source.owner();
    }

    public DiagramNode targetNode() {
        return target.owner();
    }

    /**
     * Returns true if this edge joins the two nodes, in either direction.
     *
     * @param a one node
     * @param b the other node
     * @return true if the edge links {@code a} and {@code b}
     */
    public boolean links(DiagramNode a, DiagramNode b) {
        return (sourceNode() == a && targetNode() == b) || (sourceNode() == b && targetNode() == a);
    }

    public boolean touches(DiagramNode node) {
        return sourceNode() == node || targetNode() == node;
    }

    public UUID id() {
        return id;
    }

    public EdgePolicy policy() {
        return policy;
    }

    public Port source() {
        return source;
    }

    public Port target() {
        return target;
    }

    public EdgeStatus status() {
        return status;
    }

    public void setStatus(EdgeStatus status) {
        this.status = Objects.requireNonNull(status, "status must not be null");
    }

    public String statusColor() {
        return statusColor;
    }

    public boolean showStatusIndicator() {
        return showStatusIndicator;
    }

    public List<String> annotations() {
        return Collections.unmodifiableList(annotations);
    }

    public ColumnSchema schema() {
        return schema;
    }

    public void setSchema(ColumnSchema schema) {
        this.schema = schema;
    }

    public ColumnSchema expectedSchema() {
        return expectedSchema;
    }

    public void setExpectedSchema(ColumnSchema expectedSchema) {
        this.expectedSchema = expectedSchema;
    }

    public UUID sourceRowId() {
        return sourceRowId;
    }

    public UUID targetRowId() {
        return targetRowId;
    }

    public Multiplicity startMultiplicity() {
        return startMultiplicity;
    }

    public Multiplicity endMultiplicity() {
        return endMultiplicity;
    }

    public FlowDirection flowDirection() {
        return flowDirection;
    }

    public void setFlowDirection(FlowDirection flowDirection) {
        this.flowDirection = Objects.requireNonNull(flowDirection, "flowDirection must not be null");
    }

    public boolean isDataFlowAnimated() {
        return dataFlowAnimated;
    }

    public void setDataFlowAnimated(boolean dataFlowAnimated) {
        this.dataFlowAnimated = dataFlowAnimated;
    }

    public String dataFlowColor() {
        return dataFlowColor;
    }

    public void setDataFlowColor(String dataFlowColor) {
        this.dataFlowColor = dataFlowColor;
    }

    public String label1() {
        return label1;
    }

    public void setLabel1(String label1) {
        this.label1 = label1 == null ? "" : label1;
    }

    public String label2() {
        return label2;
    }

    public void setLabel2(String label2) {
        this.label2 = label2 == null ? "" : label2;
    }

    public String label3() {
        return label3;
    }

    public void setLabel3(String label3) {
        this.label3 = label3 == null ? "" : label3;
    }

    public String dataTypeLabel() {
        return dataTypeLabel;
    }

    public void setDataTypeLabel(String dataTypeLabel) {
        this.dataTypeLabel = dataTypeLabel == null ? "" : dataTypeLabel;
    }

    @Override
    public String toString() {
        return sourceNode().name() + " -> " + targetNode().name() + " [" + status + "]";
    }
}

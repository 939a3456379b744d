package com.linkgraph.core.graph;

import com.linkgraph.core.model.EdgePolicy;
import com.linkgraph.core.model.EdgeStatus;
import com.linkgraph.core.model.Multiplicity;
import com.linkgraph.core.model.MultiplicityPreset;
import com.linkgraph.core.node.GenericNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Edge}.
 */
class EdgeTest {

    private GenericNode a;
    private GenericNode b;
    private Port out;
    private Port in;

    @BeforeEach
    void setUp() {
        a = new GenericNode("A");
        b = new GenericNode("B");
        out = a.addOutputPort("string");
        in = b.addInputPort("string");
    }

    @Test
    void constructor_sameOwner_throws() {
        Port ownIn = a.addInputPort("string");

        assertThatThrownBy(() -> new Edge(out, ownIn, EdgePolicy.FAN_OUT))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("different nodes");
    }

    @Test
    void constructor_reversedDirections_throws() {
        assertThatThrownBy(() -> new Edge(in, out, EdgePolicy.FAN_OUT))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void bindPorts_singleUse_consumesBothPorts() {
        Edge edge = new Edge(out, in, EdgePolicy.SINGLE_USE);

        edge.bindPorts();

        assertThat(out.isAvailable()).isFalse();
        assertThat(in.isAvailable()).isFalse();
        assertThat(out.connectedTo()).isSameAs(in);
        assertThat(in.connectedTo()).isSameAs(out);
    }

    @Test
    void bindPorts_fanOut_leavesPortsAvailable() {
        Edge edge = new Edge(out, in, EdgePolicy.FAN_OUT);

        edge.bindPorts();

        assertThat(out.isAvailable()).isTrue();
        assertThat(in.isAvailable()).isTrue();
    }

    @Test
    void markWarning_keepsErrorAndAddsAnnotationOnce() {
        Edge edge = new Edge(out, in, EdgePolicy.FAN_OUT);
        edge.setStatus(EdgeStatus.ERROR);

        edge.markWarning("#FF9800", "Schema mismatch");
        edge.markWarning("#FF9800", "Schema mismatch");

        assertThat(edge.status()).isEqualTo(EdgeStatus.ERROR);
        assertThat(edge.showStatusIndicator()).isTrue();
        assertThat(edge.annotations()).containsExactly("Schema mismatch");
    }

    @Test
    void applyPreset_nullEnd_keepsExistingMarker() {
        Edge edge = new Edge(out, in, EdgePolicy.FAN_OUT);
        edge.applyPreset(new MultiplicityPreset(Multiplicity.ONE, Multiplicity.MANY));

        edge.applyPreset(new MultiplicityPreset(null, Multiplicity.ZERO_OR_MANY));

        assertThat(edge.startMultiplicity()).isEqualTo(Multiplicity.ONE);
        assertThat(edge.endMultiplicity()).isEqualTo(Multiplicity.ZERO_OR_MANY);
    }
}

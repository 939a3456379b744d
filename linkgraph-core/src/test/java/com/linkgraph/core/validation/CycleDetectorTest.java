package com.linkgraph.core.validation;

import com.linkgraph.core.graph.ConnectionGraph;
import com.linkgraph.core.graph.Edge;
import com.linkgraph.core.model.EdgePolicy;
import com.linkgraph.core.node.GenericNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeout;

/**
 * Tests for {@link CycleDetector}.
 */
class CycleDetectorTest {

    private ConnectionGraph graph;
    private CycleDetector detector;
    private GenericNode a;
    private GenericNode b;
    private GenericNode c;

    @BeforeEach
    void setUp() {
        graph = new ConnectionGraph();
        detector = new CycleDetector(graph);
        a = node("A");
        b = node("B");
        c = node("C");
    }

    @Test
    void wouldCreateCycle_emptyGraph_returnsFalse() {
        assertThat(detector.wouldCreateCycle(a, b)).isFalse();
    }

    @Test
    void wouldCreateCycle_backEdgeOnChain_returnsTrue() {
        link(a, b);
        link(b, c);

        assertThat(detector.wouldCreateCycle(c, a)).isTrue();
        assertThat(detector.wouldCreateCycle(b, a)).isTrue();
    }

    @Test
    void wouldCreateCycle_forwardShortcut_returnsFalse() {
        link(a, b);
        link(b, c);

        assertThat(detector.wouldCreateCycle(a, c)).isFalse();
    }

    @Test
    void wouldCreateCycle_diamond_returnsFalse() {
        GenericNode d = node("D");
        link(a, b);
        link(a, c);
        link(b, d);

        assertThat(detector.wouldCreateCycle(c, d)).isFalse();
        assertThat(detector.wouldCreateCycle(d, a)).isTrue();
    }

    @Test
    void hasCycle_detectsExistingLoop() {
        link(a, b);
        link(b, c);
        assertThat(detector.hasCycle()).isFalse();

        link(c, a);

        assertThat(detector.hasCycle()).isTrue();
    }

    @Test
    void wouldCreateCycle_ignoredEdge_isLeftOutOfWalk() {
        Edge ab = link(a, b);
        link(b, c);

        assertThat(detector.wouldCreateCycle(c, a, ab)).isFalse();
        assertThat(detector.wouldCreateCycle(c, b, ab)).isTrue();
    }

    @Test
    void wouldCreateCycle_longChain_completesQuickly() {
        List<GenericNode> chain = new ArrayList<>();
        for (int i = 0; i < 20_000; i++) {
            chain.add(node("N" + i));
        }
        for (int i = 1; i < chain.size(); i++) {
            link(chain.get(i - 1), chain.get(i));
        }
        GenericNode first = chain.get(0);
        GenericNode last = chain.get(chain.size() - 1);

        assertTimeout(Duration.ofSeconds(5), () -> {
            assertThat(detector.wouldCreateCycle(last, first)).isTrue();
            assertThat(detector.wouldCreateCycle(first, last)).isFalse();
            assertThat(detector.hasCycle()).isFalse();
        });
    }

    private Edge link(GenericNode from, GenericNode to) {
        Edge edge = new Edge(from.outputPorts().get(0), to.inputPorts().get(0), EdgePolicy.FAN_OUT);
        graph.add(edge);
        return edge;
    }

    private static GenericNode node(String name) {
        GenericNode node = new GenericNode(name);
        node.addInputPort("any");
        node.addOutputPort("any");
        return node;
    }
}

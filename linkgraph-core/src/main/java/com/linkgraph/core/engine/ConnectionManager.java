package com.linkgraph.core.engine;

import com.linkgraph.core.config.EngineConfig;
import com.linkgraph.core.graph.AutomationNode;
import com.linkgraph.core.graph.ConnectionGraph;
import com.linkgraph.core.graph.DiagramNode;
import com.linkgraph.core.graph.Edge;
import com.linkgraph.core.graph.Port;
import com.linkgraph.core.graph.PortRegistry;
import com.linkgraph.core.graph.PortState;
import com.linkgraph.core.graph.TypeCompatibility;
import com.linkgraph.core.history.ConnectAction;
import com.linkgraph.core.history.DisconnectAction;
import com.linkgraph.core.history.HistoryLog;
import com.linkgraph.core.history.MoveAction;
import com.linkgraph.core.model.EdgePolicy;
import com.linkgraph.core.model.FlowDirection;
import com.linkgraph.core.model.MultiplicityPreset;
import com.linkgraph.core.model.PortDirection;
import com.linkgraph.core.schema.InferenceResult;
import com.linkgraph.core.schema.NodeMetadata;
import com.linkgraph.core.schema.SchemaPropagator;
import com.linkgraph.core.validation.CycleDetector;
import com.linkgraph.core.validation.NodeKindRules;
import com.linkgraph.core.validation.PkFkValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Entry point of the connection engine: creates, removes and moves edges between diagram nodes.
 *
 * <p>Two edge-creation policies exist:
 * <ul>
 *   <li><b>Automation</b> (both nodes are {@link AutomationNode}s): the first free output and
 *       input ports are used and consumed, and the edge must pass the direction, type, node kind
 *       and cycle checks. A failed check refuses the edge quietly.</li>
 *   <li><b>Generic</b> (any other pair): the first output and input ports are used whether or not
 *       they are already in use, so ports fan out. Schema metadata is attached and column edges
 *       are checked as key relationships.</li>
 * </ul>
 * Every successful mutation is recorded for undo, re-infers the schemas of the nodes involved
 * and asks the host to redraw. Semantic findings only annotate edges.
 *
 * <p>Not thread-safe. All calls must come from one thread or be serialized by the caller.
 */
public class ConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final EngineConfig config;
    private final Runnable redraw;
    private final ConnectionGraph graph = new ConnectionGraph();
    private final HistoryLog history = new HistoryLog();
    private final CycleDetector cycleDetector;
    private final NodeKindRules kindRules;
    private final PkFkValidator pkFkValidator;
    private final SchemaPropagator propagator;

    private MultiplicityPreset nextPreset = MultiplicityPreset.none();

    public ConnectionManager() {
        this(EngineConfig.defaults(), () -> { });
    }

    /**
     * Creates an engine.
     *
     * @param config engine settings
     * @param redraw called after every change that affects what the host displays
     */
    public ConnectionManager(EngineConfig config, Runnable redraw) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.redraw = Objects.requireNonNull(redraw, "redraw must not be null");
        NodeMetadata metadata = new NodeMetadata(config.propertyKeys());
        this.cycleDetector = new CycleDetector(graph);
        this.kindRules = new NodeKindRules(config.disallowedKindPairs());
        this.pkFkValidator = new PkFkValidator(metadata, config.warningColor());
        this.propagator = new SchemaPropagator(graph, metadata, config.warningColor());
    }

    /**
     * Connects {@code a} to {@code b}, applying the pending multiplicity preset if one is set.
     *
     * @param a source node
     * @param b target node
     * @return {@link ConnectResult#CONNECTED}, or the reason the edge was refused
     * @throws IllegalArgumentException if {@code a} and {@code b} are the same node
     */
    public ConnectResult connect(DiagramNode a, DiagramNode b) {
        return connect(a, b, null);
    }

    /**
     * Connects {@code a} to {@code b} with explicit ERD multiplicity markers. The pending preset
     * is discarded when the edge is created.
     *
     * @param a source node
     * @param b target node
     * @param preset markers for the new edge, or null to use the pending preset
     * @return {@link ConnectResult#CONNECTED}, or the reason the edge was refused
     * @throws IllegalArgumentException if {@code a} and {@code b} are the same node
     */
    public ConnectResult connect(DiagramNode a, DiagramNode b, MultiplicityPreset preset) {
        checkDistinct(a, b);
        graph.registry().register(a);
        graph.registry().register(b);

        if (a instanceof AutomationNode source && b instanceof AutomationNode target) {
            return connectAutomation(source, target, preset);
        }

        Optional<Port> out = PortRegistry.firstPort(a, PortDirection.OUTPUT);
        Optional<Port> in = PortRegistry.firstPort(b, PortDirection.INPUT);
        if (out.isEmpty() || in.isEmpty()) {
            return reject(ConnectResult.NO_PORTS, a, b);
        }
        createGenericEdge(out.get(), in.get(), preset);
        return ConnectResult.CONNECTED;
    }

    /**
     * Connects two specific ports with the generic policy, e.g. one ERD column to another.
     *
     * @param output output port
     * @param input input port
     * @return {@link ConnectResult#CONNECTED}, or {@link ConnectResult#DIRECTION_MISMATCH}
     * @throws IllegalArgumentException if both ports are on the same node
     */
    public ConnectResult connectPorts(Port output, Port input) {
        Objects.requireNonNull(output, "output must not be null");
        Objects.requireNonNull(input, "input must not be null");
        checkDistinct(output.owner(), input.owner());
        if (output.direction() != PortDirection.OUTPUT || input.direction() != PortDirection.INPUT) {
            return reject(ConnectResult.DIRECTION_MISMATCH, output.owner(), input.owner());
        }
        graph.registry().register(output.owner());
        graph.registry().register(input.owner());
        createGenericEdge(output, input, null);
        return ConnectResult.CONNECTED;
    }

    /**
     * Runs the automation checks without changing anything.
     *
     * @param source source node
     * @param target target node
     * @return the result {@link #connect} would return
     * @throws IllegalArgumentException if {@code source} and {@code target} are the same node
     */
    public ConnectResult check(AutomationNode source, AutomationNode target) {
        checkDistinct(source, target);
        return evaluate(source, target).result();
    }

    /**
     * Removes the first edge found between two nodes, in either direction.
     *
     * @param a one node
     * @param b the other node
     * @return true if an edge was removed; false (and nothing happens) if none exists
     */
    public boolean disconnect(DiagramNode a, DiagramNode b) {
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(b, "b must not be null");
        Optional<Edge> found = graph.findBetween(a, b);
        if (found.isEmpty()) {
            log.debug("No edge between {} and {} to disconnect", a.name(), b.name());
            return false;
        }
        Edge edge = found.get();
        int position = graph.indexOf(edge);
        List<PortState> before = capture(edge.source(), edge.target());

        graph.remove(edge);
        edge.releasePorts();

        history.record(new DisconnectAction(graph, edge, position, before,
            capture(edge.source(), edge.target()), this::reinfer));
        reinfer(edge.sourceNode());
        reinfer(edge.targetNode());
        redraw.run();
        return true;
    }

    /**
     * Re-attaches an edge to new ports. A null port keeps that end where it is.
     *
     * @param edge edge to move
     * @param newSource new output port, or null
     * @param newTarget new input port, or null
     * @throws IllegalArgumentException if the edge is not in the graph, a port has the wrong
     *         direction, both ends would sit on one node, or a single-use edge would take a port
     *         that is already in use or fail the type, node kind or cycle checks of
     *         {@link #connect}
     */
    public void moveEdge(Edge edge, Port newSource, Port newTarget) {
        Objects.requireNonNull(edge, "edge must not be null");
        if (!graph.contains(edge)) {
            throw new IllegalArgumentException("Edge is not part of this graph: " + edge);
        }
        Port oldSource = edge.source();
        Port oldTarget = edge.target();
        Port source = newSource == null ? oldSource : newSource;
        Port target = newTarget == null ? oldTarget : newTarget;
        if (source == oldSource && target == oldTarget) {
            return;
        }
        if (source.direction() != PortDirection.OUTPUT) {
            throw new IllegalArgumentException("New source must be an output port: " + source);
        }
        if (target.direction() != PortDirection.INPUT) {
            throw new IllegalArgumentException("New target must be an input port: " + target);
        }
        if (source.owner() == target.owner()) {
            throw new IllegalArgumentException("Edge endpoints must be on different nodes: " + source.owner().name());
        }
        if (edge.policy() == EdgePolicy.SINGLE_USE) {
            checkFree(source, oldSource);
            checkFree(target, oldTarget);
            checkAutomationMove(edge, source, target);
        }

        Port[] touched = {oldSource, oldTarget, source, target};
        List<PortState> before = capture(touched);
        edge.releasePorts();
        edge.rebind(source, target);
        edge.bindPorts();
        graph.registry().register(source.owner());
        graph.registry().register(target.owner());

        propagator.attach(edge, List.of(source.owner()), List.of(target.owner()));
        if (edge.policy() == EdgePolicy.FAN_OUT) {
            pkFkValidator.validate(edge);
        }
        history.record(new MoveAction(graph, edge, oldSource, oldTarget, before, capture(touched), this::reinfer));
        Set<DiagramNode> affected = new LinkedHashSet<>();
        for (Port port : touched) {
            affected.add(port.owner());
        }
        affected.forEach(this::reinfer);
        redraw.run();
    }

    /**
     * Stores ERD multiplicity markers for the next edge created. The preset is cleared as soon
     * as that edge exists.
     *
     * @param preset markers, or null to clear
     */
    public void setNextEdgeMultiplicityPreset(MultiplicityPreset preset) {
        this.nextPreset = preset == null ? MultiplicityPreset.none() : preset;
    }

    public MultiplicityPreset pendingMultiplicityPreset() {
        return nextPreset;
    }

    /**
     * Re-infers the output schema of one node on demand.
     *
     * @param node node to re-infer
     * @return outcome
     */
    public InferenceResult inferSchema(DiagramNode node) {
        Objects.requireNonNull(node, "node must not be null");
        InferenceResult result = reinfer(node);
        redraw.run();
        return result;
    }

    /**
     * Undoes the most recent mutation.
     *
     * @return true if something was undone
     */
    public boolean undo() {
        boolean undone = history.undo().isPresent();
        if (undone) {
            redraw.run();
        }
        return undone;
    }

    /**
     * Redoes the most recently undone mutation.
     *
     * @return true if something was redone
     */
    public boolean redo() {
        boolean redone = history.redo().isPresent();
        if (redone) {
            redraw.run();
        }
        return redone;
    }

    public List<Edge> edges() {
        return graph.edges();
    }

    public List<Edge> edgesFrom(DiagramNode node) {
        return graph.edgesFrom(node);
    }

    public List<Edge> edgesInto(DiagramNode node) {
        return graph.edgesInto(node);
    }

    public Optional<Edge> findEdge(DiagramNode a, DiagramNode b) {
        return graph.findBetween(a, b);
    }

    /**
     * Returns the node owning a port, searching every node the engine has seen.
     *
     * @param portId port id
     * @return owning node, empty if the port is unknown
     */
    public Optional<DiagramNode> ownerOfPort(UUID portId) {
        return graph.registry().ownerOf(portId);
    }

    /**
     * Makes a node known to the engine before it takes part in any edge, so its ports can be
     * looked up with {@link #ownerOfPort(UUID)}.
     *
     * @param node node to register
     */
    public void register(DiagramNode node) {
        graph.registry().register(Objects.requireNonNull(node, "node must not be null"));
    }

    public boolean hasCycle() {
        return cycleDetector.hasCycle();
    }

    public HistoryLog history() {
        return history;
    }

    public EngineConfig config() {
        return config;
    }

    private ConnectResult connectAutomation(AutomationNode source, AutomationNode target, MultiplicityPreset preset) {
        Candidate candidate = evaluate(source, target);
        if (!candidate.result().isConnected()) {
            return reject(candidate.result(), source, target);
        }
        Port out = candidate.output();
        Port in = candidate.input();

        Edge edge = new Edge(out, in, EdgePolicy.SINGLE_USE);
        List<PortState> before = capture(out, in);
        edge.bindPorts();
        edge.applyPreset(takePreset(preset));
        edge.setFlowDirection(FlowDirection.FORWARD);
        edge.setDataFlowAnimated(config.animateAutomationEdges());
        edge.setDataFlowColor(config.dataFlowColorFor(out.dataType()));
        graph.add(edge);

        propagator.attach(edge, List.of(source), List.of(target));
        finishCreate(edge, before, capture(out, in));
        return ConnectResult.CONNECTED;
    }

    private Candidate evaluate(AutomationNode source, AutomationNode target) {
        if (graph.findBetween(source, target).isPresent()) {
            return Candidate.rejected(ConnectResult.ALREADY_CONNECTED);
        }
        Optional<Port> out = PortRegistry.firstAvailablePort(source, PortDirection.OUTPUT);
        Optional<Port> in = PortRegistry.firstAvailablePort(target, PortDirection.INPUT);
        if (out.isEmpty() || in.isEmpty()) {
            return Candidate.rejected(ConnectResult.NO_AVAILABLE_PORT);
        }
        if (out.get().direction() != PortDirection.OUTPUT || in.get().direction() != PortDirection.INPUT) {
            return Candidate.rejected(ConnectResult.DIRECTION_MISMATCH);
        }
        if (!TypeCompatibility.isCompatible(out.get().dataType(), in.get().dataType())) {
            return Candidate.rejected(ConnectResult.INCOMPATIBLE_TYPES);
        }
        if (!kindRules.allows(source.kind(), target.kind())) {
            return Candidate.rejected(ConnectResult.DISALLOWED_NODE_KINDS);
        }
        if (cycleDetector.wouldCreateCycle(source, target)) {
            return Candidate.rejected(ConnectResult.WOULD_CREATE_CYCLE);
        }
        return new Candidate(ConnectResult.CONNECTED, out.get(), in.get());
    }

    private void createGenericEdge(Port out, Port in, MultiplicityPreset preset) {
        Edge edge = new Edge(out, in, EdgePolicy.FAN_OUT);
        List<PortState> before = capture(out, in);
        edge.applyPreset(takePreset(preset));
        edge.setFlowDirection(FlowDirection.FORWARD);
        graph.add(edge);

        DiagramNode a = out.owner();
        DiagramNode b = in.owner();
        propagator.attach(edge, List.of(a, b), List.of(b, a));
        pkFkValidator.validate(edge);
        finishCreate(edge, before, capture(out, in));
    }

    private void finishCreate(Edge edge, List<PortState> before, List<PortState> after) {
        history.record(new ConnectAction(graph, edge, before, after, this::reinfer));
        log.debug("Connected {} -> {}", edge.source(), edge.target());
        reinfer(edge.sourceNode());
        reinfer(edge.targetNode());
        redraw.run();
    }

    /**
     * Returns the preset for a new edge and clears the pending one.
     */
    private MultiplicityPreset takePreset(MultiplicityPreset explicit) {
        MultiplicityPreset pending = nextPreset;
        nextPreset = MultiplicityPreset.none();
        return explicit != null ? explicit : pending;
    }

    private InferenceResult reinfer(DiagramNode node) {
        InferenceResult result = propagator.reinfer(node);
        if (result.isFailure()) {
            log.warn("Schema inference failed for {}: {}", node.name(), result.message());
        }
        return result;
    }

    private ConnectResult reject(ConnectResult reason, DiagramNode a, DiagramNode b) {
        log.debug("Refused to connect {} -> {}: {}", a.name(), b.name(), reason);
        return reason;
    }

    private static void checkDistinct(DiagramNode a, DiagramNode b) {
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(b, "b must not be null");
        if (a == b) {
            throw new IllegalArgumentException("Cannot connect a node to itself: " + a.name());
        }
    }

    /**
     * Applies the automation connect checks to a single-use edge about to be re-attached. The
     * edge itself is left out of the cycle walk.
     */
    private void checkAutomationMove(Edge edge, Port source, Port target) {
        if (!(source.owner() instanceof AutomationNode from) || !(target.owner() instanceof AutomationNode to)) {
            throw new IllegalArgumentException("Single-use edges must join automation nodes: "
                + source.owner().name() + " -> " + target.owner().name());
        }
        if (!TypeCompatibility.isCompatible(source.dataType(), target.dataType())) {
            throw new IllegalArgumentException("Incompatible port types: "
                + source.dataType() + " -> " + target.dataType());
        }
        if (!kindRules.allows(from.kind(), to.kind())) {
            throw new IllegalArgumentException("Node kinds may not be connected: "
                + from.kind() + " -> " + to.kind());
        }
        if (cycleDetector.wouldCreateCycle(from, to, edge)) {
            throw new IllegalArgumentException("Move would create a cycle: "
                + from.name() + " -> " + to.name());
        }
    }

    private static void checkFree(Port port, Port current) {
        if (port != current && !port.isAvailable()) {
            throw new IllegalArgumentException("Port is already in use: " + port);
        }
    }

    private static List<PortState> capture(Port... ports) {
        List<PortState> states = new ArrayList<>();
        Set<Port> seen = new LinkedHashSet<>();
        for (Port port : ports) {
            if (seen.add(port)) {
                states.add(PortState.capture(port));
            }
        }
        return states;
    }

    private record Candidate(ConnectResult result, Port output, Port input) {

        static Candidate rejected(ConnectResult reason) {
            return new Candidate(reason, null, null);
        }
    }
}

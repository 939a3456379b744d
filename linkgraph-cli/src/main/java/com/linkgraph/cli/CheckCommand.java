package com.linkgraph.cli;

import com.linkgraph.cli.diagram.DiagramException;
import com.linkgraph.cli.diagram.DiagramFile;
import com.linkgraph.cli.diagram.DiagramLoader;
import com.linkgraph.cli.diagram.DiagramReplay;
import com.linkgraph.core.config.ConfigLoader;
import com.linkgraph.core.config.EngineConfig;
import com.linkgraph.core.engine.ConnectionManager;
import com.linkgraph.core.graph.DiagramNode;
import com.linkgraph.core.graph.Edge;
import com.linkgraph.core.model.ColumnDefinition;
import com.linkgraph.core.model.ColumnSchema;
import com.linkgraph.core.model.EdgeStatus;
import com.linkgraph.core.schema.NodeMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Replays a diagram file through the connection engine and prints the resulting edges.
 *
 * <p><b>Exit codes:</b> 0 on success, 1 if the diagram cannot be loaded, 2 with
 * {@code --strict} when an edge is not {@code NORMAL} or a connection was refused.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * linkgraph check diagram.yaml
 * linkgraph check diagram.yaml --strict --schemas
 * linkgraph check diagram.yaml --config linkgraph.yaml
 * }</pre>
 */
@Command(
    name = "check",
    description = "Replay a diagram file and report edge status",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Diagram file (YAML or JSON)")
    private Path diagramFile;

    @Option(names = {"-c", "--config"}, description = "Engine configuration file (linkgraph.yaml)")
    private Path configFile;

    @Option(names = {"--strict"}, description = "Fail if any edge is not NORMAL or any connection is refused")
    private boolean strict;

    @Option(names = {"--schemas"}, description = "Also print the output schema of every node")
    private boolean schemas;

    @Override
    public Integer call() {
        EngineConfig config = configFile == null ? EngineConfig.defaults() : ConfigLoader.load(configFile);
        ConnectionManager manager = new ConnectionManager(config, () -> { });
        DiagramReplay replay;
        try {
            DiagramFile diagram = DiagramLoader.load(diagramFile);
            replay = new DiagramReplay(manager).run(diagram);
        } catch (DiagramException e) {
            log.error("{}", e.getMessage());
            return 1;
        }

        PrintWriter out = spec.commandLine().getOut();
        List<Edge> edges = manager.edges();
        out.printf("Nodes: %d, edges: %d, refused: %d%n", replay.nodes().size(), edges.size(), replay.refused().size());
        for (Edge edge : edges) {
            out.printf("  %s -> %s  %s%s%n",
                DiagramReplay.describe(edge.source()),
                DiagramReplay.describe(edge.target()),
                edge.status(),
                edge.annotations().isEmpty() ? "" : "  " + String.join("; ", edge.annotations()));
        }
        for (DiagramReplay.Outcome refused : replay.refused()) {
            out.printf("  refused %s  %s%n", refused.connection(), refused.result());
        }
        if (schemas) {
            printSchemas(out, replay, new NodeMetadata(config.propertyKeys()));
        }
        out.flush();

        boolean clean = replay.refused().isEmpty()
            && edges.stream().allMatch(e -> e.status() == EdgeStatus.NORMAL);
        if (strict && !clean) {
            log.info("Strict check failed for {}", diagramFile);
            return 2;
        }
        return 0;
    }

    private static void printSchemas(PrintWriter out, DiagramReplay replay, NodeMetadata metadata) {
        out.println("Schemas:");
        for (DiagramNode node : replay.nodes().values()) {
            Optional<ColumnSchema> schema = metadata.outputSchema(node);
            out.printf("  %s: %s%n", node.name(), schema.map(CheckCommand::render).orElse("-"));
        }
    }

    private static String render(ColumnSchema schema) {
        return schema.columns().stream()
            .map(CheckCommand::render)
            .collect(Collectors.joining(", ", "[", "]"));
    }

    private static String render(ColumnDefinition column) {
        return column.hasDataType() ? column.name() + ":" + column.dataType() : column.name();
    }
}

package com.linkgraph.cli;

import com.linkgraph.core.graph.TypeCompatibility;
import com.linkgraph.core.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * Command to list automation node kinds or the type conversion table.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List automation node kinds
 * linkgraph list kinds
 *
 * # List one-way type conversions
 * linkgraph list types
 * }</pre>
 */
@Command(
    name = "list",
    description = "List automation node kinds or type conversions",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: kinds or types"
    )
    private String type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        return switch (type.toLowerCase()) {
            case "kinds", "kind" -> listKinds(out);
            case "types", "type" -> listTypes(out);
            default -> {
                log.error("Unknown type: {}. Use: kinds or types", type);
                yield 1;
            }
        };
    }

    private int listKinds(PrintWriter out) {
        out.println("Automation node kinds:");
        for (NodeKind kind : NodeKind.values()) {
            out.printf("  %s%n", kind);
        }
        return 0;
    }

    private int listTypes(PrintWriter out) {
        out.println("Type conversions (output -> input):");
        out.printf("  any -> *, * -> any, T -> T%n");
        Map<String, Set<String>> sorted = new TreeMap<>(TypeCompatibility.conversions());
        sorted.forEach((from, to) -> out.printf("  %s -> %s%n", from, String.join(", ", new TreeSet<>(to))));
        return 0;
    }
}

package com.linkgraph.cli;

import com.linkgraph.core.model.ColumnSchema;
import com.linkgraph.core.model.SchemaDiff;
import com.linkgraph.core.schema.SchemaCodec;
import com.linkgraph.core.schema.SchemaComparator;
import com.linkgraph.core.schema.SchemaFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to compare an expected column schema against an actual one.
 *
 * <p>Both files hold a JSON column array in the portable schema form.
 */
@Command(
    name = "diff",
    description = "Compare an expected column schema against an actual one",
    mixinStandardHelpOptions = true
)
public class DiffCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DiffCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Expected schema (JSON)")
    private Path expectedFile;

    @Parameters(index = "1", description = "Actual schema (JSON)")
    private Path actualFile;

    @Option(names = {"--fail-on-breaking"}, description = "Fail if a column is missing or typed differently")
    private boolean failOnBreaking;

    @Override
    public Integer call() {
        ColumnSchema expected;
        ColumnSchema actual;
        try {
            expected = SchemaCodec.decodeSchema(Files.readString(expectedFile));
            actual = SchemaCodec.decodeSchema(Files.readString(actualFile));
        } catch (IOException | SchemaFormatException e) {
            log.error("Cannot read schemas: {}", e.getMessage());
            return 1;
        }

        SchemaDiff diff = SchemaComparator.diff(expected, actual);
        PrintWriter out = spec.commandLine().getOut();
        if (!diff.hasDifferences()) {
            out.println("No differences");
            return 0;
        }
        diff.missingColumns().forEach(c -> out.printf("  missing   %s%n", c));
        diff.typeDifferences().forEach(d ->
            out.printf("  type      %s: expected %s, actual %s%n", d.column(), d.expectedType(), d.actualType()));
        diff.nullabilityDifferences().forEach(d ->
            out.printf("  nullable  %s: expected %s, actual %s%n", d.column(), d.expectedNullable(), d.actualNullable()));
        diff.defaultDifferences().forEach(d ->
            out.printf("  default   %s: expected '%s', actual '%s'%n", d.column(), d.expectedDefault(), d.actualDefault()));
        out.println(diff.breaksCompatibility() ? "Incompatible" : "Compatible");
        out.flush();

        return failOnBreaking && diff.breaksCompatibility() ? 2 : 0;
    }
}

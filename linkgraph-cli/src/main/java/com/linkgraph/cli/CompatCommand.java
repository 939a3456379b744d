package com.linkgraph.cli;

import com.linkgraph.core.graph.TypeCompatibility;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Answers whether an output port of one type can feed an input port of another. Exits with 1
 * when it cannot.
 */
@Command(
    name = "compat",
    description = "Check whether an output type can feed an input type",
    mixinStandardHelpOptions = true
)
public class CompatCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Output port type, e.g. number")
    private String outputType;

    @Parameters(index = "1", description = "Input port type, e.g. string")
    private String inputType;

    @Override
    public Integer call() {
        boolean compatible = TypeCompatibility.isCompatible(outputType, inputType);
        spec.commandLine().getOut().printf("%s -> %s: %s%n", outputType, inputType,
            compatible ? "compatible" : "incompatible");
        return compatible ? 0 : 1;
    }
}

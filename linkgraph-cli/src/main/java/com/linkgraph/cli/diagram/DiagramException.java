package com.linkgraph.cli.diagram;

/**
 * A diagram file that cannot be read or does not describe a consistent diagram.
 */
public class DiagramException extends RuntimeException {

    public DiagramException(String message) {
        super(message);
    }

    public DiagramException(String message, Throwable cause) {
        super(message, cause);
    }
}

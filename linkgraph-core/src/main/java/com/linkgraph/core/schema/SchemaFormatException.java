package com.linkgraph.core.schema;

/**
 * Thrown when a serialized schema or foreign key payload cannot be decoded.
 */
public class SchemaFormatException extends RuntimeException {

    public SchemaFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}

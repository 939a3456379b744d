package com.linkgraph.core.schema;

import com.linkgraph.core.model.ColumnSchema;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a schema re-inference.
 *
 * @param status what happened
 * @param schema the inferred schema when {@code status} is {@link Status#INFERRED}, else null
 * @param message failure reason when {@code status} is {@link Status#FAILED}, else null
 */
public record InferenceResult(Status status, ColumnSchema schema, String message) {

    /**
     * Inference outcome categories.
     */
    public enum Status {
        /** A schema was produced and stored */
        INFERRED,
        /** The node kept its previous schema */
        UNCHANGED,
        /** The node has no re-inference capability */
        NOT_SUPPORTED,
        /** Inference failed; nothing was changed */
        FAILED
    }

    public InferenceResult {
        Objects.requireNonNull(status, "status must not be null");
        if (status == Status.INFERRED) {
            Objects.requireNonNull(schema, "schema must not be null when inferred");
        }
    }

    public static InferenceResult inferred(ColumnSchema schema) {
        return new InferenceResult(Status.INFERRED, schema, null);
    }

    public static InferenceResult unchanged() {
        return new InferenceResult(Status.UNCHANGED, null, null);
    }

    public static InferenceResult notSupported() {
        return new InferenceResult(Status.NOT_SUPPORTED, null, null);
    }

    public static InferenceResult failed(String message) {
        return new InferenceResult(Status.FAILED, null, message);
    }

    public boolean isFailure() {
        return status == Status.FAILED;
    }

    public Optional<ColumnSchema> inferredSchema() {
        return Optional.ofNullable(schema);
    }
}

package com.linkgraph.core.validation;

import com.linkgraph.core.graph.DiagramNode;
import com.linkgraph.core.graph.Edge;
import com.linkgraph.core.model.ColumnDefinition;
import com.linkgraph.core.model.ForeignKeyDefinition;
import com.linkgraph.core.schema.NodeMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Checks that an edge linking two table columns forms a legitimate key relationship.
 *
 * <p>Applies only when both ends of the edge carry a row id that resolves to a column of the
 * owning node. The edge is valid when
 * <ol>
 *   <li>one column is flagged foreign key and the other primary key, or</li>
 *   <li>either node declares a foreign key to the other node's entity that pairs the two columns
 *       at the same position.</li>
 * </ol>
 * Otherwise the edge is marked with a warning. Edge creation is never blocked.
 */
public class PkFkValidator {

    private static final Logger log = LoggerFactory.getLogger(PkFkValidator.class);

    private final NodeMetadata metadata;
    private final String warningColor;

    public PkFkValidator(NodeMetadata metadata, String warningColor) {
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
        this.warningColor = Objects.requireNonNull(warningColor, "warningColor must not be null");
    }

    /**
     * Validates the edge and annotates it when the key pair is unresolved.
     *
     * @param edge edge to validate
     * @return verdict
     */
    public PkFkVerdict validate(Edge edge) {
        if (edge.sourceRowId() == null || edge.targetRowId() == null) {
            return PkFkVerdict.NOT_APPLICABLE;
        }
        DiagramNode sourceNode = edge.sourceNode();
        DiagramNode targetNode = edge.targetNode();
        Optional<ColumnDefinition> source = metadata.columns(sourceNode).findByRowId(edge.sourceRowId());
        Optional<ColumnDefinition> target = metadata.columns(targetNode).findByRowId(edge.targetRowId());
        if (source.isEmpty() || target.isEmpty()) {
            return PkFkVerdict.NOT_APPLICABLE;
        }

        PkFkVerdict verdict = evaluate(sourceNode, source.get(), targetNode, target.get());
        if (verdict == PkFkVerdict.UNRESOLVED) {
            String reason = "No key relationship between " + metadata.entityName(sourceNode) + "." + source.get().name()
                + " and " + metadata.entityName(targetNode) + "." + target.get().name();
            edge.markWarning(warningColor, reason);
            log.warn("{} on edge {}", reason, edge);
        }
        return verdict;
    }

    private PkFkVerdict evaluate(DiagramNode sourceNode, ColumnDefinition source,
                                 DiagramNode targetNode, ColumnDefinition target) {
        boolean flagsMatch = (source.foreignKey() && target.primaryKey())
            || (source.primaryKey() && target.foreignKey());
        if (flagsMatch) {
            return PkFkVerdict.FLAGS_MATCH;
        }
        if (declares(sourceNode, source, targetNode, target) || declares(targetNode, target, sourceNode, source)) {
            return PkFkVerdict.DECLARED_FOREIGN_KEY;
        }
        return PkFkVerdict.UNRESOLVED;
    }

    /**
     * Returns true if {@code owner} declares a foreign key to {@code referenced}'s entity pairing
     * {@code local} with {@code remote}.
     */
    private boolean declares(DiagramNode owner, ColumnDefinition local, DiagramNode referenced, ColumnDefinition remote) {
        String referencedEntity = metadata.entityName(referenced);
        for (ForeignKeyDefinition fk : metadata.foreignKeys(owner)) {
            if (fk.links(referencedEntity, local.name(), remote.name())) {
                return true;
            }
        }
        return false;
    }
}

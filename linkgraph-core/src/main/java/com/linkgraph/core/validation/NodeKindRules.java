package com.linkgraph.core.validation;

import com.linkgraph.core.config.EngineConfig.KindPair;
import com.linkgraph.core.model.NodeKind;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Static set of automation node kind pairs that may not be connected (source kind, target kind).
 *
 * <p>Defaults: a trigger may not feed another trigger, and a data source may not feed another
 * data source.
 */
public class NodeKindRules {

    private final Set<KindPair> disallowed;

    public NodeKindRules(List<KindPair> disallowed) {
        this.disallowed = disallowed.stream()
            .filter(p -> p.source() != null && p.target() != null)
            .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Returns true unless the pair is on the disallowed list.
     *
     * @param source kind of the source node
     * @param target kind of the target node
     * @return true if the pair may be connected
     */
    public boolean allows(NodeKind source, NodeKind target) {
        return !disallowed.contains(new KindPair(source, target));
    }
}

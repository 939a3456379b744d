package com.linkgraph.core.graph;

import com.linkgraph.core.model.NodeProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * String-keyed bag of named, typed node properties.
 *
 * <p>Insertion order is kept so hosts can list properties the way they were declared.
 */
public final class NodeProperties {

    private final Map<String, NodeProperty> properties = new LinkedHashMap<>();

    /**
     * Declares (or replaces) a property.
     *
     * @param property property to declare
     * @return this bag
     */
    public NodeProperties define(NodeProperty property) {
        Objects.requireNonNull(property, "property must not be null");
        properties.put(property.name(), property);
        return this;
    }

    /**
     * Sets the current value of a property, declaring it when absent.
     *
     * @param name property name
     * @param value new current value
     * @return this bag
     * @throws IllegalArgumentException if the property restricts its values and {@code value} is not legal
     */
    public NodeProperties set(String name, Object value) {
        NodeProperty existing = properties.get(name);
        properties.put(name, existing == null ? NodeProperty.of(name, value) : existing.withValue(value));
        return this;
    }

    public Optional<NodeProperty> find(String name) {
        return Optional.ofNullable(properties.get(name));
    }

    /**
     * Returns the effective value (current, else default) of a property.
     *
     * @param name property name
     * @return value, empty if the property is absent or has no value
     */
    public Optional<Object> value(String name) {
        return find(name).map(NodeProperty::value);
    }

    /**
     * Returns the effective value rendered as trimmed text; blank values count as absent.
     *
     * @param name property name
     * @return non-blank text value
     */
    public Optional<String> text(String name) {
        return value(name)
            .map(Object::toString)
            .map(String::trim)
            .filter(s -> !s.isEmpty());
    }

    public boolean contains(String name) {
        return properties.containsKey(name);
    }

    public void remove(String name) {
        properties.remove(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(properties.keySet());
    }
}

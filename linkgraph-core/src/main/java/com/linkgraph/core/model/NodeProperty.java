package com.linkgraph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A named, typed property of a diagram node.
 *
 * @param name property name (key in the node's property bag)
 * @param type declared value type
 * @param defaultValue value used when no current value is set
 * @param currentValue user-set value, or null
 * @param choices legal string values; empty when unrestricted
 */
public record NodeProperty(
    String name,
    Class<?> type,
    Object defaultValue,
    Object currentValue,
    List<String> choices
) {
    /**
     * Compact constructor with validation.
     */
    public NodeProperty {
        Objects.requireNonNull(name, "name must not be null");
        if (type == null) {
            type = defaultValue != null ? defaultValue.getClass() : Object.class;
        }
        choices = choices == null ? List.of() : List.copyOf(choices);
        checkChoice(name, choices, currentValue);
    }

    /**
     * Creates an unrestricted property whose current value equals its default.
     *
     * @param name property name
     * @param value initial value
     * @return property
     */
    public static NodeProperty of(String name, Object value) {
        return new NodeProperty(name, null, value, value, List.of());
    }

    /**
     * Returns the current value, falling back to the default.
     *
     * @return effective value, possibly null
     */
    public Object value() {
        return currentValue != null ? currentValue : defaultValue;
    }

    /**
     * Returns a copy with a new current value.
     *
     * @param newValue value to set
     * @return updated property
     * @throws IllegalArgumentException if the property has choices and the value is not one of them
     */
    public NodeProperty withValue(Object newValue) {
        return new NodeProperty(name, type, defaultValue, newValue, choices);
    }

    private static void checkChoice(String name, List<String> choices, Object value) {
        if (choices.isEmpty() || value == null) {
            return;
        }
        String text = value.toString();
        boolean legal = choices.stream().anyMatch(c -> c.equalsIgnoreCase(text));
        if (!legal) {
            throw new IllegalArgumentException(
                "Value '" + text + "' is not a legal choice for property " + name + ": " + choices);
        }
    }
}

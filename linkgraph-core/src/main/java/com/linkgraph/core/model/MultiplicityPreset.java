package com.linkgraph.core.model;

/**
 * Pair of ERD multiplicity markers applied to a newly created edge.
 *
 * <p>A {@code null} end leaves the edge's marker at that end untouched.
 *
 * @param start marker at the source end, or null
 * @param end marker at the target end, or null
 */
public record MultiplicityPreset(Multiplicity start, Multiplicity end) {

    private static final MultiplicityPreset NONE = new MultiplicityPreset(null, null);

    /**
     * Returns the preset that changes nothing.
     *
     * @return empty preset
     */
    public static MultiplicityPreset none() {
        return NONE;
    }

    /**
     * Returns true if neither end carries a marker.
     *
     * @return true if the preset is empty
     */
    public boolean isEmpty() {
        return start == null && end == null;
    }
}

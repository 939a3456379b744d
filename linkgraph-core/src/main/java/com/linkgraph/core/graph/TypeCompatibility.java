package com.linkgraph.core.graph;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Directed compatibility relation over port data type tags.
 *
 * <p>An output of type A may feed an input of type B when:
 * <ul>
 *   <li>A and B are equal (ignoring case),</li>
 *   <li>either side is {@code any}, or</li>
 *   <li>the conversion A&rarr;B is on the allow-list below.</li>
 * </ul>
 *
 * <p>The allow-list is one-way: {@code number -> string} holds but {@code string -> number}
 * does not. Do not symmetrize it.
 *
 * <table>
 *   <caption>Allowed conversions</caption>
 *   <tr><th>from</th><th>to</th></tr>
 *   <tr><td>number</td><td>string</td></tr>
 *   <tr><td>string</td><td>object</td></tr>
 *   <tr><td>array</td><td>object</td></tr>
 *   <tr><td>object</td><td>array</td></tr>
 *   <tr><td>boolean</td><td>number, string</td></tr>
 * </table>
 */
public final class TypeCompatibility {

    /** Wildcard type tag compatible with everything */
    public static final String ANY = "any";

    private static final Map<String, Set<String>> CONVERSIONS = Map.of(
        "number", Set.of("string"),
        "string", Set.of("object"),
        "array", Set.of("object"),
        "object", Set.of("array"),
        "boolean", Set.of("number", "string")
    );

    private TypeCompatibility() {
        // Utility class
    }

    /**
     * Answers whether an output of {@code outputType} can feed an input of {@code inputType}.
     *
     * @param outputType type tag of the output port
     * @param inputType type tag of the input port
     * @return true if compatible
     */
    public static boolean isCompatible(String outputType, String inputType) {
        String out = normalize(outputType);
        String in = normalize(inputType);

        if (ANY.equals(out) || ANY.equals(in)) {
            return true;
        }
        if (out.equals(in)) {
            return true;
        }
        return CONVERSIONS.getOrDefault(out, Set.of()).contains(in);
    }

    /**
     * Returns the explicit one-way conversions, keyed by source type.
     *
     * @return immutable conversion table
     */
    public static Map<String, Set<String>> conversions() {
        return CONVERSIONS;
    }

    private static String normalize(String type) {
        return type == null ? "" : type.trim().toLowerCase(Locale.ROOT);
    }
}

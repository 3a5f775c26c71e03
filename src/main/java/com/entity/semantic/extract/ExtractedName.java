package com.entity.semantic.extract;

/**
 * A canonical name together with where it came from.
 *
 * @param value     the canonical name
 * @param fieldPath dotted path of the field (or of the mapping holding the name parts)
 * @param rule      which derivation rule produced it
 */
public record ExtractedName(String value, String fieldPath, Rule rule) {

    public enum Rule {
        /** A field ending in {@code NAME_FULL} or {@code NAME_ORG}. */
        FULL_NAME_FIELD,
        /** Built from {@code NAME_FIRST}, {@code NAME_MIDDLE}, {@code NAME_LAST}. */
        NAME_PARTS
    }
}

package net.modshub.util;

import net.modshub.domain.ModIdentifierType;

/**
 * Utility to classify identifier strings before they reach a store.
 *
 * Mod ids and slugs cannot collide: ids always carry underscores, slugs never do.
 * Anything that is neither is rejected up front so malformed input never costs a
 * store round-trip.
 */
public final class IdentifierClassifier {

    private IdentifierClassifier() {
    }

    /**
     * Classifies an identifier string by its type.
     *
     * Priority order:
     * 1. Mod id ({@code mod_<millis>_<token>})
     * 2. Slug (lowercase alphanumeric words joined by single hyphens)
     * 3. UNKNOWN
     *
     * No trimming or case folding happens here; lookups are exact-match.
     *
     * @param identifier The identifier string to classify
     * @return The classified identifier type
     */
    public static ModIdentifierType classify(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return ModIdentifierType.UNKNOWN;
        }
        if (ModIdGenerator.isModId(identifier)) {
            return ModIdentifierType.MOD_ID;
        }
        if (SlugGenerator.isValidSlug(identifier)) {
            return ModIdentifierType.SLUG;
        }
        return ModIdentifierType.UNKNOWN;
    }
}

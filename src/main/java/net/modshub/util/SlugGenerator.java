package net.modshub.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives URL slugs from mod titles.
 * <p>
 * Derivation is pure: the same title always yields the same slug. Disambiguation is
 * never attempted here; a taken slug is reported as a conflict by the caller.
 */
public final class SlugGenerator {
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{InCombiningDiacriticalMarks}+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern EDGE_DASHES = Pattern.compile("^-+|-+$");
    private static final Pattern VALID_SLUG = Pattern.compile("^[a-z0-9]+(-[a-z0-9]+)*$");

    public static final int MAX_SLUG_LENGTH = 100;

    private SlugGenerator() {}

    /**
     * Converts a title to its slug.
     * Example: "Bob's Café &amp; Overlay!" becomes "bobs-cafe-and-overlay"
     *
     * @param title the author-supplied title
     * @return the slug, or an empty string when the title has no letters or digits
     */
    public static String deriveSlug(String title) {
        if (title == null) {
            return "";
        }

        String slug = title.toLowerCase(Locale.ROOT).trim();

        // Normalize Unicode characters (é -> e, etc.)
        slug = Normalizer.normalize(slug, Normalizer.Form.NFD);
        slug = COMBINING_MARKS.matcher(slug).replaceAll("");

        slug = slug.replace("&", " and ");
        // Contractions collapse rather than split: "bob's" -> "bobs"
        slug = slug.replace("'", "");
        slug = slug.replace("’", "");
        slug = slug.replace("‘", "");

        slug = NON_ALPHANUMERIC.matcher(slug).replaceAll("-");
        slug = EDGE_DASHES.matcher(slug).replaceAll("");

        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = EDGE_DASHES.matcher(truncateAtWordBoundary(slug, MAX_SLUG_LENGTH)).replaceAll("");
        }
        return slug;
    }

    /**
     * Truncate a slug at the nearest word boundary.
     */
    private static String truncateAtWordBoundary(String slug, int maxLength) {
        if (slug.length() <= maxLength) {
            return slug;
        }

        // A dash right at maxLength means the cut already falls on a boundary
        int lastDash = slug.lastIndexOf('-', maxLength);

        if (lastDash <= 0 || lastDash < maxLength / 2) {
            return slug.substring(0, maxLength);
        }

        return slug.substring(0, lastDash);
    }

    /**
     * Lowercase letters, digits and single inner hyphens only.
     */
    public static boolean isValidSlug(String slug) {
        return slug != null && !slug.isEmpty() && VALID_SLUG.matcher(slug).matches();
    }
}

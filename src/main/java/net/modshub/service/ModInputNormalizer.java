package net.modshub.service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import net.modshub.exception.InvalidModRequestException;
import net.modshub.util.SlugGenerator;

/**
 * Validates and normalizes author-supplied mod fields.
 */
final class ModInputNormalizer {

    static final int MAX_TITLE_LENGTH = 200;
    static final int MAX_DESCRIPTION_LENGTH = 5000;
    static final int MAX_TAGS = 20;
    static final int MAX_TAG_LENGTH = 40;

    private ModInputNormalizer() {
    }

    static String requireTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new InvalidModRequestException("Title is required");
        }
        String trimmed = title.trim();
        if (trimmed.length() > MAX_TITLE_LENGTH) {
            throw new InvalidModRequestException("Title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
        return trimmed;
    }

    /**
     * @return the slug for {@code title}; never empty
     */
    static String slugFor(String title) {
        String slug = SlugGenerator.deriveSlug(title);
        if (slug.isEmpty()) {
            throw new InvalidModRequestException("Title must contain at least one letter or digit");
        }
        return slug;
    }

    static String description(String description) {
        if (description == null) {
            return null;
        }
        String trimmed = description.trim();
        if (trimmed.length() > MAX_DESCRIPTION_LENGTH) {
            throw new InvalidModRequestException(
                "Description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        return trimmed.isEmpty() ? null : trimmed;
    }

    static List<String> tags(List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return List.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String tag : tags) {
            if (tag == null || tag.isBlank()) {
                continue;
            }
            String value = tag.trim().toLowerCase(Locale.ROOT);
            if (value.length() > MAX_TAG_LENGTH) {
                throw new InvalidModRequestException("Tags must be at most " + MAX_TAG_LENGTH + " characters");
            }
            normalized.add(value);
        }
        if (normalized.size() > MAX_TAGS) {
            throw new InvalidModRequestException("At most " + MAX_TAGS + " tags are allowed");
        }
        return List.copyOf(normalized);
    }
}

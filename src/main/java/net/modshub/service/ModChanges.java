package net.modshub.service;

import java.util.List;
import net.modshub.domain.ModCategory;
import net.modshub.domain.ModVisibility;

/**
 * Partial update; a null field is left unchanged.
 */
public record ModChanges(String title,
                         String description,
                         ModCategory category,
                         List<String> tags,
                         ModVisibility visibility) {

    public static ModChanges none() {
        return new ModChanges(null, null, null, null, null);
    }

    public boolean isEmpty() {
        return title == null && description == null && category == null && tags == null && visibility == null;
    }
}

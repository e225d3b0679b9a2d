package net.modshub.service;

import java.util.List;
import net.modshub.domain.ModCategory;
import net.modshub.domain.ModVisibility;

/**
 * Fields supplied when creating a mod. Null optional fields take their defaults.
 */
public record ModDraft(String title,
                       String description,
                       ModCategory category,
                       List<String> tags,
                       ModVisibility visibility) {
}

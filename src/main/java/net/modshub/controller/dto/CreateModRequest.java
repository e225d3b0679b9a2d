package net.modshub.controller.dto;

import java.util.List;

/**
 * Body of {@code POST /mods}. Enum-valued fields arrive as their lower-case wire names.
 */
public record CreateModRequest(String title,
                               String description,
                               String category,
                               List<String> tags,
                               String visibility) {
}

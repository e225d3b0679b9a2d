package net.modshub.controller.dto;

import java.util.List;

/**
 * Body of {@code PATCH/PUT /mods/{modId}}; omitted fields stay as they are.
 */
public record UpdateModRequest(String title,
                               String description,
                               String category,
                               List<String> tags,
                               String visibility) {
}

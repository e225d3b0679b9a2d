package net.modshub.controller.dto;

import java.util.List;
import net.modshub.domain.Mod;

/**
 * Wire shape of a mod. Timestamps are ISO-8601 strings.
 */
public record ModResponse(String modId,
                          String slug,
                          String title,
                          String description,
                          String category,
                          List<String> tags,
                          String visibility,
                          String status,
                          boolean featured,
                          String authorId,
                          String createdAt,
                          String updatedAt) {

    public static ModResponse from(Mod mod) {
        return new ModResponse(
            mod.getModId(),
            mod.getSlug(),
            mod.getTitle(),
            mod.getDescription(),
            mod.getCategory().wireValue(),
            mod.getTags(),
            mod.getVisibility().wireValue(),
            mod.getStatus().wireValue(),
            mod.isFeatured(),
            mod.getOwnerId(),
            mod.getCreatedAt().toString(),
            mod.getUpdatedAt().toString()
        );
    }
}

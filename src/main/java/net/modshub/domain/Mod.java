package net.modshub.domain;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Primary mod record. {@code modId} and {@code ownerId} never change after creation;
 * {@code slug} always mirrors the current title and is reserved in the slug index.
 * {@code version} starts at 0 and grows by one with every stored change.
 */
@Value
@Builder(toBuilder = true)
public class Mod {
    String modId;
    String slug;
    String title;
    String description;
    ModCategory category;
    @Builder.Default
    List<String> tags = List.of();
    ModVisibility visibility;
    ModStatus status;
    String ownerId;
    boolean featured;
    Instant createdAt;
    Instant updatedAt;
    long version;

    /** Builder seeded from this record with the version bumped, for a conditional replace. */
    public ModBuilder nextRevision() {
        return toBuilder().version(version + 1);
    }

    public boolean isPublic() {
        return visibility == ModVisibility.PUBLIC;
    }
}

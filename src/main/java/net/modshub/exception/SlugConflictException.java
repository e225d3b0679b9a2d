package net.modshub.exception;

/**
 * A create or rename would take a slug already reserved by a different mod.
 * Recoverable by choosing another title; no state was changed.
 */
public class SlugConflictException extends ModsHubException {

    public static final String TITLE = "Slug Already Exists";

    private final String slug;
    private final String holderModId;

    public SlugConflictException(String slug, String holderModId) {
        super(TITLE + ": slug '" + slug + "' is already in use. Choose a different title.");
        this.slug = slug;
        this.holderModId = holderModId;
    }

    public String getSlug() {
        return slug;
    }

    /** Mod currently holding the reservation. Never sent to callers. */
    public String getHolderModId() {
        return holderModId;
    }
}

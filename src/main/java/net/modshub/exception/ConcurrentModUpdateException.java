package net.modshub.exception;

/**
 * Another write to the same mod won the race. Nothing from this request was applied.
 * RETRYABLE: Yes (re-read the mod and send the change again)
 */
public class ConcurrentModUpdateException extends ModsHubException {

    public static final String TITLE = "Concurrent Modification";

    private final String modId;

    public ConcurrentModUpdateException(String modId) {
        super("Mod '" + modId + "' was changed by another request. Reload it and try again.");
        this.modId = modId;
    }

    public String getModId() {
        return modId;
    }
}

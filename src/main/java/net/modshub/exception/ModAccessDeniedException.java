package net.modshub.exception;

/**
 * An authenticated caller was refused: either a mod they neither own nor administer,
 * or an action reserved for admins or approved uploaders.
 * Anonymous callers get {@link ModNotFoundException} instead.
 */
public class ModAccessDeniedException extends ModsHubException {

    private final String modId;

    public ModAccessDeniedException(String modId, String action) {
        super("Not allowed to " + action + " mod " + modId);
        this.modId = modId;
    }

    private ModAccessDeniedException(String message) {
        super(message);
        this.modId = null;
    }

    /** The caller is signed in but not on the approved uploader list. */
    public static ModAccessDeniedException uploadNotApproved(String userId) {
        return new ModAccessDeniedException("User " + userId + " is not approved to upload mods");
    }

    public static ModAccessDeniedException adminOnly(String action) {
        return new ModAccessDeniedException("Only admins may " + action);
    }

    /** Null when the denial is not about a particular mod. */
    public String getModId() {
        return modId;
    }
}

package net.modshub.exception;

/**
 * Identifier does not resolve for this caller: never existed, deleted, or not visible.
 */
public class ModNotFoundException extends ModsHubException {

    private final String identifier;

    public ModNotFoundException(String identifier) {
        super("Mod not found: " + identifier);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}

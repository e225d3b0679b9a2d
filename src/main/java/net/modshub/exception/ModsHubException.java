package net.modshub.exception;

/**
 * Base type for caller-actionable failures raised by the mod services.
 * RETRYABLE: No (the request itself must change)
 */
public abstract class ModsHubException extends RuntimeException {

    protected ModsHubException(String message) {
        super(message);
    }
}

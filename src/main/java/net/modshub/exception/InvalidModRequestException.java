package net.modshub.exception;

public class InvalidModRequestException extends ModsHubException {

    public InvalidModRequestException(String message) {
        super(message);
    }
}

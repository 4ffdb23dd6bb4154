package com.phillippitts.callpilot.exception;

/**
 * Thrown when provider data cannot be ranked because a required scoring field is missing or
 * out of its valid range. Fails the whole ranking call.
 */
public class InvalidProviderException extends CallPilotException {

    private final String providerId;
    private final String field;

    public InvalidProviderException(String providerId, String field, String reason) {
        super("Invalid provider " + providerId + ": " + field + " " + reason);
        this.providerId = providerId;
        this.field = field;
    }

    public String getProviderId() {
        return providerId;
    }

    public String getField() {
        return field;
    }
}

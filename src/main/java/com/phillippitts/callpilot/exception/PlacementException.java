package com.phillippitts.callpilot.exception;

/**
 * Thrown by the call-placing client when a call cannot be started. The dispatcher records it
 * on the affected session and never lets it escape a dispatch.
 */
public class PlacementException extends CallPilotException {

    private final Integer statusCode;

    public PlacementException(String message) {
        super(message);
        this.statusCode = null;
    }

    public PlacementException(String message, int statusCode) {
        super(message + " (status: " + statusCode + ")");
        this.statusCode = statusCode;
    }

    public PlacementException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    /** HTTP status returned by the collaborator, or {@code null} for transport failures. */
    public Integer getStatusCode() {
        return statusCode;
    }
}

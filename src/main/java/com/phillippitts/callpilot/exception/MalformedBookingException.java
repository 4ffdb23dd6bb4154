package com.phillippitts.callpilot.exception;

/**
 * Thrown when a confirmation event is missing a required field or carries an unparseable
 * date or time. The event is rejected without any state change.
 */
public class MalformedBookingException extends CallPilotException {

    private final String reason;

    public MalformedBookingException(String reason) {
        super("Malformed booking confirmation: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}

package com.phillippitts.callpilot.exception;

/**
 * Base exception for all CallPilot application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class CallPilotException extends RuntimeException {

    public CallPilotException(String message) {
        super(message);
    }

    public CallPilotException(String message, Throwable cause) {
        super(message, cause);
    }
}

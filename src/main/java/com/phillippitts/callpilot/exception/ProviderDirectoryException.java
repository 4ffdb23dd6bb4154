package com.phillippitts.callpilot.exception;

/**
 * Thrown when the provider directory cannot be read or parsed.
 */
public class ProviderDirectoryException extends CallPilotException {

    private final String location;

    public ProviderDirectoryException(String location, String reason) {
        super("Provider directory unavailable at " + location + ": " + reason);
        this.location = location;
    }

    public ProviderDirectoryException(String location, String reason, Throwable cause) {
        super("Provider directory unavailable at " + location + ": " + reason, cause);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}

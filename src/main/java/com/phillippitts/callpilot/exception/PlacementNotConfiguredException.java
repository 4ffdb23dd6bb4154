package com.phillippitts.callpilot.exception;

import java.util.List;

/**
 * Thrown when a dispatch is requested while required call-placing settings are missing.
 * This is a configuration error, not a per-session placement failure.
 */
public class PlacementNotConfiguredException extends CallPilotException {

    private final List<String> missingSettings;

    public PlacementNotConfiguredException(List<String> missingSettings) {
        super("Call placement not configured; missing: " + String.join(", ", missingSettings));
        this.missingSettings = List.copyOf(missingSettings);
    }

    public List<String> getMissingSettings() {
        return missingSettings;
    }
}

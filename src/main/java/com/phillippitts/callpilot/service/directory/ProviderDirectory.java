package com.phillippitts.callpilot.service.directory;

import com.phillippitts.callpilot.domain.Provider;

import java.util.List;

/**
 * Read-only source of the current provider snapshot.
 */
public interface ProviderDirectory {

    /**
     * Loads all providers. Called once per ranking request, so edits to the backing store are
     * picked up without a restart.
     *
     * @return providers in directory order
     * @throws com.phillippitts.callpilot.exception.ProviderDirectoryException if the directory
     *         cannot be read or parsed
     */
    List<Provider> loadProviders();
}

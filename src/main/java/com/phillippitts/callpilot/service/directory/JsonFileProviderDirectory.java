package com.phillippitts.callpilot.service.directory;

import com.phillippitts.callpilot.domain.Provider;
import com.phillippitts.callpilot.exception.ProviderDirectoryException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Provider directory backed by a JSON file, read fresh on every call.
 *
 * <p>The location is any Spring resource string ({@code classpath:providers.json},
 * {@code file:/etc/callpilot/providers.json}), configured by {@code callpilot.directory.location}.
 */
@Component
public class JsonFileProviderDirectory implements ProviderDirectory {

    private static final Logger LOG = LogManager.getLogger(JsonFileProviderDirectory.class);

    private final ResourceLoader resourceLoader;
    private final String location;

    public JsonFileProviderDirectory(ResourceLoader resourceLoader,
                                     @Value("${callpilot.directory.location:classpath:providers.json}")
                                     String location) {
        this.resourceLoader = Objects.requireNonNull(resourceLoader);
        this.location = Objects.requireNonNull(location);
    }

    @Override
    public List<Provider> loadProviders() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ProviderDirectoryException(location, "not found");
        }
        String json;
        try (InputStream in = resource.getInputStream()) {
            json = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ProviderDirectoryException(location, "unreadable", e);
        }
        try {
            List<Provider> providers = ProviderJsonParser.parse(json);
            LOG.debug("Loaded {} providers from {}", providers.size(), location);
            return providers;
        } catch (JSONException e) {
            LOG.warn("Provider directory at {} is invalid: {}", location, e.getMessage());
            throw new ProviderDirectoryException(location, "invalid JSON: " + e.getMessage(), e);
        }
    }
}

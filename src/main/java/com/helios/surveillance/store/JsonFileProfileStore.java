package com.helios.surveillance.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.helios.surveillance.model.Profile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads profiles from a JSON file holding an array of profile objects.
 * The file is re-read on every call so edits are picked up by the next reload.
 */
public class JsonFileProfileStore implements ProfileStore {
    private static final Logger logger = Logger.getLogger(JsonFileProfileStore.class.getName());

    private static final TypeReference<List<Profile>> PROFILE_LIST = new TypeReference<>() {
    };

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonFileProfileStore(Path path) {
        this.path = path;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public List<Profile> findActiveProfiles() throws ProfileStoreException {
        if (!Files.isReadable(path)) {
            throw new ProfileStoreException("Profile file not readable: " + path);
        }
        List<Profile> all;
        try (InputStream in = Files.newInputStream(path)) {
            all = objectMapper.readValue(in, PROFILE_LIST);
        } catch (IOException e) {
            throw new ProfileStoreException("Failed to read profiles from " + path, e);
        }

        List<Profile> active = new ArrayList<>(all.size());
        for (Profile profile : all) {
            if (profile != null && profile.active()) {
                active.add(profile);
            }
        }
        logger.fine(() -> "Read " + active.size() + " active profiles from " + path);
        return active;
    }

    public Path path() {
        return path;
    }
}

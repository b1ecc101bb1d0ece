package com.helios.surveillance.store;

import com.helios.surveillance.model.Profile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable profile store held in memory. Insertion order is preserved.
 */
public class InMemoryProfileStore implements ProfileStore {

    private final Map<String, Profile> profiles = new LinkedHashMap<>();
    private volatile boolean available = true;

    public InMemoryProfileStore() {
    }

    public InMemoryProfileStore(Collection<Profile> initial) {
        initial.forEach(this::put);
    }

    public synchronized void put(Profile profile) {
        profiles.put(profile.id(), profile);
    }

    public synchronized void remove(String profileId) {
        profiles.remove(profileId);
    }

    public synchronized void clear() {
        profiles.clear();
    }

    /**
     * While unavailable, {@link #findActiveProfiles()} throws.
     */
    public void setAvailable(boolean available) {
        this.available = available;
    }

    @Override
    public synchronized List<Profile> findActiveProfiles() throws ProfileStoreException {
        if (!available) {
            throw new ProfileStoreException("Profile store is unavailable");
        }
        List<Profile> active = new ArrayList<>(profiles.size());
        for (Profile profile : profiles.values()) {
            if (profile.active()) {
                active.add(profile);
            }
        }
        return active;
    }
}

package com.helios.surveillance.store;

import com.helios.surveillance.model.Profile;

import java.util.List;

/**
 * Source of surveillance profiles. The engine reads it on every reload and never writes to it.
 */
public interface ProfileStore {

    /**
     * @return all profiles with {@code is_active = true}, in a stable order
     * @throws ProfileStoreException if the store cannot be read
     */
    List<Profile> findActiveProfiles() throws ProfileStoreException;
}

package com.helios.surveillance.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A surveillance profile as owned by the profile store.
 * The filter tree is kept in its raw JSON shape; the engine compiles it on reload.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Profile(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("user_id") String userId,
        @JsonProperty("filter_tree") Map<String, Object> filterTree,
        @JsonProperty("is_active") boolean active,
        @JsonProperty("match_count") long matchCount,
        @JsonProperty("last_match_at") Instant lastMatchAt
) {

    public Profile {
        Objects.requireNonNull(id, "Profile id cannot be null");
    }

    public static Profile active(String id, String name, Map<String, Object> filterTree) {
        return new Profile(id, name, null, null, filterTree, true, 0L, null);
    }

    public Profile withActive(boolean active) {
        return new Profile(id, name, description, userId, filterTree, active, matchCount, lastMatchAt);
    }

    public Profile withMatches(long increment, Instant at) {
        return new Profile(id, name, description, userId, filterTree, active, matchCount + increment, at);
    }
}

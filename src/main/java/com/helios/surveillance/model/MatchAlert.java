package com.helios.surveillance.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Discrete match notification for the alerting collaborator.
 * Delivery is at-least-once; consumers deduplicate on {@link #dedupKey()}.
 */
public record MatchAlert(
        @JsonProperty("profile_id") String profileId,
        @JsonProperty("profile_name") String profileName,
        @JsonProperty("killmail_id") long killmailId,
        @JsonProperty("display_summary") DisplaySummary displaySummary,
        @JsonProperty("matched_at") Instant matchedAt
) {

    @JsonIgnore
    public String dedupKey() {
        return profileId + ":" + killmailId;
    }
}

package com.helios.surveillance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Persisted record of a single profile match, handed to the match store in bulk.
 */
public record MatchRecord(
        @JsonProperty("profile_id") String profileId,
        @JsonProperty("killmail_id") long killmailId,
        @JsonProperty("killmail_time") Instant killmailTime,
        @JsonProperty("display_summary") DisplaySummary displaySummary,
        @JsonProperty("total_value") double totalValue,
        @JsonProperty("created_at") Instant createdAt
) {
}

package com.helios.surveillance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

/**
 * Outcome of matching one killmail against one generation of profiles.
 *
 * @param generation id of the generation that produced the result, or -1 when no generation answered
 */
public record MatchResult(
        @JsonProperty("killmail_id") long killmailId,
        @JsonProperty("matched_profile_ids") Set<String> matchedProfileIds,
        @JsonProperty("generation") long generation,
        @JsonProperty("from_cache") boolean fromCache,
        @JsonProperty("candidate_count") int candidateCount,
        @JsonProperty("evaluation_time_nanos") long evaluationTimeNanos
) {

    public MatchResult {
        matchedProfileIds = Set.copyOf(matchedProfileIds);
    }

    public static MatchResult empty(long killmailId) {
        return new MatchResult(killmailId, Set.of(), -1L, false, 0, 0L);
    }
}

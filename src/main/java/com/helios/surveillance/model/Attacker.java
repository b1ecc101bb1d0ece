package com.helios.surveillance.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Attacker(
        @JsonProperty("character_id") Long characterId,
        @JsonProperty("corporation_id") Long corporationId,
        @JsonProperty("alliance_id") Long allianceId,
        @JsonProperty("ship_type_id") Long shipTypeId,
        @JsonProperty("final_blow") boolean finalBlow
) {
}

package com.helios.surveillance.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The losing side of a killmail. Any id or name may be absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Victim(
        @JsonProperty("character_id") Long characterId,
        @JsonProperty("corporation_id") Long corporationId,
        @JsonProperty("alliance_id") Long allianceId,
        @JsonProperty("ship_type_id") Long shipTypeId,
        @JsonProperty("character_name") String characterName,
        @JsonProperty("corporation_name") String corporationName,
        @JsonProperty("alliance_name") String allianceName,
        @JsonProperty("ship_name") String shipName
) {

    public static Victim ofShip(long shipTypeId) {
        return new Victim(null, null, null, shipTypeId, null, null, null, null);
    }
}

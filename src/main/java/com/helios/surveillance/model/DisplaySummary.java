package com.helios.surveillance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DisplaySummary(
        @JsonProperty("victim_name") String victimName,
        @JsonProperty("ship_name") String shipName,
        @JsonProperty("system_name") String systemName,
        @JsonProperty("total_value") double totalValue
) {

    public static DisplaySummary of(Killmail killmail) {
        Victim victim = killmail.victim();
        return new DisplaySummary(
                victim != null ? victim.characterName() : null,
                victim != null ? victim.shipName() : null,
                killmail.solarSystemName(),
                killmail.totalValue() != null ? killmail.totalValue() : 0.0);
    }
}

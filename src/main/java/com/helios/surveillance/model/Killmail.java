package com.helios.surveillance.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable projection of a killmail as consumed by the matching engine.
 * <p>
 * Derived fields ({@code kill_category}, {@code ship_category}) are not stored here;
 * they are computed on demand by {@link com.helios.surveillance.core.extraction.FieldExtractor}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Killmail(
        @JsonProperty("killmail_id") long killmailId,
        @JsonProperty("killmail_time") Instant killmailTime,
        @JsonProperty("solar_system_id") Long solarSystemId,
        @JsonProperty("solar_system_name") String solarSystemName,
        @JsonProperty("victim") Victim victim,
        @JsonProperty("attackers") List<Attacker> attackers,
        @JsonProperty("total_value") Double totalValue,
        @JsonProperty("ship_value") Double shipValue,
        @JsonProperty("fitted_value") Double fittedValue,
        @JsonProperty("attacker_count") Integer attackerCount,
        @JsonProperty("module_tags") List<String> moduleTags
) {

    public Killmail {
        attackers = attackers == null ? List.of() : List.copyOf(attackers);
        moduleTags = moduleTags == null ? List.of() : List.copyOf(moduleTags);
    }

    /**
     * Attacker count as reported, falling back to the size of the attacker list.
     */
    public int effectiveAttackerCount() {
        return attackerCount != null ? attackerCount : attackers.size();
    }

    public Attacker finalBlowAttacker() {
        for (Attacker attacker : attackers) {
            if (attacker.finalBlow()) {
                return attacker;
            }
        }
        return null;
    }

    public static Builder builder(long killmailId) {
        return new Builder(killmailId);
    }

    public static final class Builder {
        private final long killmailId;
        private Instant killmailTime = Instant.EPOCH;
        private Long solarSystemId;
        private String solarSystemName;
        private Victim victim;
        private final List<Attacker> attackers = new ArrayList<>();
        private Double totalValue;
        private Double shipValue;
        private Double fittedValue;
        private Integer attackerCount;
        private final List<String> moduleTags = new ArrayList<>();

        private Builder(long killmailId) {
            this.killmailId = killmailId;
        }

        public Builder killmailTime(Instant killmailTime) {
            this.killmailTime = Objects.requireNonNull(killmailTime);
            return this;
        }

        public Builder solarSystem(long id, String name) {
            this.solarSystemId = id;
            this.solarSystemName = name;
            return this;
        }

        public Builder solarSystemId(long id) {
            this.solarSystemId = id;
            return this;
        }

        public Builder victim(Victim victim) {
            this.victim = victim;
            return this;
        }

        public Builder attacker(Attacker attacker) {
            this.attackers.add(attacker);
            return this;
        }

        public Builder attackers(List<Attacker> attackers) {
            this.attackers.addAll(attackers);
            return this;
        }

        public Builder totalValue(double totalValue) {
            this.totalValue = totalValue;
            return this;
        }

        public Builder shipValue(double shipValue) {
            this.shipValue = shipValue;
            return this;
        }

        public Builder fittedValue(double fittedValue) {
            this.fittedValue = fittedValue;
            return this;
        }

        public Builder attackerCount(int attackerCount) {
            this.attackerCount = attackerCount;
            return this;
        }

        public Builder moduleTags(String... tags) {
            this.moduleTags.addAll(List.of(tags));
            return this;
        }

        public Killmail build() {
            return new Killmail(killmailId, killmailTime, solarSystemId, solarSystemName, victim,
                    attackers, totalValue, shipValue, fittedValue, attackerCount, moduleTags);
        }
    }
}

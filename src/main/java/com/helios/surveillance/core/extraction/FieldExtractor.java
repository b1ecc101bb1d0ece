package com.helios.surveillance.core.extraction;

import com.helios.surveillance.model.Attacker;
import com.helios.surveillance.model.Killmail;
import com.helios.surveillance.model.Victim;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Resolves named fields against a {@link Killmail}.
 * <p>
 * Field names are resolved to an accessor once, at compile time, so that evaluating a rule
 * is a single function call. Unknown fields resolve to an accessor that always yields
 * {@code null}; nothing here throws for a missing field or a missing victim.
 * <p>
 * Integral values are returned as {@link Long}, ISK values as {@link Double} (absent values
 * read as {@code 0.0}), tags and attacker ids as lists.
 */
public final class FieldExtractor {

    private static final Function<Killmail, Object> UNKNOWN_FIELD = killmail -> null;

    private static final Object2ObjectOpenHashMap<String, Function<Killmail, Object>> ACCESSORS =
            new Object2ObjectOpenHashMap<>();

    static {
        register(k -> k.killmailId(), "event_id", "killmail_id");
        register(k -> k.killmailTime() != null ? k.killmailTime().toString() : null, "killmail_time");
        register(k -> orZero(k.totalValue()), "total_value");
        register(k -> orZero(k.shipValue()), "ship_value");
        register(k -> orZero(k.fittedValue()), "fitted_value");
        register(k -> (long) k.effectiveAttackerCount(), "attacker_count");
        register(k -> {
            Attacker finalBlow = k.finalBlowAttacker();
            return finalBlow != null ? finalBlow.characterId() : null;
        }, "final_blow_character_id");
        register(k -> ShipClassifier.killCategory(k.effectiveAttackerCount()), "kill_category");
        register(Killmail::moduleTags, "module_tags", "noteworthy_modules");

        register(Killmail::solarSystemId, "system_id", "solar_system_id");
        register(Killmail::solarSystemName, "system_name", "solar_system_name");

        register(victim(Victim::characterId), "victim_character_id");
        register(victim(Victim::corporationId), "victim_corporation_id");
        register(victim(Victim::allianceId), "victim_alliance_id");
        register(victim(Victim::shipTypeId), "victim_ship_type_id");
        register(victim(Victim::characterName), "victim_character_name");
        register(victim(Victim::corporationName), "victim_corporation_name");
        register(victim(Victim::allianceName), "victim_alliance_name");
        register(victim(Victim::shipName), "victim_ship_name");
        register(k -> ShipClassifier.classify(k.victim() != null ? k.victim().shipTypeId() : null),
                "victim_ship_category");

        register(attackerIds(Attacker::characterId), "attacker_character_ids");
        register(attackerIds(Attacker::corporationId), "attacker_corporation_ids");
        register(attackerIds(Attacker::allianceId), "attacker_alliance_ids");
        register(attackerIds(Attacker::shipTypeId), "attacker_ship_type_ids");

        ACCESSORS.trim();
    }

    private FieldExtractor() {
    }

    /**
     * Returns the accessor for {@code field}; unknown fields get an accessor returning {@code null}.
     */
    public static Function<Killmail, Object> accessor(String field) {
        if (field == null) {
            return UNKNOWN_FIELD;
        }
        return ACCESSORS.getOrDefault(field, UNKNOWN_FIELD);
    }

    public static Object resolve(Killmail killmail, String field) {
        if (killmail == null) {
            return null;
        }
        return accessor(field).apply(killmail);
    }

    public static boolean isKnownField(String field) {
        return field != null && ACCESSORS.containsKey(field);
    }

    public static Set<String> knownFields() {
        return Collections.unmodifiableSet(ACCESSORS.keySet());
    }

    private static void register(Function<Killmail, Object> accessor, String... names) {
        for (String name : names) {
            ACCESSORS.put(name, accessor);
        }
    }

    private static Function<Killmail, Object> victim(Function<Victim, Object> getter) {
        return k -> k.victim() != null ? getter.apply(k.victim()) : null;
    }

    private static Function<Killmail, Object> attackerIds(Function<Attacker, Long> getter) {
        return k -> {
            List<Long> ids = new ArrayList<>(k.attackers().size());
            for (Attacker attacker : k.attackers()) {
                Long id = getter.apply(attacker);
                if (id != null) {
                    ids.add(id);
                }
            }
            return ids;
        };
    }

    private static Double orZero(Double value) {
        return value != null ? value : 0.0;
    }
}

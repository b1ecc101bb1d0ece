package com.helios.surveillance.core.cache;

import com.helios.surveillance.model.Attacker;
import com.helios.surveillance.model.Killmail;
import com.helios.surveillance.model.Victim;

import java.nio.charset.StandardCharsets;

/**
 * 64-bit FNV-1a fingerprint of a killmail plus the generation it is matched against.
 * <p>
 * Every field a filter can read goes into the hash, so two killmails with the same
 * fingerprint produce the same match set under the same generation (barring hash collisions).
 * Absent values hash differently from zero.
 */
public final class MatchFingerprint {

    private static final long OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long PRIME = 0x100000001b3L;
    private static final long ABSENT = 0x9e3779b97f4a7c15L;

    private long hash = OFFSET_BASIS;

    private MatchFingerprint() {
    }

    public static long of(Killmail killmail, long generation) {
        MatchFingerprint fp = new MatchFingerprint();
        fp.mix(generation);
        fp.mix(killmail.killmailId());
        fp.mix(killmail.killmailTime() != null ? killmail.killmailTime().toString() : null);
        fp.mix(killmail.solarSystemId());
        fp.mix(killmail.solarSystemName());
        fp.mix(killmail.totalValue());
        fp.mix(killmail.shipValue());
        fp.mix(killmail.fittedValue());
        fp.mix(killmail.effectiveAttackerCount());

        fp.mix(killmail.moduleTags().size());
        for (String tag : killmail.moduleTags()) {
            fp.mix(tag);
        }

        Victim victim = killmail.victim();
        if (victim == null) {
            fp.mix(ABSENT);
        } else {
            fp.mix(victim.characterId());
            fp.mix(victim.corporationId());
            fp.mix(victim.allianceId());
            fp.mix(victim.shipTypeId());
            fp.mix(victim.characterName());
            fp.mix(victim.corporationName());
            fp.mix(victim.allianceName());
            fp.mix(victim.shipName());
        }

        fp.mix(killmail.attackers().size());
        for (Attacker attacker : killmail.attackers()) {
            fp.mix(attacker.characterId());
            fp.mix(attacker.corporationId());
            fp.mix(attacker.allianceId());
            fp.mix(attacker.shipTypeId());
            fp.mix(attacker.finalBlow() ? 1L : 0L);
        }
        return fp.hash;
    }

    private void mix(long value) {
        for (int i = 0; i < 8; i++) {
            hash ^= (value >>> (i * 8)) & 0xff;
            hash *= PRIME;
        }
    }

    private void mix(Long value) {
        mix(value != null ? value : ABSENT);
    }

    private void mix(Double value) {
        mix(value != null ? Double.doubleToLongBits(value) : ABSENT);
    }

    private void mix(String value) {
        if (value == null) {
            mix(ABSENT);
            return;
        }
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        mix((long) bytes.length);
        for (byte b : bytes) {
            hash ^= b & 0xff;
            hash *= PRIME;
        }
    }
}

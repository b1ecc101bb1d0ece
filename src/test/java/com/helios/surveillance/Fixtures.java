package com.helios.surveillance;

import com.helios.surveillance.model.Attacker;
import com.helios.surveillance.model.Profile;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for filter trees and profiles in their raw JSON shape.
 */
public final class Fixtures {

    public static final long JITA = 30000142L;
    public static final long PERIMETER = 30000144L;

    private Fixtures() {
    }

    public static Map<String, Object> rule(String field, String operator, Object value) {
        Map<String, Object> rule = new LinkedHashMap<>();
        rule.put("field", field);
        rule.put("operator", operator);
        rule.put("value", value);
        return rule;
    }

    @SafeVarargs
    public static Map<String, Object> and(Map<String, Object>... rules) {
        return group("and", rules);
    }

    @SafeVarargs
    public static Map<String, Object> or(Map<String, Object>... rules) {
        return group("or", rules);
    }

    @SafeVarargs
    private static Map<String, Object> group(String condition, Map<String, Object>... rules) {
        Map<String, Object> group = new LinkedHashMap<>();
        group.put("condition", condition);
        group.put("rules", Arrays.asList(rules));
        return group;
    }

    public static Profile profile(String id, Map<String, Object> filterTree) {
        return Profile.active(id, "Profile " + id, filterTree);
    }

    public static Attacker attacker(long characterId, boolean finalBlow) {
        return new Attacker(characterId, 1000L + characterId, null, 587L, finalBlow);
    }

    public static List<Long> ids(long... ids) {
        return Arrays.stream(ids).boxed().toList();
    }
}

package com.helios.surveillance.core.extraction;

/**
 * Coarse ship classification from ship type id ranges.
 * <p>
 * This is a heuristic, not a static-data lookup. Ranges are checked in order and the first
 * hit wins, so overlapping ranges (e.g. 620..650) resolve to the earlier class.
 */
public final class ShipClassifier {

    public static final String UNKNOWN = "unknown";
    public static final String OTHER = "other";

    private static final long[][] RANGES = {
            {580, 650},
            {16_000, 16_100},
            {620, 650},
            {416, 456},
            {640, 680},
            {19_000, 24_000},
    };
    private static final String[] CLASSES = {
            "frigate",
            "destroyer",
            "cruiser",
            "battlecruiser",
            "battleship",
            "capital",
    };

    private ShipClassifier() {
    }

    public static String classify(Long shipTypeId) {
        if (shipTypeId == null) {
            return UNKNOWN;
        }
        long id = shipTypeId;
        for (int i = 0; i < RANGES.length; i++) {
            if (id >= RANGES[i][0] && id <= RANGES[i][1]) {
                return CLASSES[i];
            }
        }
        return OTHER;
    }

    /**
     * solo (1), small_gang (up to 5), fleet (up to 20), large_fleet (above 20).
     * Zero attackers fall into small_gang.
     */
    public static String killCategory(int attackerCount) {
        if (attackerCount == 1) {
            return "solo";
        } else if (attackerCount <= 5) {
            return "small_gang";
        } else if (attackerCount <= 20) {
            return "fleet";
        }
        return "large_fleet";
    }
}

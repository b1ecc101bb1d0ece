package com.helios.surveillance.core.index;

/**
 * The four inverted indexes. Each kind owns one bit so a profile's indexed kinds fit in an int mask.
 */
public enum IndexKind {
    TAG("tags"),
    SYSTEM("systems"),
    SHIP_TYPE("ship_types"),
    ISK("isk_thresholds");

    private final String statsName;

    IndexKind(String statsName) {
        this.statsName = statsName;
    }

    public int bit() {
        return 1 << ordinal();
    }

    public String statsName() {
        return statsName;
    }

    public boolean in(int mask) {
        return (mask & bit()) != 0;
    }
}

package com.sendanywhere.signal;

/**
 * A pairing code starts out waiting and becomes paired the first time both
 * roles are connected. It never goes back.
 */
public enum PairStatus {
    WAITING,
    PAIRED;

    public String wireName() {
        return name().toLowerCase();
    }

    public static PairStatus fromWireName(String name) {
        for (PairStatus s : values()) {
            if (s.wireName().equals(name)) return s;
        }
        throw new IllegalArgumentException("Unknown pair status: " + name);
    }
}

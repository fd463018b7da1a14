package com.sendanywhere.signal;

/**
 * The two sides of a pairing room.
 */
public enum Role {
    SENDER,
    RECEIVER;

    public String wireName() {
        return name().toLowerCase();
    }

    public Role opposite() {
        return this == SENDER ? RECEIVER : SENDER;
    }

    /** @return the role, or null if {@code name} is not one */
    public static Role fromWireName(String name) {
        if (name == null) return null;
        for (Role r : values()) {
            if (r.wireName().equals(name)) return r;
        }
        return null;
    }
}

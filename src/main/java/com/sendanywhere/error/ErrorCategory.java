package com.sendanywhere.error;

/**
 * Machine-checkable failure categories shared by every component and by the
 * structured error bodies the servers return.
 */
public enum ErrorCategory {
    NOT_FOUND,
    INVALID_INPUT,
    IO_FAILURE,
    MANIFEST_CORRUPT,
    HASH_MISMATCH,
    NETWORK_FAILURE,
    EXHAUSTED;

    /** Wire name, e.g. {@code not_found}. */
    public String wireName() {
        return name().toLowerCase();
    }

    public static ErrorCategory fromWireName(String name) {
        if (name == null) {
            return null;
        }
        for (ErrorCategory c : values()) {
            if (c.wireName().equalsIgnoreCase(name)) {
                return c;
            }
        }
        return null;
    }
}

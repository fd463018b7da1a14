package com.sendanywhere.error;

/**
 * Why something was not found. The distinction matters to a resuming client:
 * an unknown transfer means give up, a pending chunk means wait and retry.
 */
public enum NotFoundReason {
    TRANSFER_UNKNOWN,
    CHUNK_PENDING,
    FILE_UNKNOWN,
    PAIR_CODE_UNKNOWN;

    public String wireName() {
        return name().toLowerCase();
    }

    public static NotFoundReason fromWireName(String name) {
        if (name == null) {
            return null;
        }
        for (NotFoundReason r : values()) {
            if (r.wireName().equalsIgnoreCase(name)) {
                return r;
            }
        }
        return null;
    }
}

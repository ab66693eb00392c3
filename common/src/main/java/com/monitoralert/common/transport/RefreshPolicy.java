package com.monitoralert.common.transport;

import java.util.Locale;

/**
 * When written alerts become visible to readers. Encoded on the wire as a single byte.
 */
public enum RefreshPolicy {
    NONE((byte) 0, "false"),
    IMMEDIATE((byte) 1, "true"),
    WAIT_UNTIL((byte) 2, "wait_for");

    private final byte id;
    private final String parameterValue;

    RefreshPolicy(byte id, String parameterValue) {
        this.id = id;
        this.parameterValue = parameterValue;
    }

    public byte id() {
        return id;
    }

    public String parameterValue() {
        return parameterValue;
    }

    public static RefreshPolicy fromId(byte id) {
        for (var policy : values()) {
            if (policy.id == id) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown refresh policy id: " + id);
    }

    /**
     * Parses a {@code refresh} request parameter. An empty value means IMMEDIATE and an
     * absent one means NONE.
     */
    public static RefreshPolicy parse(String value) {
        if (value == null) {
            return NONE;
        }
        if (value.isEmpty()) {
            return IMMEDIATE;
        }
        for (var policy : values()) {
            if (policy.parameterValue.equals(value) || policy.name().equals(value.toUpperCase(Locale.ROOT))) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown refresh policy: " + value);
    }
}

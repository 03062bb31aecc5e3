package com.raid.roundsync.core.model;

import java.util.Arrays;

/**
 * How this device came to hold a round's network identity.
 */
public enum JoinedVia {

    /** Solo or same-device round created here. */
    CREATED("created"),

    /** Multi-device round hosted by this device. */
    CREATED_MULTI("created_multi"),

    /** Round created elsewhere and joined through an invite. */
    JOINED("joined");

    private final String value;

    JoinedVia(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static JoinedVia fromValue(String value) {
        return Arrays.stream(values())
                .filter(v -> v.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown joined_via: " + value));
    }

    public static JoinedVia forCreatedRound(ScoringMode mode) {
        return mode == ScoringMode.MULTI_DEVICE ? CREATED_MULTI : CREATED;
    }
}

package com.raid.roundsync.core.model;

import java.util.Locale;

public enum ScorecardStatus {
    IN_PROGRESS,
    COMPLETED;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ScorecardStatus fromWire(String value) {
        if (value == null) {
            return IN_PROGRESS;
        }
        return "completed".equalsIgnoreCase(value.trim()) ? COMPLETED : IN_PROGRESS;
    }
}

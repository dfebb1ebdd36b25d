package com.diskwatcher.app.database;

import java.util.Locale;

public enum JobType {
    SCAN,
    WATCH;

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobType fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

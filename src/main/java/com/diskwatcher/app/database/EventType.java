package com.diskwatcher.app.database;

import java.util.Locale;

public enum EventType {
    CREATED,
    MODIFIED,
    DELETED,
    DISCOVERED;

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EventType fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

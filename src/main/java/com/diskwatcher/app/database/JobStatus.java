package com.diskwatcher.app.database;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    STOPPED;

    public static final Set<JobStatus> ACTIVE = EnumSet.of(PENDING, RUNNING);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isTerminal() {
        return !isActive();
    }

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobStatus fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

package com.diskwatcher.app.database;

import java.time.Instant;
import java.util.Objects;

/** One observed change, as handed to the store. */
public record EventRecord(
        Instant timestamp,
        EventType type,
        String path,
        String directory,
        String volumeId,
        Long processId
) {
    public EventRecord {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(volumeId, "volumeId");
    }

    public static EventRecord of(Instant timestamp, EventType type, String path, String directory, String volumeId) {
        return new EventRecord(timestamp, type, path, directory, volumeId, null);
    }
}

package com.diskwatcher.app.database;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;

/**
 * Latest known metadata of a file, stat'ed by the caller before it reaches the store.
 */
public record FileRecord(
        String volumeId,
        String path,
        String directory,
        Long sizeBytes,
        Instant modifiedTime,
        Instant createdTime
) {
    public static FileRecord fromAttributes(String volumeId, Path file, BasicFileAttributes attrs) {
        Path parent = file.getParent();
        return new FileRecord(
                volumeId,
                file.toString(),
                parent == null ? file.toString() : parent.toString(),
                attrs.size(),
                attrs.lastModifiedTime().toInstant(),
                attrs.creationTime() == null ? null : attrs.creationTime().toInstant()
        );
    }

    /** Stats {@code file} without following links. Throws if it vanished in the meantime. */
    public static FileRecord stat(String volumeId, Path file) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        return fromAttributes(volumeId, file, attrs);
    }
}

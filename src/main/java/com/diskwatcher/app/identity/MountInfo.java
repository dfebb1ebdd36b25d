package com.diskwatcher.app.identity;

import java.nio.file.Path;

/**
 * What the mount table knows about the filesystem backing a directory.
 * Any field except {@code mountPoint} may be null.
 */
public record MountInfo(
        Path mountPoint,
        String device,
        String fsType,
        String uuid,
        String label,
        String volumeId
) {}

package com.diskwatcher.app.identity;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

/**
 * Result of resolving a directory: the stable id plus the probe snapshot it was derived from.
 */
public record VolumeIdentity(
        String volumeId,
        IdentitySource source,
        Path directory,
        MountInfo mount,
        BlockDeviceInfo block,
        Map<String, String> rawPayload,
        Instant resolvedAt
) {
    public VolumeIdentity {
        rawPayload = rawPayload == null ? Map.of() : Map.copyOf(rawPayload);
    }

    public String device() {
        return mount == null ? null : mount.device();
    }
}

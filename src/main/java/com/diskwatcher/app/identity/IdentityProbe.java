package com.diskwatcher.app.identity;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Capability used by {@link IdentityResolver}. Implementations may be missing tooling on the
 * host; they report that as an empty result rather than an exception where they can.
 */
public interface IdentityProbe {

    Optional<MountInfo> probeMount(Path directory);

    Optional<BlockDeviceInfo> probeBlockDevice(String device);
}

package com.diskwatcher.app.identity;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a directory to a stable volume id. Never throws for probe trouble: an unavailable
 * probe just pushes resolution further down the fallback chain in {@link VolumeIdComposer}.
 */
public final class IdentityResolver {

    private static final Logger logger = LoggerFactory.getLogger(IdentityResolver.class);

    private final IdentityProbe probe;
    private final Clock clock;

    public IdentityResolver(IdentityProbe probe) {
        this(probe, Clock.systemUTC());
    }

    public IdentityResolver(IdentityProbe probe, Clock clock) {
        this.probe = probe;
        this.clock = clock;
    }

    public VolumeIdentity resolve(Path directory) {
        Path dir = directory.toAbsolutePath().normalize();

        MountInfo mount = safely("mount", dir, () -> probe.probeMount(dir)).orElse(null);
        BlockDeviceInfo block = null;
        if (mount != null && mount.device() != null) {
            String device = mount.device();
            block = safely("block", dir, () -> probe.probeBlockDevice(device)).orElse(null);
        }

        String fsUuid = block != null && block.uuid() != null ? block.uuid() : (mount == null ? null : mount.uuid());
        VolumeIdComposer.Composition id = VolumeIdComposer.compose(new VolumeIdComposer.Signals(
                fsUuid,
                block == null ? null : block.partuuid(),
                block == null ? null : block.serial(),
                block == null ? null : block.model(),
                block == null ? null : block.vendor(),
                block == null ? null : block.fsver(),
                mount == null ? null : mount.device(),
                dir
        ));

        logger.debug("resolved dir={} volume={} source={}", dir, id.volumeId(), id.source());
        Map<String, String> raw = block == null ? Map.of() : block.raw();
        return new VolumeIdentity(id.volumeId(), id.source(), dir, mount, block, raw, clock.instant());
    }

    private static <T> Optional<T> safely(String what, Path dir, Supplier<Optional<T>> call) {
        try {
            Optional<T> out = call.get();
            return out == null ? Optional.empty() : out;
        } catch (RuntimeException e) {
            logger.debug("{} probe unavailable dir={} error={}", what, dir, e.toString());
            return Optional.empty();
        }
    }
}

package com.diskwatcher.app.identity;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class IdentityProbes {

    private static final Logger logger = LoggerFactory.getLogger(IdentityProbes.class);

    private IdentityProbes() {}

    /** util-linux first with OSHI behind it on Linux; OSHI alone elsewhere. */
    public static IdentityProbe platformDefault() {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ROOT);
        if (os.contains("linux")) {
            return fallback(new LinuxIdentityProbe(CommandRunner.process()), new OshiIdentityProbe());
        }
        return new OshiIdentityProbe();
    }

    public static IdentityProbe fallback(IdentityProbe primary, IdentityProbe secondary) {
        return new IdentityProbe() {
            @Override
            public Optional<MountInfo> probeMount(Path directory) {
                return firstPresent(() -> primary.probeMount(directory), () -> secondary.probeMount(directory));
            }

            @Override
            public Optional<BlockDeviceInfo> probeBlockDevice(String device) {
                return firstPresent(() -> primary.probeBlockDevice(device), () -> secondary.probeBlockDevice(device));
            }
        };
    }

    private static <T> Optional<T> firstPresent(Supplier<Optional<T>> first, Supplier<Optional<T>> second) {
        try {
            Optional<T> v = first.get();
            if (v.isPresent()) return v;
        } catch (RuntimeException e) {
            logger.debug("primary probe failed error={}", e.toString());
        }
        return second.get();
    }
}

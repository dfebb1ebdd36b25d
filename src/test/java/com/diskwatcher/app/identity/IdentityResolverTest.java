package com.diskwatcher.app.identity;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class IdentityResolverTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tmp;

    private static IdentityProbe probe(MountInfo mount, BlockDeviceInfo block) {
        return new IdentityProbe() {
            @Override
            public Optional<MountInfo> probeMount(Path directory) {
                return Optional.ofNullable(mount);
            }

            @Override
            public Optional<BlockDeviceInfo> probeBlockDevice(String device) {
                return Optional.ofNullable(block);
            }
        };
    }

    private static BlockDeviceInfo block(String uuid, String partuuid, String serial, String model) {
        return new BlockDeviceInfo("sdb1", "/dev/sdb1", uuid, null, model, serial, null, "1T", null,
                "gpt", "pt-1", null, partuuid, null, null, "8:17", Map.of("NAME", "sdb1"));
    }

    @Test
    void noMountAndNoToolingFallsBackToDirectory() {
        IdentityResolver resolver = new IdentityResolver(probe(null, null), CLOCK);

        VolumeIdentity id = resolver.resolve(tmp);

        assertEquals(tmp.toAbsolutePath().normalize().toString(), id.volumeId());
        assertEquals(IdentitySource.DIRECTORY, id.source());
        assertNull(id.mount());
        assertNull(id.block());
        assertEquals(CLOCK.instant(), id.resolvedAt());
    }

    @Test
    void throwingProbeIsTreatedAsUnavailable() {
        IdentityProbe broken = new IdentityProbe() {
            @Override
            public Optional<MountInfo> probeMount(Path directory) {
                throw new IllegalStateException("findmnt exploded");
            }

            @Override
            public Optional<BlockDeviceInfo> probeBlockDevice(String device) {
                throw new IllegalStateException("lsblk exploded");
            }
        };

        VolumeIdentity id = assertDoesNotThrow(() -> new IdentityResolver(broken, CLOCK).resolve(tmp));
        assertEquals(IdentitySource.DIRECTORY, id.source());
    }

    @Test
    void blockUuidPreferredOverMountUuid() {
        MountInfo mount = new MountInfo(Path.of("/mnt/a"), "/dev/sdb1", "ext4", "mount-uuid", "ARCHIVE", null);
        IdentityResolver resolver = new IdentityResolver(probe(mount, block("block-uuid", "p-1", "S", "M")), CLOCK);

        VolumeIdentity id = resolver.resolve(Path.of("/mnt/a/sub"));

        assertEquals("block-uuid", id.volumeId());
        assertEquals(IdentitySource.FS_UUID, id.source());
        assertEquals("/dev/sdb1", id.device());
        assertEquals(Map.of("NAME", "sdb1"), id.rawPayload());
    }

    @Test
    void sameUuidOnDifferentMountPointGivesSameId() {
        MountInfo first = new MountInfo(Path.of("/mnt/a"), "/dev/sdb1", "ext4", "UUID-1", null, null);
        MountInfo second = new MountInfo(Path.of("/media/usb"), "/dev/sdc1", "ext4", "UUID-1", null, null);

        String a = new IdentityResolver(probe(first, null), CLOCK).resolve(Path.of("/mnt/a")).volumeId();
        String b = new IdentityResolver(probe(second, null), CLOCK).resolve(Path.of("/media/usb")).volumeId();

        assertEquals(a, b, "Volume id must follow the filesystem, not the mount point");
    }

    @Test
    void hardwareTupleWhenNoUuids() {
        MountInfo mount = new MountInfo(Path.of("/mnt/a"), "/dev/sdb1", "vfat", null, null, null);
        IdentityResolver resolver = new IdentityResolver(probe(mount, block(null, null, "SER-7", "Cruzer")), CLOCK);

        VolumeIdentity id = resolver.resolve(Path.of("/mnt/a"));

        assertEquals("serial=SER-7|model=Cruzer", id.volumeId());
        assertEquals(IdentitySource.HARDWARE, id.source());
    }

    @Test
    void deviceWhenBlockProbeHasNothing() {
        MountInfo mount = new MountInfo(Path.of("/mnt/nfs"), "server:/export", "nfs4", null, null, null);
        VolumeIdentity id = new IdentityResolver(probe(mount, null), CLOCK).resolve(Path.of("/mnt/nfs"));

        assertEquals("server:/export", id.volumeId());
        assertEquals(IdentitySource.DEVICE, id.source());
    }
}

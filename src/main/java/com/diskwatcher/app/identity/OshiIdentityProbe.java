package com.diskwatcher.app.identity;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import oshi.SystemInfo;
import oshi.hardware.HWDiskStore;
import oshi.hardware.HWPartition;
import oshi.software.os.OSFileStore;

/**
 * Cross-platform probe over OSHI file stores and disk stores. Used where util-linux is absent.
 */
public final class OshiIdentityProbe implements IdentityProbe {

    private static final Logger logger = LoggerFactory.getLogger(OshiIdentityProbe.class);

    private static final String OSHI_UNKNOWN = "unknown";

    private volatile SystemInfo systemInfo;

    @Override
    public Optional<MountInfo> probeMount(Path directory) {
        Path target = directory.toAbsolutePath().normalize();
        OSFileStore best = null;
        int bestLen = -1;

        for (OSFileStore store : systemInfo().getOperatingSystem().getFileSystem().getFileStores()) {
            String mount = clean(store.getMount());
            if (mount == null) continue;
            Path mountPath;
            try {
                mountPath = Path.of(mount);
            } catch (RuntimeException e) {
                continue;
            }
            if (target.startsWith(mountPath) && mount.length() > bestLen) {
                best = store;
                bestLen = mount.length();
            }
        }

        if (best == null) {
            logger.debug("no OSHI file store covers dir={}", target);
            return Optional.empty();
        }
        return Optional.of(new MountInfo(
                Path.of(best.getMount()),
                clean(best.getVolume()),
                clean(best.getType()),
                clean(best.getUUID()),
                clean(best.getLabel()),
                clean(best.getLogicalVolume())
        ));
    }

    @Override
    public Optional<BlockDeviceInfo> probeBlockDevice(String device) {
        if (device == null || device.isBlank()) return Optional.empty();

        List<HWDiskStore> disks = systemInfo().getHardware().getDiskStores();
        for (HWDiskStore disk : disks) {
            for (HWPartition part : disk.getPartitions()) {
                if (!matches(device, part)) continue;

                Map<String, String> raw = new LinkedHashMap<>();
                putIfPresent(raw, "NAME", part.getIdentification());
                putIfPresent(raw, "PATH", device);
                putIfPresent(raw, "PKNAME", disk.getName());
                putIfPresent(raw, "PARTUUID", part.getUuid());
                putIfPresent(raw, "PARTTYPENAME", part.getType());
                putIfPresent(raw, "MODEL", disk.getModel());
                putIfPresent(raw, "SERIAL", disk.getSerial());
                putIfPresent(raw, "SIZE", String.valueOf(part.getSize()));
                putIfPresent(raw, "MAJ_MIN", part.getMajor() + ":" + part.getMinor());
                return Optional.of(BlockDeviceInfo.fromPairs(raw));
            }
        }
        return Optional.empty();
    }

    private static boolean matches(String device, HWPartition part) {
        String id = clean(part.getIdentification());
        if (id == null) return false;
        return device.equals(id) || device.equals("/dev/" + id) || device.endsWith("/" + id);
    }

    private SystemInfo systemInfo() {
        SystemInfo si = systemInfo;
        if (si == null) {
            synchronized (this) {
                si = systemInfo;
                if (si == null) {
                    si = new SystemInfo();
                    systemInfo = si;
                }
            }
        }
        return si;
    }

    private static void putIfPresent(Map<String, String> out, String key, String value) {
        String v = clean(value);
        if (v != null) out.put(key, v);
    }

    private static String clean(String v) {
        String t = BlockDeviceInfo.clean(v);
        return (t == null || OSHI_UNKNOWN.equalsIgnoreCase(t)) ? null : t;
    }
}
